package com.rico.insurance.client;

import java.util.List;

/**
 * Source of raw insurance filings. "Not found" is an empty list, never an error.
 */
public interface InsuranceDataProvider {

    /**
     * All insurance filings for the carrier, current and historical.
     *
     * @throws com.rico.insurance.exception.ExternalProviderException when the provider stays unavailable after retries
     */
    List<RawInsuranceRecord> fetchInsuranceHistory(Long usdot);

    ComplianceCheck fetchComplianceCheck(Long usdot);

    /** Name used in logs and provenance fields. */
    String getSourceName();
}
