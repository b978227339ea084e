package com.rico.insurance.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Insurance filing as returned by the SearchCarriers v2 insurances endpoint. Values are kept as the
 * provider sends them; mapping and validation happen in the enrichment layer.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawInsuranceRecord {

    private static final BigDecimal THOUSAND = new BigDecimal("1000");

    @JsonProperty("id")
    String id;

    @JsonProperty("name_company")
    String nameCompany;

    /** Coverage in thousands of dollars, e.g. "00750". */
    @JsonProperty("max_cov_amount")
    String maxCovAmount;

    @JsonProperty("policy_no")
    String policyNo;

    /** Filing form code: 34, 84, 91, 91X, 32. */
    @JsonProperty("ins_form_code")
    String insFormCode;

    @JsonProperty("effective_date")
    String effectiveDate;

    @JsonProperty("expiration_date")
    String expirationDate;

    @JsonProperty("cancellation_date")
    String cancellationDate;

    @JsonProperty("cancellation_reason")
    String cancellationReason;

    @JsonProperty("filing_status")
    String filingStatus;

    @JsonProperty("provider_id")
    String providerId;

    @JsonProperty("cargo_coverage")
    String cargoCoverage;

    /**
     * Coverage in dollars ({@code max_cov_amount} x 1000); zero when blank.
     *
     * @throws NumberFormatException when the amount is not numeric
     */
    public BigDecimal coverageDollars() {
        if (maxCovAmount == null || maxCovAmount.isBlank()) {
            return BigDecimal.ZERO;
        }
        return new BigDecimal(maxCovAmount.trim()).multiply(THOUSAND);
    }
}
