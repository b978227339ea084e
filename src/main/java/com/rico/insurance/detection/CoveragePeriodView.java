package com.rico.insurance.detection;

import com.rico.insurance.domain.CoverageStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Coverage period joined with the policy's provider and amount, for timelines.
 */
@Value
@Builder
public class CoveragePeriodView {
    String policyId;
    String providerName;
    BigDecimal coverageAmount;
    LocalDate fromDate;
    LocalDate toDate;
    CoverageStatus status;
    int durationDays;
}
