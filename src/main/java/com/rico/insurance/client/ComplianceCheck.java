package com.rico.insurance.client;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Insurance compliance summary for one carrier.
 */
@Value
@Builder
public class ComplianceCheck {
    Long carrierUsdot;
    boolean compliant;
    List<ComplianceViolation> violations;
    /** Largest coverage among active filings; null when none is active. */
    BigDecimal currentCoverage;
    BigDecimal requiredMinimum;
    Instant checkedAt;
}
