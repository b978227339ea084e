package com.rico.insurance.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Set;

/**
 * A discrete transition in a carrier's insurance history. Written once at enrichment time.
 */
@Value
@Builder(toBuilder = true)
public class InsuranceEvent {

    String eventId;
    Long carrierUsdot;
    InsuranceEventType eventType;
    LocalDate eventDate;

    String previousProvider;
    String newProvider;
    BigDecimal previousCoverage;
    BigDecimal newCoverage;
    /** newCoverage - previousCoverage when both are known. */
    BigDecimal coverageChange;
    String previousPolicyId;
    String newPolicyId;

    /** Gap immediately preceding this event; null when undefined. */
    Integer daysWithoutCoverage;

    boolean complianceViolation;
    String violationReason;

    boolean suspicious;
    @Singular
    Set<FraudIndicator> fraudIndicators;

    String reason;
    String notes;
    String dataSource;
    Instant createdAt;
}
