package com.rico.insurance.risk.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Portfolio-wide insurance fraud summary.
 */
@Value
@Builder
public class InsuranceStatistics {
    long carrierCount;
    /** Carriers with at least one gap over 30 days. */
    int carriersWithGaps;
    double averageGapDays;
    int shoppingCarriers;
    int underinsuredCarriers;
    /** Carriers scoring above 50. */
    int highRiskCarriers;
    List<CarrierRiskScore> topRisks;
}
