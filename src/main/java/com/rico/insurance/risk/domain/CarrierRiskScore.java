package com.rico.insurance.risk.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Explainable 0-100 carrier risk score: the total is the sum of the listed factors.
 */
@Value
@Builder
public class CarrierRiskScore {
    Long carrierUsdot;
    String carrierName;
    double score;
    List<RiskFactor> factors;
    long policyCount;
    long providerCount;
    long cancellationCount;
    int maxGapDays;
    boolean complianceViolation;
}
