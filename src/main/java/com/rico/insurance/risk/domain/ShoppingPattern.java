package com.rico.insurance.risk.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Carrier that used many distinct providers in the trailing window.
 */
@Value
@Builder
public class ShoppingPattern {
    Long carrierUsdot;
    String carrierName;
    int providerCount;
    List<String> providers;
    int policyCount;
    LocalDate firstPolicyDate;
    LocalDate lastPolicyDate;
    int monthsWindow;
    /** providerCount / monthsWindow. */
    double riskScore;
}
