package com.rico.insurance.risk.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Provider churn in one carrier's own policy history.
 */
@Value
@Builder
public class ProviderShoppingAnalysis {
    boolean shopping;
    int providerCount;
    List<String> providers;
    int policyCount;
    int monthsWindow;
    /** min(providerCount / 3, 1). */
    double riskScore;
}
