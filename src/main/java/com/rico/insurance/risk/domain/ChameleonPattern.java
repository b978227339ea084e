package com.rico.insurance.risk.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Two distinct carriers sharing at least one officer and at least one insurance provider. Flags a candidate
 * for manual review. {@code carrier1Usdot} is always the lower USDOT, so each pair appears once.
 */
@Value
@Builder
public class ChameleonPattern {
    Long carrier1Usdot;
    String carrier1Name;
    Long carrier2Usdot;
    String carrier2Name;
    /** First shared officer by name. */
    String sharedOfficer;
    List<String> sharedOfficers;
    int sharedProviderCount;
    List<String> sharedProviders;
    Integer carrier1Violations;
    Integer carrier2Violations;
}
