package com.rico.insurance.detection;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Two coverage periods of the same carrier that are in force at the same time. {@code firstPolicyId} is the
 * one that started first.
 */
@Value
@Builder
public class CoverageOverlap {
    Long carrierUsdot;
    String firstPolicyId;
    String secondPolicyId;
    LocalDate overlapStart;
    LocalDate overlapEnd;
    int overlapDays;
}
