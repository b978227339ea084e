package com.rico.insurance.detection;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CarrierGapSummary {
    Long carrierUsdot;
    String carrierName;
    int gapCount;
    int maxGapDays;
    int totalGapDays;
    List<CoverageGap> gaps;
}
