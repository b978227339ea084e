package com.rico.insurance.detection;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * A period without coverage between two adjacent policies of one carrier.
 */
@Value
@Builder
public class CoverageGap {
    Long carrierUsdot;
    String fromPolicyId;
    String toPolicyId;
    /** End of the earlier policy. */
    LocalDate gapStart;
    /** Start of the later policy. */
    LocalDate gapEnd;
    int gapDays;
    String fromProvider;
    String toProvider;
}
