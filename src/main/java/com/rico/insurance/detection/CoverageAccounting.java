package com.rico.insurance.detection;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Covered versus uncovered days of a carrier in a half-open window; coveredDays + uncoveredDays == windowDays.
 */
@Value
@Builder
public class CoverageAccounting {
    Long carrierUsdot;
    LocalDate windowStart;
    LocalDate windowEnd;
    int windowDays;
    int coveredDays;
    int uncoveredDays;
}
