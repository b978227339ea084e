package com.rico.insurance.domain;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Cargo classes with their federal minimum liability coverage.
 */
public enum CargoType {
    GENERAL_FREIGHT(new BigDecimal("750000")),
    HOUSEHOLD_GOODS(new BigDecimal("750000")),
    HAZMAT(new BigDecimal("5000000")),
    PASSENGERS_15_PLUS(new BigDecimal("5000000")),
    PASSENGERS_UNDER_15(new BigDecimal("1500000")),
    OIL(new BigDecimal("1000000"));

    /** Applied when the cargo type is unknown. */
    public static final BigDecimal DEFAULT_MINIMUM = new BigDecimal("750000");

    private final BigDecimal minimumCoverage;

    CargoType(BigDecimal minimumCoverage) {
        this.minimumCoverage = minimumCoverage;
    }

    public BigDecimal getMinimumCoverage() {
        return minimumCoverage;
    }

    /**
     * Minimum coverage for a free-form cargo type name; unknown or blank names get {@link #DEFAULT_MINIMUM}.
     */
    public static BigDecimal minimumFor(String cargoType) {
        if (cargoType == null || cargoType.isBlank()) {
            return DEFAULT_MINIMUM;
        }
        try {
            return valueOf(cargoType.trim().toUpperCase(Locale.ROOT)).minimumCoverage;
        } catch (IllegalArgumentException e) {
            return DEFAULT_MINIMUM;
        }
    }
}
