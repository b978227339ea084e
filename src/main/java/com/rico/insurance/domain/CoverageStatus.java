package com.rico.insurance.domain;

/**
 * Derived status of a coverage period. CANCELLED takes precedence over date-based EXPIRED.
 */
public enum CoverageStatus {
    ACTIVE,
    EXPIRED,
    CANCELLED
}
