package com.rico.insurance.domain;

/**
 * Pattern tags attached to insurance events and enrichment results. Tags are independent; an event may
 * carry several.
 */
public enum FraudIndicator {
    /** More than 30 days without coverage before the event. */
    EXTENDED_COVERAGE_GAP,
    /** Carrier moved to a different provider. */
    PROVIDER_SHOPPING,
    /** Coverage dropped by more than $100,000. */
    SIGNIFICANT_COVERAGE_REDUCTION,
    /** Policy cancelled for non-payment. */
    FINANCIAL_DISTRESS,
    /** Coverage lapsed. */
    COVERAGE_LAPSE,
    /** Three or more distinct providers in the raw provider history window. */
    INSURANCE_SHOPPING
}
