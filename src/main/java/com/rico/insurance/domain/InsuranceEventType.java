package com.rico.insurance.domain;

/**
 * State transitions in a carrier's insurance history.
 */
public enum InsuranceEventType {
    /** First policy seen for the carrier. */
    NEW_POLICY,
    /** Same provider, same coverage. */
    RENEWAL,
    /** Next policy is written by a different provider. */
    PROVIDER_CHANGE,
    /** Policy terminated before expiration. */
    CANCELLATION,
    /** Policy expired and nothing picked up coverage. */
    LAPSE,
    /** Same provider, higher coverage amount. */
    COVERAGE_INCREASE,
    /** Same provider, lower coverage amount. */
    COVERAGE_DECREASE
}
