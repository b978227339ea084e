package com.rico.insurance.domain;

/**
 * Filing status of a policy as supplied by the data source at creation time.
 * Later transitions are derived from dates, never written back.
 */
public enum FilingStatus {
    /** Filed but not yet in force. */
    PENDING,
    /** In force. */
    ACTIVE,
    /** Reached its expiration date. */
    EXPIRED,
    /** Terminated early by the insurer or the insured. */
    CANCELLED,
    /** Expiration passed without a recorded renewal. */
    LAPSED
}
