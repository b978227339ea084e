package com.rico.insurance.exception;

/**
 * Thrown when a raw provider record cannot be mapped (unparseable date or amount, unknown form code).
 * The orchestrator counts and skips such records.
 */
public class DataQualityException extends InsuranceGraphException {

    public DataQualityException(String message) {
        super(message);
    }

    public DataQualityException(String message, Throwable cause) {
        super(message, cause);
    }
}
