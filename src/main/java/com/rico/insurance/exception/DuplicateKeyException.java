package com.rico.insurance.exception;

/**
 * Thrown when an explicit create targets a key that already exists.
 */
public class DuplicateKeyException extends InsuranceGraphException {

    public DuplicateKeyException(String message) {
        super(message);
    }

    public DuplicateKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
