package com.rico.insurance.exception;

/**
 * Base type for failures raised by the insurance graph services.
 */
public class InsuranceGraphException extends RuntimeException {

    public InsuranceGraphException(String message) {
        super(message);
    }

    public InsuranceGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
