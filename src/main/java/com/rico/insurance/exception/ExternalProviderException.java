package com.rico.insurance.exception;

/**
 * Thrown when the external insurance-data provider is unreachable, keeps rate limiting after retries,
 * or returns a payload we cannot read.
 */
public class ExternalProviderException extends InsuranceGraphException {

    public ExternalProviderException(String message) {
        super(message);
    }

    public ExternalProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
