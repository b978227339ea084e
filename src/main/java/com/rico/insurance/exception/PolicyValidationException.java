package com.rico.insurance.exception;

import java.util.List;

/**
 * Thrown when a policy or event is rejected before any write (missing effective date,
 * negative coverage, end date before effective date, ...).
 */
public class PolicyValidationException extends InsuranceGraphException {

    private final List<String> violations;

    public PolicyValidationException(String message, List<String> violations) {
        super(message + ": " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public PolicyValidationException(String message) {
        super(message);
        this.violations = List.of(message);
    }

    public List<String> getViolations() {
        return violations;
    }
}
