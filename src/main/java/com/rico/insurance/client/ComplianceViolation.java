package com.rico.insurance.client;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ComplianceViolation {
    /** NO_INSURANCE, NO_ACTIVE_INSURANCE, UNDERINSURED. */
    String type;
    String description;
    /** CRITICAL or HIGH. */
    String severity;
}
