package com.rico.insurance.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * One entry of a carrier's merged policy/event timeline. Exactly one of policy and event is set.
 */
@Value
@Builder
public class TimelineEntry {

    public enum Kind { POLICY, EVENT }

    Kind kind;
    LocalDate date;
    InsurancePolicy policy;
    InsuranceEvent event;
}
