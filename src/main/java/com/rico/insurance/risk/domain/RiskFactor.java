package com.rico.insurance.risk.domain;

import lombok.Builder;
import lombok.Value;

/**
 * One additive component of a carrier risk score.
 */
@Value
@Builder
public class RiskFactor {
    /** Short name, e.g. "no policy", "coverage gap". */
    String name;
    /** Points this factor adds to the total. */
    double points;
    /** Human-readable detail (e.g. "3 cancellations"). */
    String detail;
}
