package com.rico.insurance.risk.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class UnderinsuredCarrier {
    Long carrierUsdot;
    String carrierName;
    String policyId;
    String providerName;
    String cargoType;
    BigDecimal coverageAmount;
    BigDecimal requiredMinimum;
    /** requiredMinimum - coverageAmount. */
    BigDecimal shortage;
}
