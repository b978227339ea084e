package com.rico.insurance.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Partial carrier update. Only non-null fields are applied.
 */
@Value
@Builder
public class CarrierPatch {
    String carrierName;
    String primaryOfficer;
    Boolean jbCarrier;
    Integer trucks;
    Integer inspections;
    Integer violations;
    Integer oos;
    Integer crashes;
    Double driverOosRate;
    Double vehicleOosRate;
    Integer mcs150Drivers;
    Long mcs150Miles;
    Long ampd;
    LocalDate mcs150Date;
    String insuranceProvider;
    BigDecimal insuranceAmount;
    String dataSource;
}
