package com.rico.insurance.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Motor carrier keyed by USDOT number. The insurance provider/amount columns are a display cache of the
 * last known policy; the temporal coverage model is authoritative.
 */
@Entity
@Table(name = "carriers", indexes = {
    @Index(name = "idx_carrier_name", columnList = "carrier_name")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CarrierEntity {

    @Id
    @Column(name = "usdot", nullable = false)
    private Long usdot;

    @Column(name = "carrier_name")
    private String carrierName;

    @Column(name = "jb_carrier")
    private Boolean jbCarrier;

    @Column(name = "primary_officer")
    private String primaryOfficer;

    @Column(name = "insurance_provider")
    private String insuranceProvider;

    @Column(name = "insurance_amount", precision = 19, scale = 2)
    private BigDecimal insuranceAmount;

    @Column(name = "trucks")
    private Integer trucks;

    @Column(name = "inspections")
    private Integer inspections;

    @Column(name = "violations")
    private Integer violations;

    @Column(name = "oos")
    private Integer oos;

    @Column(name = "crashes")
    private Integer crashes;

    @Column(name = "driver_oos_rate")
    private Double driverOosRate;

    @Column(name = "vehicle_oos_rate")
    private Double vehicleOosRate;

    @Column(name = "mcs150_drivers")
    private Integer mcs150Drivers;

    @Column(name = "mcs150_miles")
    private Long mcs150Miles;

    @Column(name = "ampd")
    private Long ampd;

    @Column(name = "mcs150_date")
    private LocalDate mcs150Date;

    @Column(name = "data_source")
    private String dataSource;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
