package com.rico.insurance.persistence.entity;

import com.rico.insurance.domain.FilingStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Persistent insurance policy. Rows are written once; derived state lives on the coverage period.
 */
@Entity
@Table(name = "insurance_policies", indexes = {
    @Index(name = "idx_policy_carrier", columnList = "carrier_usdot"),
    @Index(name = "idx_policy_provider", columnList = "provider_name"),
    @Index(name = "idx_policy_effective", columnList = "effective_date")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InsurancePolicyEntity {

    @Id
    @Column(name = "policy_id", nullable = false)
    private String policyId;

    @Column(name = "carrier_usdot", nullable = false)
    private Long carrierUsdot;

    @Column(name = "provider_name", nullable = false)
    private String providerName;

    @Column(name = "policy_type", nullable = false)
    private String policyType;

    @Column(name = "coverage_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal coverageAmount;

    @Column(name = "cargo_coverage", precision = 19, scale = 2)
    private BigDecimal cargoCoverage;

    @Column(name = "effective_date", nullable = false)
    private LocalDate effectiveDate;

    @Column(name = "expiration_date")
    private LocalDate expirationDate;

    @Column(name = "cancellation_date")
    private LocalDate cancellationDate;

    @Column(name = "cancellation_reason")
    private String cancellationReason;

    @Enumerated(EnumType.STRING)
    @Column(name = "filing_status", nullable = false)
    private FilingStatus filingStatus;

    @Column(name = "is_compliant")
    private Boolean compliant;

    @Column(name = "meets_federal_minimum")
    private Boolean meetsFederalMinimum;

    @Column(name = "required_minimum", precision = 19, scale = 2)
    private BigDecimal requiredMinimum;

    @Column(name = "data_source")
    private String dataSource;

    @Column(name = "source_record_id")
    private String sourceRecordId;

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
