package com.rico.insurance.persistence.entity;

import com.rico.insurance.domain.CoverageStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * HAD_INSURANCE: carrier to policy, with temporal facts. One row per (carrier, policy); the generated id
 * preserves creation order.
 */
@Entity
@Table(name = "coverage_periods",
    uniqueConstraints = @UniqueConstraint(name = "uk_coverage_carrier_policy", columnNames = {"carrier_usdot", "policy_id"}),
    indexes = {
        @Index(name = "idx_coverage_carrier", columnList = "carrier_usdot"),
        @Index(name = "idx_coverage_from", columnList = "from_date")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CoveragePeriodEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "carrier_usdot", nullable = false)
    private Long carrierUsdot;

    @Column(name = "policy_id", nullable = false)
    private String policyId;

    @Column(name = "from_date", nullable = false)
    private LocalDate fromDate;

    @Column(name = "to_date")
    private LocalDate toDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private CoverageStatus status;

    /** -1 while open-ended. */
    @Column(name = "duration_days", nullable = false)
    private int durationDays;

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
