package com.rico.insurance.persistence.entity;

import com.rico.insurance.domain.FraudIndicator;
import com.rico.insurance.domain.InsuranceEventType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.Set;

/**
 * Persistent insurance event (the carrier's INSURANCE_EVENT history). Immutable once written.
 */
@Entity
@Table(name = "insurance_events", indexes = {
    @Index(name = "idx_event_carrier", columnList = "carrier_usdot"),
    @Index(name = "idx_event_type", columnList = "event_type"),
    @Index(name = "idx_event_date", columnList = "event_date")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InsuranceEventEntity {

    @Id
    @Column(name = "event_id", nullable = false)
    private String eventId;

    @Column(name = "carrier_usdot", nullable = false)
    private Long carrierUsdot;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false)
    private InsuranceEventType eventType;

    @Column(name = "event_date", nullable = false)
    private LocalDate eventDate;

    @Column(name = "previous_provider")
    private String previousProvider;

    @Column(name = "new_provider")
    private String newProvider;

    @Column(name = "previous_coverage", precision = 19, scale = 2)
    private BigDecimal previousCoverage;

    @Column(name = "new_coverage", precision = 19, scale = 2)
    private BigDecimal newCoverage;

    @Column(name = "coverage_change", precision = 19, scale = 2)
    private BigDecimal coverageChange;

    @Column(name = "previous_policy_id")
    private String previousPolicyId;

    @Column(name = "new_policy_id")
    private String newPolicyId;

    @Column(name = "days_without_coverage")
    private Integer daysWithoutCoverage;

    @Column(name = "compliance_violation", nullable = false)
    private boolean complianceViolation;

    @Column(name = "violation_reason")
    private String violationReason;

    @Column(name = "is_suspicious", nullable = false)
    private boolean suspicious;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "insurance_event_indicators", joinColumns = @JoinColumn(name = "event_id"))
    @Column(name = "indicator", nullable = false)
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private Set<FraudIndicator> fraudIndicators = new HashSet<>();

    @Column(name = "reason")
    private String reason;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    @Column(name = "data_source")
    private String dataSource;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }
}
