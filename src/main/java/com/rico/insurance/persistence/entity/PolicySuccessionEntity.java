package com.rico.insurance.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * PRECEDED_BY: later policy to the policy it replaced, with the gap between them.
 */
@Entity
@Table(name = "policy_successions",
    uniqueConstraints = @UniqueConstraint(name = "uk_policy_succession", columnNames = {"policy_id", "preceded_by_policy_id"}),
    indexes = @Index(name = "idx_succession_preceded_by", columnList = "preceded_by_policy_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PolicySuccessionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    /** The later policy. */
    @Column(name = "policy_id", nullable = false)
    private String policyId;

    @Column(name = "preceded_by_policy_id", nullable = false)
    private String precededByPolicyId;

    /** Null when the earlier policy had no end date. */
    @Column(name = "gap_days")
    private Integer gapDays;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }
}
