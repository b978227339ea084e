package com.rico.insurance.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * PROVIDED_BY: policy to provider.
 */
@Entity
@Table(name = "policy_providers",
    uniqueConstraints = @UniqueConstraint(name = "uk_policy_provider", columnNames = {"policy_id", "provider_id"}),
    indexes = @Index(name = "idx_policy_provider_provider", columnList = "provider_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PolicyProviderLinkEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "policy_id", nullable = false)
    private String policyId;

    @Column(name = "provider_id", nullable = false)
    private String providerId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }
}
