package com.rico.insurance.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * INSURED_BY: carrier to provider display cache.
 */
@Entity
@Table(name = "carrier_providers",
    uniqueConstraints = @UniqueConstraint(name = "uk_carrier_provider", columnNames = {"carrier_usdot", "provider_id"}),
    indexes = @Index(name = "idx_carrier_provider_provider", columnList = "provider_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CarrierProviderLinkEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "carrier_usdot", nullable = false)
    private Long carrierUsdot;

    @Column(name = "provider_id", nullable = false)
    private String providerId;

    @Column(name = "amount", precision = 19, scale = 2)
    private BigDecimal amount;

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
