package com.rico.insurance.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * MANAGED_BY: carrier to officer.
 */
@Entity
@Table(name = "carrier_officers",
    uniqueConstraints = @UniqueConstraint(name = "uk_carrier_officer", columnNames = {"carrier_usdot", "person_id"}),
    indexes = @Index(name = "idx_carrier_officer_person", columnList = "person_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CarrierOfficerLinkEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "carrier_usdot", nullable = false)
    private Long carrierUsdot;

    @Column(name = "person_id", nullable = false)
    private String personId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }
}
