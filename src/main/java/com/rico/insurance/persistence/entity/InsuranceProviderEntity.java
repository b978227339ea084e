package com.rico.insurance.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Insurance company, unique by name. Created on first reference.
 */
@Entity
@Table(name = "insurance_providers", uniqueConstraints = {
    @UniqueConstraint(name = "uk_provider_name", columnNames = "name")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InsuranceProviderEntity {

    @Id
    @Column(name = "provider_id", nullable = false)
    private String providerId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "contact_phone")
    private String contactPhone;

    @Column(name = "contact_email")
    private String contactEmail;

    @Column(name = "website")
    private String website;

    @Column(name = "total_carriers_insured", nullable = false)
    private int totalCarriersInsured;

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
