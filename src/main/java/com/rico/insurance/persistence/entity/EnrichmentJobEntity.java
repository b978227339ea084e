package com.rico.insurance.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Batch enrichment job with progress counters.
 */
@Entity
@Table(name = "enrichment_jobs", indexes = {
    @Index(name = "idx_job_status", columnList = "status"),
    @Index(name = "idx_job_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrichmentJobEntity {

    @Id
    @Column(name = "job_id", nullable = false)
    private String jobId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "enrichment_job_carriers", joinColumns = @JoinColumn(name = "job_id"))
    @OrderColumn(name = "position")
    @Column(name = "usdot", nullable = false)
    @Builder.Default
    private List<Long> carrierUsdots = new ArrayList<>();

    @Column(name = "carriers_total", nullable = false)
    private int carriersTotal;

    @Column(name = "carriers_processed", nullable = false)
    private int carriersProcessed;

    @Column(name = "carriers_succeeded", nullable = false)
    private int carriersSucceeded;

    @Column(name = "carriers_failed", nullable = false)
    private int carriersFailed;

    @Column(name = "carriers_skipped", nullable = false)
    private int carriersSkipped;

    @Column(name = "policies_created", nullable = false)
    private int policiesCreated;

    @Column(name = "events_created", nullable = false)
    private int eventsCreated;

    @Column(name = "gaps_found", nullable = false)
    private int gapsFound;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "enrichment_job_errors", joinColumns = @JoinColumn(name = "job_id"))
    @OrderColumn(name = "position")
    @Column(name = "error", length = 1000, nullable = false)
    @Builder.Default
    private List<String> errors = new ArrayList<>();

    @Column(name = "failure_message", length = 1000)
    private String failureMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }

    public enum JobStatus {
        PENDING, RUNNING, COMPLETED, FAILED
    }
}
