package com.rico.insurance.enrichment;

import com.rico.insurance.config.RicoProperties;
import com.rico.insurance.exception.NotFoundException;
import com.rico.insurance.persistence.entity.CarrierEntity;
import com.rico.insurance.persistence.entity.EnrichmentJobEntity;
import com.rico.insurance.persistence.entity.EnrichmentJobEntity.JobStatus;
import com.rico.insurance.persistence.repository.EnrichmentJobRepository;
import com.rico.insurance.persistence.service.CarrierPersistenceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Runs enrichment for a list of carriers in the background. Carriers are processed in batches with
 * pauses between carriers and between batches; job progress is persisted after every carrier.
 */
@Slf4j
@Service
public class EnrichmentJobService {

    private final EnrichmentJobRepository jobRepository;
    private final EnrichmentOrchestrator orchestrator;
    private final CarrierPersistenceService carrierStore;
    private final Executor executor;
    private final RicoProperties properties;
    private final Clock clock;

    public EnrichmentJobService(EnrichmentJobRepository jobRepository,
                                EnrichmentOrchestrator orchestrator,
                                CarrierPersistenceService carrierStore,
                                @Qualifier("enrichmentExecutor") Executor executor,
                                RicoProperties properties,
                                Clock clock) {
        this.jobRepository = jobRepository;
        this.orchestrator = orchestrator;
        this.carrierStore = carrierStore;
        this.executor = executor;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Queues a job for the given carriers and returns its id immediately. Duplicate USDOTs are run once.
     */
    public String submit(List<Long> usdots) {
        if (usdots == null || usdots.isEmpty()) {
            throw new IllegalArgumentException("At least one USDOT is required");
        }
        List<Long> distinct = new ArrayList<>(new LinkedHashSet<>(usdots));
        EnrichmentJobEntity job = EnrichmentJobEntity.builder()
                .jobId(UUID.randomUUID().toString())
                .status(JobStatus.PENDING)
                .carrierUsdots(distinct)
                .carriersTotal(distinct.size())
                .build();
        jobRepository.save(job);
        log.info("Enrichment job queued: jobId={}, carriers={}", job.getJobId(), distinct.size());

        String jobId = job.getJobId();
        CompletableFuture.runAsync(() -> run(jobId), executor)
                .exceptionally(ex -> {
                    log.error("Enrichment job crashed: jobId={}", jobId, ex);
                    markFailed(jobId, ex.getMessage());
                    return null;
                });
        return jobId;
    }

    /** Queues a job for the riskiest carriers by OOS rate and crash count. */
    public String submitHighRisk(int limit) {
        List<Long> usdots = carrierStore.findHighRiskCarriers(limit).stream()
                .map(CarrierEntity::getUsdot)
                .collect(Collectors.toList());
        if (usdots.isEmpty()) {
            throw new IllegalArgumentException("No high-risk carriers found");
        }
        return submit(usdots);
    }

    public Optional<EnrichmentJobEntity> getJob(String jobId) {
        return jobRepository.findById(jobId);
    }

    public List<EnrichmentJobEntity> listJobs(JobStatus status) {
        return jobRepository.findByStatusOrderByCreatedAtDesc(status);
    }

    void run(String jobId) {
        EnrichmentJobEntity job = jobRepository.findById(jobId)
                .orElseThrow(() -> new NotFoundException("EnrichmentJob", jobId));
        job.setStatus(JobStatus.RUNNING);
        job.setStartedAt(Instant.now(clock));
        job = jobRepository.save(job);

        RicoProperties.Enrichment settings = properties.getEnrichment();
        int batchSize = Math.max(1, settings.getBatchSize());
        ErrorLog errors = new ErrorLog(settings.getMaxErrorDetails());
        List<Long> usdots = List.copyOf(job.getCarrierUsdots());

        try {
            for (int i = 0; i < usdots.size(); i++) {
                if (i > 0) {
                    pause(i % batchSize == 0 ? settings.getInterBatchDelayMs() : settings.getInterCarrierDelayMs());
                }
                Long usdot = usdots.get(i);
                record(job, usdot, errors);
                job.setErrors(new ArrayList<>(errors.getDetails()));
                job = jobRepository.save(job);
            }
            job.setStatus(JobStatus.COMPLETED);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            job.setStatus(JobStatus.FAILED);
            job.setFailureMessage("Interrupted after " + job.getCarriersProcessed() + " carriers");
            log.warn("Enrichment job interrupted: jobId={}", jobId);
        }
        job.setFinishedAt(Instant.now(clock));
        jobRepository.save(job);
        log.info("Enrichment job finished: jobId={}, status={}, processed={}/{}, succeeded={}, failed={}, skipped={}, errors={}",
                jobId, job.getStatus(), job.getCarriersProcessed(), job.getCarriersTotal(),
                job.getCarriersSucceeded(), job.getCarriersFailed(), job.getCarriersSkipped(), errors.getTotal());
    }

    private void record(EnrichmentJobEntity job, Long usdot, ErrorLog errors) {
        try {
            EnrichmentResult result = orchestrator.enrichCarrier(usdot);
            switch (result.getOutcome()) {
                case ENRICHED:
                    job.setCarriersSucceeded(job.getCarriersSucceeded() + 1);
                    job.setPoliciesCreated(job.getPoliciesCreated() + result.getPoliciesCreated());
                    job.setEventsCreated(job.getEventsCreated() + result.getEventsCreated());
                    job.setGapsFound(job.getGapsFound() + result.getGapsFound());
                    break;
                case NO_DATA:
                case CARRIER_NOT_FOUND:
                    job.setCarriersSkipped(job.getCarriersSkipped() + 1);
                    break;
                default:
                    job.setCarriersFailed(job.getCarriersFailed() + 1);
                    break;
            }
            result.getErrors().forEach(e -> errors.add(usdot + ": " + e));
        } catch (RuntimeException e) {
            job.setCarriersFailed(job.getCarriersFailed() + 1);
            errors.add(usdot + ": " + e.getMessage());
            log.error("Carrier enrichment failed: jobId={}, usdot={}", job.getJobId(), usdot, e);
        }
        job.setCarriersProcessed(job.getCarriersProcessed() + 1);
    }

    private void markFailed(String jobId, String message) {
        jobRepository.findById(jobId).ifPresent(job -> {
            job.setStatus(JobStatus.FAILED);
            job.setFailureMessage(message);
            job.setFinishedAt(Instant.now(clock));
            jobRepository.save(job);
        });
    }

    private static void pause(long millis) throws InterruptedException {
        if (millis > 0) {
            Thread.sleep(millis);
        }
    }
}
