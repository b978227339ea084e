package com.rico.insurance.enrichment;

import com.rico.insurance.config.RicoProperties;
import com.rico.insurance.persistence.entity.CarrierEntity;
import com.rico.insurance.persistence.entity.EnrichmentJobEntity;
import com.rico.insurance.persistence.entity.EnrichmentJobEntity.JobStatus;
import com.rico.insurance.persistence.repository.EnrichmentJobRepository;
import com.rico.insurance.persistence.service.CarrierPersistenceService;
import com.rico.insurance.support.GraphTestConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.rico.insurance.support.GraphFixtures.carrier;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for EnrichmentJobService. The executor runs jobs inline and delays are zero.
 */
@ExtendWith(MockitoExtension.class)
class EnrichmentJobServiceTest {

    @Mock
    private EnrichmentJobRepository jobRepository;
    @Mock
    private EnrichmentOrchestrator orchestrator;
    @Mock
    private CarrierPersistenceService carrierStore;

    private final Map<String, EnrichmentJobEntity> jobs = new HashMap<>();
    private EnrichmentJobService service;

    @BeforeEach
    void setUp() {
        lenient().when(jobRepository.save(any(EnrichmentJobEntity.class))).thenAnswer(inv -> {
            EnrichmentJobEntity job = inv.getArgument(0);
            jobs.put(job.getJobId(), job);
            return job;
        });
        lenient().when(jobRepository.findById(anyString()))
                .thenAnswer(inv -> Optional.ofNullable(jobs.get(inv.<String>getArgument(0))));

        RicoProperties properties = new RicoProperties();
        properties.getEnrichment().setBatchSize(2);
        properties.getEnrichment().setInterCarrierDelayMs(0);
        properties.getEnrichment().setInterBatchDelayMs(0);
        properties.getEnrichment().setMaxErrorDetails(2);
        service = new EnrichmentJobService(jobRepository, orchestrator, carrierStore, Runnable::run,
                properties, GraphTestConfig.fixedClock());
    }

    private static EnrichmentResult enriched(long usdot, int policies, int events, int gaps) {
        return EnrichmentResult.builder()
                .carrierUsdot(usdot)
                .outcome(EnrichmentOutcome.ENRICHED)
                .policiesCreated(policies)
                .eventsCreated(events)
                .gapsFound(gaps)
                .complianceViolations(List.of())
                .fraudIndicators(Set.of())
                .errors(List.of())
                .build();
    }

    @Test
    void runsEveryCarrierAndAggregatesCounters() {
        when(orchestrator.enrichCarrier(1L)).thenReturn(enriched(1L, 2, 3, 1));
        when(orchestrator.enrichCarrier(2L)).thenReturn(EnrichmentResult.of(2L, EnrichmentOutcome.NO_DATA, null));
        when(orchestrator.enrichCarrier(3L)).thenReturn(enriched(3L, 1, 1, 0));

        String jobId = service.submit(List.of(1L, 2L, 3L, 1L));

        EnrichmentJobEntity job = service.getJob(jobId).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getCarriersTotal()).isEqualTo(3);
        assertThat(job.getCarriersProcessed()).isEqualTo(3);
        assertThat(job.getCarriersSucceeded()).isEqualTo(2);
        assertThat(job.getCarriersSkipped()).isEqualTo(1);
        assertThat(job.getPoliciesCreated()).isEqualTo(3);
        assertThat(job.getEventsCreated()).isEqualTo(4);
        assertThat(job.getGapsFound()).isEqualTo(1);
        assertThat(job.getStartedAt()).isNotNull();
        assertThat(job.getFinishedAt()).isNotNull();
        verify(orchestrator, times(1)).enrichCarrier(1L);
    }

    @Test
    void oneFailingCarrierDoesNotStopTheJob() {
        when(orchestrator.enrichCarrier(1L)).thenThrow(new IllegalStateException("boom"));
        when(orchestrator.enrichCarrier(2L)).thenReturn(EnrichmentResult.of(2L, EnrichmentOutcome.FAILED, "upstream down"));
        when(orchestrator.enrichCarrier(3L)).thenReturn(enriched(3L, 1, 1, 0));
        when(orchestrator.enrichCarrier(4L)).thenReturn(EnrichmentResult.of(4L, EnrichmentOutcome.FAILED, "timeout"));

        String jobId = service.submit(List.of(1L, 2L, 3L, 4L));

        EnrichmentJobEntity job = service.getJob(jobId).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getCarriersFailed()).isEqualTo(3);
        assertThat(job.getCarriersSucceeded()).isEqualTo(1);
        assertThat(job.getErrors()).containsExactly("1: boom", "2: upstream down");
    }

    @Test
    void highRiskJobUsesCarrierStore() {
        when(carrierStore.findHighRiskCarriers(5)).thenReturn(List.of(carrier(7L, "Risky"), carrier(8L, "Riskier")));
        when(orchestrator.enrichCarrier(any())).thenReturn(enriched(7L, 0, 0, 0));

        String jobId = service.submitHighRisk(5);

        assertThat(service.getJob(jobId).orElseThrow().getCarrierUsdots()).containsExactly(7L, 8L);
    }

    @Test
    void emptySubmissionsAreRejected() {
        when(carrierStore.findHighRiskCarriers(5)).thenReturn(List.<CarrierEntity>of());

        assertThatThrownBy(() -> service.submit(List.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.submitHighRisk(5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void listsJobsByStatus() {
        when(jobRepository.findByStatusOrderByCreatedAtDesc(JobStatus.RUNNING)).thenReturn(List.of());

        assertThat(service.listJobs(JobStatus.RUNNING)).isEmpty();
    }
}
