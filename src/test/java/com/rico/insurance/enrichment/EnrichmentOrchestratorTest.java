package com.rico.insurance.enrichment;

import com.rico.insurance.client.ComplianceCheck;
import com.rico.insurance.client.ComplianceViolation;
import com.rico.insurance.client.InsuranceDataProvider;
import com.rico.insurance.client.RawInsuranceRecord;
import com.rico.insurance.config.RicoProperties;
import com.rico.insurance.detection.CoverageGapDetector;
import com.rico.insurance.domain.FraudIndicator;
import com.rico.insurance.domain.InsuranceEvent;
import com.rico.insurance.exception.ExternalProviderException;
import com.rico.insurance.graph.CoverageRelationshipService;
import com.rico.insurance.persistence.entity.CarrierEntity;
import com.rico.insurance.persistence.repository.CarrierRepository;
import com.rico.insurance.persistence.repository.CoveragePeriodRepository;
import com.rico.insurance.persistence.service.CarrierPersistenceService;
import com.rico.insurance.persistence.service.InsurancePersistenceService;
import com.rico.insurance.persistence.service.InsuranceProviderService;
import com.rico.insurance.risk.engine.EventPatternDetector;
import com.rico.insurance.support.GraphTestConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.util.List;

import static com.rico.insurance.support.GraphFixtures.carrier;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * End-to-end enrichment over the JPA slice with the insurance-data provider mocked.
 */
@DataJpaTest
@Import({GraphTestConfig.class, RicoProperties.class, EnrichmentOrchestrator.class, InsuranceRecordMapper.class,
        InsuranceEventDeriver.class, EventPatternDetector.class, CarrierLockRegistry.class,
        InsurancePersistenceService.class, CarrierPersistenceService.class, InsuranceProviderService.class,
        CoverageRelationshipService.class, CoverageGapDetector.class})
class EnrichmentOrchestratorTest {

    @MockitoBean
    private InsuranceDataProvider dataProvider;

    @Autowired
    private EnrichmentOrchestrator orchestrator;
    @Autowired
    private InsurancePersistenceService store;
    @Autowired
    private CoverageGapDetector gapDetector;
    @Autowired
    private InsuranceProviderService providers;
    @Autowired
    private CarrierRepository carrierRepository;
    @Autowired
    private CoveragePeriodRepository coveragePeriodRepository;

    private static final ComplianceCheck UNDERINSURED = ComplianceCheck.builder()
            .carrierUsdot(100L)
            .compliant(false)
            .violations(List.of(ComplianceViolation.builder()
                    .type("UNDERINSURED").description("Coverage below minimum").severity("HIGH").build()))
            .build();

    @BeforeEach
    void setUp() {
        carrierRepository.save(carrier(100L, "Alpha Freight"));
        when(dataProvider.getSourceName()).thenReturn("searchcarriers");
    }

    private static List<RawInsuranceRecord> history() {
        return List.of(
                RawInsuranceRecord.builder().id("r1").nameCompany("Acme").maxCovAmount("00750").insFormCode("91X")
                        .effectiveDate("2023-01-01").cancellationDate("2023-06-01").cancellationReason("NON_PAYMENT")
                        .build(),
                RawInsuranceRecord.builder().id("r2").nameCompany("Beta").maxCovAmount("00500").insFormCode("91X")
                        .effectiveDate("2023-07-15 00:00:00").filingStatus("ACTIVE").build(),
                RawInsuranceRecord.builder().id("r3").nameCompany("Gamma").maxCovAmount("01000").insFormCode("99")
                        .effectiveDate("2023-09-01").build(),
                RawInsuranceRecord.builder().id("r4").nameCompany("Beta").maxCovAmount("00500").insFormCode("91X")
                        .effectiveDate("07/15/2023").build());
    }

    @Test
    void enrichesCarrierFromProviderHistory() {
        when(dataProvider.fetchInsuranceHistory(100L)).thenReturn(history());
        when(dataProvider.fetchComplianceCheck(100L)).thenReturn(UNDERINSURED);

        EnrichmentResult result = orchestrator.enrichCarrier(100L);

        assertThat(result.getOutcome()).isEqualTo(EnrichmentOutcome.ENRICHED);
        assertThat(result.getCarrierName()).isEqualTo("Alpha Freight");
        assertThat(result.getRecordsFetched()).isEqualTo(4);
        assertThat(result.getPoliciesCreated()).isEqualTo(2);
        assertThat(result.getRecordsSkipped()).isEqualTo(1);
        assertThat(result.getRecordsDuplicate()).isEqualTo(1);
        assertThat(accountedRecords(result)).isEqualTo(result.getRecordsFetched());
        assertThat(result.getTotalErrors()).isEqualTo(2);
        assertThat(result.getErrors()).anyMatch(e -> e.contains("r3"))
                .anyMatch(e -> e.contains("r4") && e.contains("duplicate"));
        assertThat(result.getGapsFound()).isEqualTo(1);
        assertThat(result.getEventsCreated()).isEqualTo(3);
        assertThat(result.getFraudIndicators()).containsExactlyInAnyOrder(
                FraudIndicator.FINANCIAL_DISTRESS,
                FraudIndicator.EXTENDED_COVERAGE_GAP,
                FraudIndicator.PROVIDER_SHOPPING,
                FraudIndicator.SIGNIFICANT_COVERAGE_REDUCTION);
        assertThat(result.getComplianceViolations()).extracting(ComplianceViolation::getType)
                .containsExactly("COVERAGE_GAP", "UNDERINSURED");

        assertThat(store.listPoliciesForCarrier(100L)).hasSize(2);
        assertThat(store.listEventsForCarrier(100L)).extracting(InsuranceEvent::getEventId).containsExactly(
                "EVT-100-20230101-NEW_POLICY",
                "EVT-100-20230601-CANCELLATION",
                "EVT-100-20230715-PROVIDER_CHANGE");
        assertThat(gapDetector.maxGapDays(100L)).isEqualTo(44);

        CarrierEntity carrier = carrierRepository.findById(100L).orElseThrow();
        assertThat(carrier.getInsuranceProvider()).isEqualTo("Beta");
        assertThat(carrier.getInsuranceAmount()).isEqualByComparingTo("500000");
        assertThat(providers.findByName("Beta").orElseThrow().getTotalCarriersInsured()).isEqualTo(1);
    }

    @Test
    void sameProviderAndDateFiledUnderTwoFormsCountsTheSecondAsDuplicate() {
        when(dataProvider.fetchInsuranceHistory(100L)).thenReturn(List.of(
                RawInsuranceRecord.builder().id("a1").nameCompany("Acme").maxCovAmount("00750").insFormCode("91X")
                        .effectiveDate("2023-01-01").build(),
                RawInsuranceRecord.builder().id("a2").nameCompany("Acme").maxCovAmount("00750").insFormCode("34")
                        .effectiveDate("2023-01-01").build()));
        when(dataProvider.fetchComplianceCheck(100L)).thenReturn(null);

        EnrichmentResult result = orchestrator.enrichCarrier(100L);

        assertThat(result.getRecordsFetched()).isEqualTo(2);
        assertThat(result.getPoliciesCreated()).isEqualTo(1);
        assertThat(result.getRecordsDuplicate()).isEqualTo(1);
        assertThat(result.getRecordsSkipped()).isZero();
        assertThat(accountedRecords(result)).isEqualTo(2);
        assertThat(result.getErrors()).singleElement().asString().contains("a2");
    }

    private static int accountedRecords(EnrichmentResult result) {
        return result.getPoliciesCreated() + result.getPoliciesExisting()
                + result.getRecordsSkipped() + result.getRecordsDuplicate();
    }

    @Test
    void rerunCreatesNothingNew() {
        when(dataProvider.fetchInsuranceHistory(100L)).thenReturn(history());
        when(dataProvider.fetchComplianceCheck(100L)).thenReturn(UNDERINSURED);
        orchestrator.enrichCarrier(100L);

        EnrichmentResult again = orchestrator.enrichCarrier(100L);

        assertThat(again.getPoliciesCreated()).isZero();
        assertThat(again.getPoliciesExisting()).isEqualTo(2);
        assertThat(accountedRecords(again)).isEqualTo(again.getRecordsFetched());
        assertThat(again.getEventsCreated()).isZero();
        assertThat(store.listEventsForCarrier(100L)).hasSize(3);
        assertThat(coveragePeriodRepository.findByCarrierUsdotOrderByFromDateAscIdAsc(100L)).hasSize(2);
    }

    @Test
    void unknownCarrierIsNotFetched() {
        EnrichmentResult result = orchestrator.enrichCarrier(999L);

        assertThat(result.getOutcome()).isEqualTo(EnrichmentOutcome.CARRIER_NOT_FOUND);
        verify(dataProvider, never()).fetchInsuranceHistory(anyLong());
    }

    @Test
    void emptyHistoryIsNoData() {
        when(dataProvider.fetchInsuranceHistory(100L)).thenReturn(List.of());

        EnrichmentResult result = orchestrator.enrichCarrier(100L);

        assertThat(result.getOutcome()).isEqualTo(EnrichmentOutcome.NO_DATA);
        assertThat(result.getErrors()).isEmpty();
    }

    @Test
    void providerFailureIsReported() {
        when(dataProvider.fetchInsuranceHistory(100L)).thenThrow(new ExternalProviderException("upstream down"));

        EnrichmentResult result = orchestrator.enrichCarrier(100L);

        assertThat(result.getOutcome()).isEqualTo(EnrichmentOutcome.FAILED);
        assertThat(result.getErrors()).containsExactly("upstream down");
    }

    @Test
    void complianceFailureDoesNotFailEnrichment() {
        when(dataProvider.fetchInsuranceHistory(100L)).thenReturn(history());
        when(dataProvider.fetchComplianceCheck(100L)).thenThrow(new ExternalProviderException("timeout"));

        EnrichmentResult result = orchestrator.enrichCarrier(100L);

        assertThat(result.getOutcome()).isEqualTo(EnrichmentOutcome.ENRICHED);
        assertThat(result.getTotalErrors()).isEqualTo(2);
        assertThat(result.getComplianceViolations()).extracting(ComplianceViolation::getType)
                .containsExactly("COVERAGE_GAP");
    }
}
