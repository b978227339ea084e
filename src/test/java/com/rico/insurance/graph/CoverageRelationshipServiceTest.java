package com.rico.insurance.graph;

import com.rico.insurance.domain.CoverageStatus;
import com.rico.insurance.persistence.entity.CarrierEntity;
import com.rico.insurance.persistence.entity.CoveragePeriodEntity;
import com.rico.insurance.persistence.entity.InsuranceProviderEntity;
import com.rico.insurance.persistence.entity.PolicySuccessionEntity;
import com.rico.insurance.persistence.repository.CarrierRepository;
import com.rico.insurance.persistence.repository.CoveragePeriodRepository;
import com.rico.insurance.persistence.repository.PolicyProviderLinkRepository;
import com.rico.insurance.persistence.repository.PolicySuccessionRepository;
import com.rico.insurance.persistence.service.InsurancePersistenceService;
import com.rico.insurance.persistence.service.InsuranceProviderService;
import com.rico.insurance.support.GraphTestConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;

import static com.rico.insurance.support.GraphFixtures.carrier;
import static com.rico.insurance.support.GraphFixtures.date;
import static com.rico.insurance.support.GraphFixtures.policy;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Upsert and endpoint checks for the coverage, provider and succession links.
 */
@DataJpaTest
@Import({GraphTestConfig.class, CoverageRelationshipService.class, InsuranceProviderService.class,
        InsurancePersistenceService.class})
class CoverageRelationshipServiceTest {

    @Autowired
    private CoverageRelationshipService relationships;
    @Autowired
    private InsurancePersistenceService store;
    @Autowired
    private InsuranceProviderService providers;
    @Autowired
    private CarrierRepository carrierRepository;
    @Autowired
    private CoveragePeriodRepository coveragePeriodRepository;
    @Autowired
    private PolicyProviderLinkRepository policyProviderLinkRepository;
    @Autowired
    private PolicySuccessionRepository successionRepository;

    @BeforeEach
    void setUp() {
        carrierRepository.save(carrier(100L, "Alpha Freight"));
        store.createPolicy(policy("P1", 100L, "Acme", "2023-01-01").expirationDate(date("2023-06-01")).build());
        store.createPolicy(policy("P2", 100L, "Beta", "2023-07-15").build());
    }

    @Test
    void linkingTwiceLeavesOnePeriod() {
        assertThat(relationships.linkCoveragePeriod("P1", 100L, date("2023-01-01"), date("2023-06-01"))).isTrue();
        assertThat(relationships.linkCoveragePeriod("P1", 100L, date("2023-01-01"), date("2023-06-01"))).isTrue();

        assertThat(coveragePeriodRepository.countByCarrierUsdotAndPolicyId(100L, "P1")).isEqualTo(1);
    }

    @Test
    void relinkUpdatesEndDateStatusAndDuration() {
        relationships.linkCoveragePeriod("P2", 100L, date("2023-07-15"), null);
        CoveragePeriodEntity open = coveragePeriodRepository.findByCarrierUsdotAndPolicyId(100L, "P2").orElseThrow();
        assertThat(open.getStatus()).isEqualTo(CoverageStatus.ACTIVE);
        assertThat(open.getDurationDays()).isEqualTo(-1);

        relationships.linkCoveragePeriod("P2", 100L, date("2023-07-15"), date("2024-01-15"));

        CoveragePeriodEntity closed = coveragePeriodRepository.findByCarrierUsdotAndPolicyId(100L, "P2").orElseThrow();
        assertThat(closed.getToDate()).isEqualTo(date("2024-01-15"));
        assertThat(closed.getStatus()).isEqualTo(CoverageStatus.EXPIRED);
        assertThat(closed.getDurationDays()).isEqualTo(184);
    }

    @Test
    void missingEndpointIsNoOp() {
        assertThat(relationships.linkCoveragePeriod("P1", 999L, date("2023-01-01"), null)).isFalse();
        assertThat(relationships.linkCoveragePeriod("NOPE", 100L, date("2023-01-01"), null)).isFalse();
        assertThat(relationships.linkSuccession("P1", "NOPE", 3)).isFalse();
        assertThat(relationships.linkProvider("NOPE", "Acme")).isFalse();

        assertThat(coveragePeriodRepository.findByCarrierUsdotOrderByFromDateAscIdAsc(100L)).isEmpty();
    }

    @Test
    void providerLinkCreatesProviderOnce() {
        assertThat(relationships.linkProvider("P1", "Acme")).isTrue();
        assertThat(relationships.linkProvider("P1", "Acme")).isTrue();

        InsuranceProviderEntity acme = providers.findByName("Acme").orElseThrow();
        assertThat(acme.getProviderId()).isEqualTo("PROV-ACME");
        assertThat(policyProviderLinkRepository.findByPolicyId("P1")).hasSize(1);
    }

    @Test
    void successionKeepsFirstGap() {
        assertThat(relationships.linkSuccession("P1", "P2", 44)).isTrue();
        assertThat(relationships.linkSuccession("P1", "P2", 10)).isTrue();

        PolicySuccessionEntity link = successionRepository.findByPolicyIdAndPrecededByPolicyId("P2", "P1").orElseThrow();
        assertThat(link.getGapDays()).isEqualTo(44);
        assertThat(relationships.linkSuccession("P1", "P1", 0)).isFalse();
    }

    @Test
    void carrierProviderLinkUpdatesCarrierAndCount() {
        relationships.linkCarrierToProvider(100L, "Beta", new BigDecimal("1000000"));
        relationships.linkCarrierToProvider(100L, "Beta", new BigDecimal("1000000"));

        CarrierEntity carrier = carrierRepository.findById(100L).orElseThrow();
        assertThat(carrier.getInsuranceProvider()).isEqualTo("Beta");
        assertThat(carrier.getInsuranceAmount()).isEqualByComparingTo("1000000");
        assertThat(providers.recomputeCarrierCount("Beta")).isEqualTo(1);
        assertThat(relationships.linkCarrierToProvider(999L, "Beta", BigDecimal.ONE)).isFalse();
    }
}
