package com.rico.insurance.risk.engine;

import com.rico.insurance.domain.FraudIndicator;
import com.rico.insurance.domain.InsuranceEvent;
import com.rico.insurance.domain.InsuranceEventType;
import com.rico.insurance.domain.InsurancePolicy;
import com.rico.insurance.risk.domain.ProviderShoppingAnalysis;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static com.rico.insurance.support.GraphFixtures.policy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for EventPatternDetector: tags, event risk weights and provider churn.
 */
class EventPatternDetectorTest {

    private final EventPatternDetector detector = new EventPatternDetector();

    private static InsuranceEvent.InsuranceEventBuilder event(InsuranceEventType type) {
        return InsuranceEvent.builder()
                .eventId("EVT-1")
                .carrierUsdot(100L)
                .eventType(type)
                .eventDate(LocalDate.of(2024, 1, 1));
    }

    @Test
    void providerChangeAfterLongGapWithReduction() {
        InsuranceEvent e = event(InsuranceEventType.PROVIDER_CHANGE)
                .daysWithoutCoverage(45)
                .coverageChange(new BigDecimal("-250000"))
                .build();

        assertThat(detector.detectFraudPatterns(e)).containsExactlyInAnyOrder(
                FraudIndicator.EXTENDED_COVERAGE_GAP,
                FraudIndicator.PROVIDER_SHOPPING,
                FraudIndicator.SIGNIFICANT_COVERAGE_REDUCTION);
    }

    @Test
    void thresholdsAreStrict() {
        InsuranceEvent e = event(InsuranceEventType.RENEWAL)
                .daysWithoutCoverage(30)
                .coverageChange(new BigDecimal("-100000"))
                .build();

        assertThat(detector.detectFraudPatterns(e)).isEmpty();
    }

    @Test
    void nonPaymentCancellationAndLapse() {
        assertThat(detector.detectFraudPatterns(event(InsuranceEventType.CANCELLATION).reason("non_payment").build()))
                .containsExactly(FraudIndicator.FINANCIAL_DISTRESS);
        assertThat(detector.detectFraudPatterns(event(InsuranceEventType.CANCELLATION).reason("Insured request").build()))
                .isEmpty();
        assertThat(detector.detectFraudPatterns(event(InsuranceEventType.LAPSE).build()))
                .containsExactly(FraudIndicator.COVERAGE_LAPSE);
    }

    @Test
    void eventRiskAddsBumpsAndCapsAtOne() {
        assertThat(detector.eventRiskScore(event(InsuranceEventType.RENEWAL).build())).isZero();
        assertThat(detector.eventRiskScore(event(InsuranceEventType.PROVIDER_CHANGE).daysWithoutCoverage(10).build()))
                .isCloseTo(0.3, within(1e-9));
        assertThat(detector.eventRiskScore(event(InsuranceEventType.LAPSE)
                .daysWithoutCoverage(90).complianceViolation(true).suspicious(true).build()))
                .isEqualTo(1.0);
        assertThat(detector.eventRiskScore(event(null).build())).isCloseTo(0.1, within(1e-9));
    }

    @Test
    void shoppingCountsProvidersInsideWindow() {
        LocalDate today = LocalDate.of(2024, 6, 1);
        List<InsurancePolicy> policies = List.of(
                policy("P1", 100L, "Acme", "2023-01-01").build(),
                policy("P2", 100L, "Beta", "2023-08-01").build(),
                policy("P3", 100L, "Gamma", "2024-02-01").build(),
                policy("P4", 100L, "Beta", "2024-04-01").build());

        ProviderShoppingAnalysis twelveMonths = detector.analyzeProviderShopping(policies, 12, today);
        ProviderShoppingAnalysis twoYears = detector.analyzeProviderShopping(policies, 24, today);

        assertThat(twelveMonths.isShopping()).isFalse();
        assertThat(twelveMonths.getProviders()).containsExactly("Beta", "Gamma");
        assertThat(twelveMonths.getPolicyCount()).isEqualTo(3);
        assertThat(twoYears.isShopping()).isTrue();
        assertThat(twoYears.getRiskScore()).isEqualTo(1.0);
    }
}
