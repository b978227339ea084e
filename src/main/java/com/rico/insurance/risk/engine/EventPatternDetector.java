package com.rico.insurance.risk.engine;

import com.rico.insurance.domain.FraudIndicator;
import com.rico.insurance.domain.InsuranceEvent;
import com.rico.insurance.domain.InsuranceEventType;
import com.rico.insurance.domain.InsurancePolicy;
import com.rico.insurance.risk.domain.ProviderShoppingAnalysis;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Per-event fraud tags and event risk weights.
 */
@Slf4j
@Component
public class EventPatternDetector {

    static final int EXTENDED_GAP_DAYS = 30;
    static final int MINOR_GAP_DAYS = 7;
    static final BigDecimal SIGNIFICANT_REDUCTION = new BigDecimal("-100000");
    static final String NON_PAYMENT = "NON_PAYMENT";

    private static final Map<InsuranceEventType, Double> TYPE_WEIGHTS = Map.of(
            InsuranceEventType.CANCELLATION, 0.3,
            InsuranceEventType.LAPSE, 0.4,
            InsuranceEventType.PROVIDER_CHANGE, 0.2,
            InsuranceEventType.COVERAGE_DECREASE, 0.2,
            InsuranceEventType.NEW_POLICY, 0.1,
            InsuranceEventType.RENEWAL, 0.0,
            InsuranceEventType.COVERAGE_INCREASE, 0.0);
    private static final double DEFAULT_TYPE_WEIGHT = 0.1;
    private static final int SHOPPING_PROVIDER_COUNT = 3;

    /**
     * Tags that apply to the event. Each rule is independent.
     */
    public Set<FraudIndicator> detectFraudPatterns(InsuranceEvent event) {
        Set<FraudIndicator> tags = EnumSet.noneOf(FraudIndicator.class);
        if (event.getDaysWithoutCoverage() != null && event.getDaysWithoutCoverage() > EXTENDED_GAP_DAYS) {
            tags.add(FraudIndicator.EXTENDED_COVERAGE_GAP);
        }
        if (event.getEventType() == InsuranceEventType.PROVIDER_CHANGE) {
            tags.add(FraudIndicator.PROVIDER_SHOPPING);
        }
        if (event.getCoverageChange() != null && event.getCoverageChange().compareTo(SIGNIFICANT_REDUCTION) < 0) {
            tags.add(FraudIndicator.SIGNIFICANT_COVERAGE_REDUCTION);
        }
        if (event.getEventType() == InsuranceEventType.CANCELLATION && NON_PAYMENT.equalsIgnoreCase(event.getReason())) {
            tags.add(FraudIndicator.FINANCIAL_DISTRESS);
        }
        if (event.getEventType() == InsuranceEventType.LAPSE) {
            tags.add(FraudIndicator.COVERAGE_LAPSE);
        }
        log.debug("Event patterns: eventId={}, type={}, tags={}", event.getEventId(), event.getEventType(), tags);
        return tags;
    }

    /**
     * Event risk in [0, 1]: a weight per event type plus gap, compliance and suspicion bumps.
     */
    public double eventRiskScore(InsuranceEvent event) {
        double score = event.getEventType() == null
                ? DEFAULT_TYPE_WEIGHT
                : TYPE_WEIGHTS.getOrDefault(event.getEventType(), DEFAULT_TYPE_WEIGHT);
        Integer gap = event.getDaysWithoutCoverage();
        if (gap != null && gap > EXTENDED_GAP_DAYS) {
            score += 0.3;
        } else if (gap != null && gap > MINOR_GAP_DAYS) {
            score += 0.1;
        }
        if (event.isComplianceViolation()) {
            score += 0.2;
        }
        if (event.isSuspicious()) {
            score += 0.1;
        }
        return Math.min(score, 1.0);
    }

    /**
     * Distinct providers among policies effective within the last {@code monthsWindow} x 30 days.
     * Three or more providers count as shopping.
     */
    public ProviderShoppingAnalysis analyzeProviderShopping(List<InsurancePolicy> policies, int monthsWindow, LocalDate today) {
        LocalDate cutoff = today.minusDays(monthsWindow * 30L);
        List<InsurancePolicy> recent = policies.stream()
                .filter(p -> p.getEffectiveDate() != null && !p.getEffectiveDate().isBefore(cutoff))
                .collect(Collectors.toList());
        List<String> providers = recent.stream()
                .map(InsurancePolicy::getProviderName)
                .distinct()
                .sorted()
                .collect(Collectors.toList());
        return ProviderShoppingAnalysis.builder()
                .shopping(providers.size() >= SHOPPING_PROVIDER_COUNT)
                .providerCount(providers.size())
                .providers(providers)
                .policyCount(recent.size())
                .monthsWindow(monthsWindow)
                .riskScore(Math.min(providers.size() / (double) SHOPPING_PROVIDER_COUNT, 1.0))
                .build();
    }
}
