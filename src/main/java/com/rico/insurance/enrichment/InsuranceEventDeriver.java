package com.rico.insurance.enrichment;

import com.rico.insurance.domain.FraudIndicator;
import com.rico.insurance.domain.InsuranceEvent;
import com.rico.insurance.domain.InsuranceEventType;
import com.rico.insurance.domain.InsurancePolicy;
import com.rico.insurance.risk.engine.EventPatternDetector;
import com.rico.insurance.temporal.TemporalIntervals;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives a carrier's insurance events from its policies sorted by effective date, tagging each with
 * the matching fraud patterns.
 */
@Component
@RequiredArgsConstructor
public class InsuranceEventDeriver {

    static final int COMPLIANCE_GAP_DAYS = 30;
    static final String GAP_VIOLATION = "Coverage gap exceeded 30 days";

    private final EventPatternDetector patternDetector;
    private final Clock clock;

    public List<InsuranceEvent> derive(Long usdot, List<InsurancePolicy> sortedPolicies, String dataSource) {
        LocalDate today = LocalDate.now(clock);
        Map<String, Integer> idCounts = new HashMap<>();
        List<InsuranceEvent> events = new ArrayList<>();

        for (int i = 0; i < sortedPolicies.size(); i++) {
            InsurancePolicy current = sortedPolicies.get(i);
            InsurancePolicy previous = i > 0 ? sortedPolicies.get(i - 1) : null;
            InsurancePolicy next = i + 1 < sortedPolicies.size() ? sortedPolicies.get(i + 1) : null;

            InsuranceEvent.InsuranceEventBuilder transition = previous == null
                    ? newPolicy(current)
                    : transition(previous, current);
            events.add(tag(transition.carrierUsdot(usdot).dataSource(dataSource), idCounts));

            if (current.getCancellationDate() != null) {
                events.add(tag(InsuranceEvent.builder()
                        .carrierUsdot(usdot)
                        .eventType(InsuranceEventType.CANCELLATION)
                        .eventDate(current.getCancellationDate())
                        .previousProvider(current.getProviderName())
                        .previousCoverage(current.getCoverageAmount())
                        .previousPolicyId(current.getPolicyId())
                        .reason(current.getCancellationReason())
                        .dataSource(dataSource), idCounts));
            } else if (lapsed(current, next, today)) {
                events.add(tag(InsuranceEvent.builder()
                        .carrierUsdot(usdot)
                        .eventType(InsuranceEventType.LAPSE)
                        .eventDate(current.getExpirationDate())
                        .previousProvider(current.getProviderName())
                        .previousCoverage(current.getCoverageAmount())
                        .previousPolicyId(current.getPolicyId())
                        .reason("Expired without renewal")
                        .dataSource(dataSource), idCounts));
            }
        }
        return events;
    }

    private InsuranceEvent.InsuranceEventBuilder newPolicy(InsurancePolicy policy) {
        return InsuranceEvent.builder()
                .eventType(InsuranceEventType.NEW_POLICY)
                .eventDate(policy.getEffectiveDate())
                .newProvider(policy.getProviderName())
                .newCoverage(policy.getCoverageAmount())
                .newPolicyId(policy.getPolicyId());
    }

    private InsuranceEvent.InsuranceEventBuilder transition(InsurancePolicy previous, InsurancePolicy current) {
        BigDecimal change = current.getCoverageAmount().subtract(previous.getCoverageAmount());
        InsuranceEventType type;
        if (!current.getProviderName().equals(previous.getProviderName())) {
            type = InsuranceEventType.PROVIDER_CHANGE;
        } else if (change.signum() > 0) {
            type = InsuranceEventType.COVERAGE_INCREASE;
        } else if (change.signum() < 0) {
            type = InsuranceEventType.COVERAGE_DECREASE;
        } else {
            type = InsuranceEventType.RENEWAL;
        }
        Integer gap = TemporalIntervals.gapDays(previous, current);
        boolean violation = gap != null && gap > COMPLIANCE_GAP_DAYS;
        return InsuranceEvent.builder()
                .eventType(type)
                .eventDate(current.getEffectiveDate())
                .previousProvider(previous.getProviderName())
                .newProvider(current.getProviderName())
                .previousCoverage(previous.getCoverageAmount())
                .newCoverage(current.getCoverageAmount())
                .coverageChange(change)
                .previousPolicyId(previous.getPolicyId())
                .newPolicyId(current.getPolicyId())
                .daysWithoutCoverage(gap)
                .complianceViolation(violation)
                .violationReason(violation ? GAP_VIOLATION : null);
    }

    /** Expired before today with no later policy starting by the expiration date. */
    private static boolean lapsed(InsurancePolicy current, InsurancePolicy next, LocalDate today) {
        LocalDate expiration = current.getExpirationDate();
        if (expiration == null || !expiration.isBefore(today)) {
            return false;
        }
        return next == null || next.getEffectiveDate().isAfter(expiration);
    }

    private InsuranceEvent tag(InsuranceEvent.InsuranceEventBuilder builder, Map<String, Integer> idCounts) {
        InsuranceEvent draft = builder.build();
        String baseId = "EVT-" + draft.getCarrierUsdot() + "-"
                + draft.getEventDate().format(DateTimeFormatter.BASIC_ISO_DATE) + "-" + draft.getEventType();
        int seen = idCounts.merge(baseId, 1, Integer::sum);
        Set<FraudIndicator> tags = patternDetector.detectFraudPatterns(draft);
        return builder
                .eventId(seen == 1 ? baseId : baseId + "-" + seen)
                .fraudIndicators(tags)
                .suspicious(!tags.isEmpty())
                .build();
    }
}
