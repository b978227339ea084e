package com.rico.insurance.enrichment;

import com.rico.insurance.client.ComplianceViolation;
import com.rico.insurance.domain.FraudIndicator;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Summary of one carrier's enrichment. Every fetched record lands in exactly one of {@code policiesCreated},
 * {@code policiesExisting}, {@code recordsSkipped} or {@code recordsDuplicate}; the first few errors are kept
 * in {@code errors}.
 */
@Value
@Builder
public class EnrichmentResult {
    Long carrierUsdot;
    String carrierName;
    EnrichmentOutcome outcome;
    int recordsFetched;
    int policiesCreated;
    /** Policies that were already stored (re-run). */
    int policiesExisting;
    int recordsSkipped;
    /** Records mapping to a policy id already seen in the same fetch. */
    int recordsDuplicate;
    int eventsCreated;
    /** Gaps over 30 days between consecutive policies. */
    int gapsFound;
    List<ComplianceViolation> complianceViolations;
    Set<FraudIndicator> fraudIndicators;
    List<String> errors;
    int totalErrors;

    public static EnrichmentResult of(Long usdot, EnrichmentOutcome outcome, String error) {
        return EnrichmentResult.builder()
                .carrierUsdot(usdot)
                .outcome(outcome)
                .complianceViolations(List.of())
                .fraudIndicators(Set.of())
                .errors(error != null ? List.of(error) : List.of())
                .totalErrors(error != null ? 1 : 0)
                .build();
    }
}
