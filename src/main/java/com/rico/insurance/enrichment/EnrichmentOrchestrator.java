package com.rico.insurance.enrichment;

import com.rico.insurance.client.ComplianceCheck;
import com.rico.insurance.client.ComplianceViolation;
import com.rico.insurance.client.InsuranceDataProvider;
import com.rico.insurance.client.RawInsuranceRecord;
import com.rico.insurance.config.RicoProperties;
import com.rico.insurance.domain.FraudIndicator;
import com.rico.insurance.domain.InsuranceEvent;
import com.rico.insurance.domain.InsurancePolicy;
import com.rico.insurance.exception.DataQualityException;
import com.rico.insurance.exception.DuplicateKeyException;
import com.rico.insurance.exception.ExternalProviderException;
import com.rico.insurance.exception.NotFoundException;
import com.rico.insurance.exception.PolicyValidationException;
import com.rico.insurance.graph.CoverageRelationshipService;
import com.rico.insurance.persistence.entity.CarrierEntity;
import com.rico.insurance.persistence.service.CarrierPersistenceService;
import com.rico.insurance.persistence.service.InsurancePersistenceService;
import com.rico.insurance.persistence.service.InsuranceProviderService;
import com.rico.insurance.risk.domain.ProviderShoppingAnalysis;
import com.rico.insurance.risk.engine.EventPatternDetector;
import com.rico.insurance.temporal.TemporalIntervals;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Pulls a carrier's filings from the insurance-data provider and materializes them: policies, coverage
 * periods, provider and succession links, and derived events. Re-running for the same carrier creates
 * nothing new. Runs of the same carrier are serialized.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EnrichmentOrchestrator {

    static final int COMPLIANCE_GAP_DAYS = 30;
    static final int SHOPPING_WINDOW_MONTHS = 12;

    private final InsuranceDataProvider dataProvider;
    private final InsuranceRecordMapper recordMapper;
    private final InsuranceEventDeriver eventDeriver;
    private final InsurancePersistenceService insuranceStore;
    private final CarrierPersistenceService carrierStore;
    private final InsuranceProviderService providerService;
    private final CoverageRelationshipService relationships;
    private final EventPatternDetector patternDetector;
    private final CarrierLockRegistry lockRegistry;
    private final RicoProperties properties;
    private final Clock clock;

    public EnrichmentResult enrichCarrier(Long usdot) {
        return lockRegistry.withLock(usdot, () -> enrich(usdot));
    }

    private EnrichmentResult enrich(Long usdot) {
        Optional<CarrierEntity> carrier = carrierStore.getCarrier(usdot);
        if (carrier.isEmpty()) {
            log.warn("Enrichment skipped, unknown carrier: usdot={}", usdot);
            return EnrichmentResult.of(usdot, EnrichmentOutcome.CARRIER_NOT_FOUND, "Carrier not found: " + usdot);
        }

        List<RawInsuranceRecord> records;
        try {
            records = dataProvider.fetchInsuranceHistory(usdot);
        } catch (ExternalProviderException e) {
            log.error("Insurance history unavailable: usdot={}", usdot, e);
            return EnrichmentResult.of(usdot, EnrichmentOutcome.FAILED, e.getMessage());
        }
        if (records.isEmpty()) {
            log.info("No insurance data: usdot={}", usdot);
            return EnrichmentResult.of(usdot, EnrichmentOutcome.NO_DATA, null);
        }

        String source = dataProvider.getSourceName();
        ErrorLog errors = new ErrorLog(properties.getEnrichment().getMaxErrorDetails());
        int skipped = 0;
        int duplicates = 0;

        Map<String, InsurancePolicy> mapped = new LinkedHashMap<>();
        for (RawInsuranceRecord record : records) {
            try {
                InsurancePolicy policy = recordMapper.toPolicy(usdot, record, source);
                if (mapped.putIfAbsent(policy.getPolicyId(), policy) != null) {
                    duplicates++;
                    errors.add("Record " + record.getId() + ": duplicate of policy " + policy.getPolicyId());
                    log.debug("Duplicate record: usdot={}, recordId={}, policyId={}", usdot, record.getId(), policy.getPolicyId());
                }
            } catch (DataQualityException e) {
                skipped++;
                errors.add("Record " + record.getId() + ": " + e.getMessage());
                log.warn("Skipping unmappable record: usdot={}, recordId={}, reason={}", usdot, record.getId(), e.getMessage());
            }
        }

        mapped.values().stream()
                .map(InsurancePolicy::getProviderName)
                .distinct()
                .forEach(name -> providerService.getOrCreate(name, source));

        int created = 0;
        int existing = 0;
        for (InsurancePolicy policy : mapped.values()) {
            try {
                if (insuranceStore.policyExists(policy.getPolicyId())) {
                    existing++;
                } else {
                    insuranceStore.createPolicy(policy);
                    created++;
                }
            } catch (DuplicateKeyException e) {
                existing++;
            } catch (PolicyValidationException e) {
                skipped++;
                errors.add("Policy " + policy.getPolicyId() + ": " + e.getMessage());
                log.warn("Skipping invalid policy: usdot={}, policyId={}, reason={}", usdot, policy.getPolicyId(), e.getMessage());
                continue;
            }
            relationships.linkCoveragePeriod(policy.getPolicyId(), usdot, policy.getEffectiveDate(), policy.getEndDate());
            relationships.linkProvider(policy.getPolicyId(), policy.getProviderName());
        }

        List<InsurancePolicy> sorted = insuranceStore.listPoliciesForCarrier(usdot);
        List<ComplianceViolation> violations = new ArrayList<>();
        int gapsFound = 0;
        for (int i = 1; i < sorted.size(); i++) {
            InsurancePolicy earlier = sorted.get(i - 1);
            InsurancePolicy later = sorted.get(i);
            Integer gap = TemporalIntervals.gapDays(earlier, later);
            relationships.linkSuccession(earlier.getPolicyId(), later.getPolicyId(), gap);
            if (gap != null && gap > COMPLIANCE_GAP_DAYS) {
                gapsFound++;
                violations.add(ComplianceViolation.builder()
                        .type("COVERAGE_GAP")
                        .description(String.format("%d day coverage gap between %s and %s",
                                gap, earlier.getPolicyId(), later.getPolicyId()))
                        .severity("HIGH")
                        .build());
            }
        }

        Set<FraudIndicator> indicators = EnumSet.noneOf(FraudIndicator.class);
        int eventsCreated = 0;
        for (InsuranceEvent event : eventDeriver.derive(usdot, sorted, source)) {
            if (insuranceStore.eventExists(event.getEventId())) {
                continue;
            }
            try {
                insuranceStore.createEvent(event);
                eventsCreated++;
                indicators.addAll(event.getFraudIndicators());
            } catch (DuplicateKeyException e) {
                log.debug("Event already stored: usdot={}, eventId={}", usdot, event.getEventId());
            } catch (NotFoundException | PolicyValidationException e) {
                errors.add("Event " + event.getEventId() + ": " + e.getMessage());
                log.warn("Event not stored: usdot={}, eventId={}, reason={}", usdot, event.getEventId(), e.getMessage());
            }
        }

        ProviderShoppingAnalysis shopping = patternDetector.analyzeProviderShopping(
                sorted, SHOPPING_WINDOW_MONTHS, LocalDate.now(clock));
        if (shopping.isShopping()) {
            indicators.add(FraudIndicator.INSURANCE_SHOPPING);
        }

        try {
            ComplianceCheck compliance = dataProvider.fetchComplianceCheck(usdot);
            if (compliance != null && !compliance.isCompliant()) {
                violations.addAll(compliance.getViolations());
            }
        } catch (ExternalProviderException e) {
            errors.add("Compliance check: " + e.getMessage());
            log.warn("Compliance check unavailable: usdot={}, reason={}", usdot, e.getMessage());
        }

        if (!sorted.isEmpty()) {
            InsurancePolicy latest = sorted.get(sorted.size() - 1);
            relationships.linkCarrierToProvider(usdot, latest.getProviderName(), latest.getCoverageAmount());
            providerService.recomputeCarrierCount(latest.getProviderName());
        }

        log.info("Enriched carrier: usdot={}, records={}, policiesCreated={}, existing={}, skipped={}, duplicates={}, events={}, gaps={}, indicators={}",
                usdot, records.size(), created, existing, skipped, duplicates, eventsCreated, gapsFound, indicators);
        return EnrichmentResult.builder()
                .carrierUsdot(usdot)
                .carrierName(carrier.get().getCarrierName())
                .outcome(EnrichmentOutcome.ENRICHED)
                .recordsFetched(records.size())
                .policiesCreated(created)
                .policiesExisting(existing)
                .recordsSkipped(skipped)
                .recordsDuplicate(duplicates)
                .eventsCreated(eventsCreated)
                .gapsFound(gapsFound)
                .complianceViolations(violations)
                .fraudIndicators(indicators)
                .errors(errors.getDetails())
                .totalErrors(errors.getTotal())
                .build();
    }
}
