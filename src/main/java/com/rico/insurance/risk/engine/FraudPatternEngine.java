package com.rico.insurance.risk.engine;

import com.rico.insurance.detection.CarrierGapSummary;
import com.rico.insurance.detection.CoverageGap;
import com.rico.insurance.detection.CoverageGapDetector;
import com.rico.insurance.domain.CargoType;
import com.rico.insurance.domain.CoverageStatus;
import com.rico.insurance.domain.FilingStatus;
import com.rico.insurance.domain.InsuranceEventType;
import com.rico.insurance.exception.NotFoundException;
import com.rico.insurance.persistence.entity.CarrierEntity;
import com.rico.insurance.persistence.entity.CarrierOfficerLinkEntity;
import com.rico.insurance.persistence.entity.InsurancePolicyEntity;
import com.rico.insurance.persistence.entity.PersonEntity;
import com.rico.insurance.persistence.repository.CarrierOfficerLinkRepository;
import com.rico.insurance.persistence.repository.CarrierRepository;
import com.rico.insurance.persistence.repository.InsuranceEventRepository;
import com.rico.insurance.persistence.repository.InsurancePolicyRepository;
import com.rico.insurance.persistence.repository.PersonRepository;
import com.rico.insurance.risk.domain.CarrierRiskScore;
import com.rico.insurance.risk.domain.ChameleonPattern;
import com.rico.insurance.risk.domain.InsuranceStatistics;
import com.rico.insurance.risk.domain.RiskFactor;
import com.rico.insurance.risk.domain.ShoppingPattern;
import com.rico.insurance.risk.domain.UnderinsuredCarrier;
import com.rico.insurance.temporal.TemporalIntervals;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Carrier-level fraud analytics: additive risk scores, insurance shopping, underinsurance against cargo
 * minimums, and chameleon-carrier candidates (shared officer plus shared insurer).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FraudPatternEngine {

    static final double MAX_SCORE = 100.0;
    static final double SHOPPING_POINTS = 25.0;
    static final double CANCELLATION_POINTS = 10.0;
    static final double CANCELLATION_CAP = 25.0;
    static final double COMPLIANCE_POINTS = 25.0;
    static final double MAJOR_GAP_POINTS = 25.0;
    static final double MINOR_GAP_POINTS = 15.0;
    static final int SHOPPING_PROVIDER_THRESHOLD = 3;
    static final int MAJOR_GAP_DAYS = 30;
    static final int MINOR_GAP_DAYS = 7;
    static final double HIGH_RISK_SCORE = 50.0;
    private static final int TOP_RISKS = 5;

    private final CarrierRepository carrierRepository;
    private final InsurancePolicyRepository policyRepository;
    private final InsuranceEventRepository eventRepository;
    private final CarrierOfficerLinkRepository officerLinkRepository;
    private final PersonRepository personRepository;
    private final CoverageGapDetector gapDetector;
    private final Clock clock;

    @Value("${rico.fraud.shopping-window-months:12}")
    private int shoppingWindowMonths = 12;

    @Value("${rico.fraud.shopping-min-providers:3}")
    private int shoppingMinProviders = 3;

    /**
     * Risk score in [0, 100]. A carrier without any policy scores 100; otherwise the score is the sum of
     * capped components, each reported as a {@link RiskFactor}.
     */
    @Transactional(readOnly = true)
    public CarrierRiskScore riskScore(Long usdot) {
        CarrierEntity carrier = carrierRepository.findById(usdot)
                .orElseThrow(() -> new NotFoundException("Carrier", usdot));
        return score(carrier);
    }

    /**
     * Scores of every carrier with a non-zero score, highest first.
     */
    @Transactional(readOnly = true)
    public List<CarrierRiskScore> riskScores(int limit) {
        return carrierRepository.findAll().stream()
                .map(this::score)
                .filter(s -> s.getScore() > 0)
                .sorted(Comparator.comparingDouble(CarrierRiskScore::getScore).reversed()
                        .thenComparing(CarrierRiskScore::getCarrierUsdot))
                .limit(limit)
                .collect(Collectors.toList());
    }

    private CarrierRiskScore score(CarrierEntity carrier) {
        Long usdot = carrier.getUsdot();
        long policyCount = policyRepository.countByCarrierUsdot(usdot);
        if (policyCount == 0) {
            return CarrierRiskScore.builder()
                    .carrierUsdot(usdot)
                    .carrierName(carrier.getCarrierName())
                    .score(MAX_SCORE)
                    .factors(List.of(RiskFactor.builder()
                            .name("no policy")
                            .points(MAX_SCORE)
                            .detail("No insurance policy on record")
                            .build()))
                    .build();
        }

        List<RiskFactor> factors = new ArrayList<>();
        long providerCount = policyRepository.countDistinctProvidersByCarrier(usdot);
        if (providerCount > SHOPPING_PROVIDER_THRESHOLD) {
            factors.add(factor("multiple providers", SHOPPING_POINTS, providerCount + " distinct providers"));
        }

        long cancellations = eventRepository.countByCarrierUsdotAndEventType(usdot, InsuranceEventType.CANCELLATION);
        if (cancellations > 0) {
            double points = Math.min(CANCELLATION_POINTS * cancellations, CANCELLATION_CAP);
            factors.add(factor("cancellations", points, cancellations + " cancellations"));
        }

        boolean complianceViolation = eventRepository.existsByCarrierUsdotAndComplianceViolationTrue(usdot);
        if (complianceViolation) {
            factors.add(factor("compliance violation", COMPLIANCE_POINTS, "Compliance violation on record"));
        }

        int maxGap = gapDetector.maxGapDays(usdot);
        if (maxGap > MAJOR_GAP_DAYS) {
            factors.add(factor("coverage gap", MAJOR_GAP_POINTS, "Max gap " + maxGap + " days"));
        } else if (maxGap > MINOR_GAP_DAYS) {
            factors.add(factor("coverage gap", MINOR_GAP_POINTS, "Max gap " + maxGap + " days"));
        }

        double total = factors.stream().mapToDouble(RiskFactor::getPoints).sum();
        total = Math.max(0.0, Math.min(MAX_SCORE, total));
        log.debug("Risk score: usdot={}, score={}, factors={}", usdot, total, factors.size());
        return CarrierRiskScore.builder()
                .carrierUsdot(usdot)
                .carrierName(carrier.getCarrierName())
                .score(total)
                .factors(factors)
                .policyCount(policyCount)
                .providerCount(providerCount)
                .cancellationCount(cancellations)
                .maxGapDays(maxGap)
                .complianceViolation(complianceViolation)
                .build();
    }

    /**
     * Carriers with at least {@code minProviderCount} distinct providers on policies effective in the
     * trailing {@code monthsWindow} months, most providers first.
     */
    @Transactional(readOnly = true)
    public List<ShoppingPattern> detectShopping(int monthsWindow, int minProviderCount) {
        if (monthsWindow <= 0) {
            throw new IllegalArgumentException("monthsWindow must be positive: " + monthsWindow);
        }
        LocalDate since = LocalDate.now(clock).minusMonths(monthsWindow);
        Map<Long, List<InsurancePolicyEntity>> byCarrier = policyRepository
                .findByEffectiveDateGreaterThanEqualOrderByCarrierUsdotAscEffectiveDateAsc(since).stream()
                .collect(Collectors.groupingBy(InsurancePolicyEntity::getCarrierUsdot, LinkedHashMap::new, Collectors.toList()));
        Map<Long, String> names = carrierNames(byCarrier.keySet());

        List<ShoppingPattern> patterns = new ArrayList<>();
        for (Map.Entry<Long, List<InsurancePolicyEntity>> entry : byCarrier.entrySet()) {
            List<InsurancePolicyEntity> policies = entry.getValue();
            List<String> providers = policies.stream()
                    .map(InsurancePolicyEntity::getProviderName)
                    .distinct()
                    .sorted()
                    .collect(Collectors.toList());
            if (providers.size() < minProviderCount) {
                continue;
            }
            patterns.add(ShoppingPattern.builder()
                    .carrierUsdot(entry.getKey())
                    .carrierName(names.get(entry.getKey()))
                    .providerCount(providers.size())
                    .providers(providers)
                    .policyCount(policies.size())
                    .firstPolicyDate(policies.get(0).getEffectiveDate())
                    .lastPolicyDate(policies.get(policies.size() - 1).getEffectiveDate())
                    .monthsWindow(monthsWindow)
                    .riskScore((double) providers.size() / monthsWindow)
                    .build());
        }
        patterns.sort(Comparator.comparingInt(ShoppingPattern::getProviderCount).reversed()
                .thenComparing(ShoppingPattern::getCarrierUsdot));
        return patterns;
    }

    /**
     * Active policies whose coverage is below the minimum for the cargo type, largest shortage first.
     * Unknown cargo types use the general-freight minimum.
     */
    @Transactional(readOnly = true)
    public List<UnderinsuredCarrier> detectUnderinsured(String cargoType) {
        BigDecimal minimum = CargoType.minimumFor(cargoType);
        LocalDate today = LocalDate.now(clock);
        List<InsurancePolicyEntity> policies = policyRepository
                .findByFilingStatusAndCoverageAmountLessThan(FilingStatus.ACTIVE, minimum).stream()
                .filter(p -> TemporalIntervals.status(p.getCancellationDate(), p.getExpirationDate(), today)
                        == CoverageStatus.ACTIVE)
                .collect(Collectors.toList());
        Map<Long, String> names = carrierNames(policies.stream()
                .map(InsurancePolicyEntity::getCarrierUsdot).collect(Collectors.toSet()));

        return policies.stream()
                .map(p -> UnderinsuredCarrier.builder()
                        .carrierUsdot(p.getCarrierUsdot())
                        .carrierName(names.get(p.getCarrierUsdot()))
                        .policyId(p.getPolicyId())
                        .providerName(p.getProviderName())
                        .cargoType(cargoType)
                        .coverageAmount(p.getCoverageAmount())
                        .requiredMinimum(minimum)
                        .shortage(minimum.subtract(p.getCoverageAmount()))
                        .build())
                .sorted(Comparator.comparing(UnderinsuredCarrier::getShortage).reversed()
                        .thenComparing(UnderinsuredCarrier::getCarrierUsdot))
                .collect(Collectors.toList());
    }

    /**
     * Pairs of distinct carriers that share an officer and at least one insurer. Each unordered pair is
     * reported once, lower USDOT first, listing every shared officer.
     */
    @Transactional(readOnly = true)
    public List<ChameleonPattern> detectChameleonPatterns() {
        Map<String, Set<Long>> carriersByOfficer = officerLinkRepository.findAll().stream()
                .collect(Collectors.groupingBy(CarrierOfficerLinkEntity::getPersonId,
                        Collectors.mapping(CarrierOfficerLinkEntity::getCarrierUsdot, Collectors.toCollection(TreeSet::new))));

        Map<CarrierPair, Set<String>> officersByPair = new TreeMap<>();
        for (Map.Entry<String, Set<Long>> entry : carriersByOfficer.entrySet()) {
            List<Long> usdots = new ArrayList<>(entry.getValue());
            for (int i = 0; i < usdots.size(); i++) {
                for (int j = i + 1; j < usdots.size(); j++) {
                    officersByPair.computeIfAbsent(new CarrierPair(usdots.get(i), usdots.get(j)), k -> new TreeSet<>())
                            .add(entry.getKey());
                }
            }
        }
        if (officersByPair.isEmpty()) {
            return List.of();
        }

        Set<Long> involved = new HashSet<>();
        officersByPair.keySet().forEach(p -> {
            involved.add(p.getLow());
            involved.add(p.getHigh());
        });
        Map<Long, Set<String>> providersByCarrier = policyRepository.findByCarrierUsdotInOrderByEffectiveDateAsc(involved).stream()
                .collect(Collectors.groupingBy(InsurancePolicyEntity::getCarrierUsdot,
                        Collectors.mapping(InsurancePolicyEntity::getProviderName, Collectors.toCollection(TreeSet::new))));
        Map<Long, CarrierEntity> carriers = carrierRepository.findAllById(involved).stream()
                .collect(Collectors.toMap(CarrierEntity::getUsdot, c -> c));
        Map<String, String> officerNames = personRepository.findAllById(carriersByOfficer.keySet()).stream()
                .collect(Collectors.toMap(PersonEntity::getPersonId, PersonEntity::getFullName));

        List<ChameleonPattern> patterns = new ArrayList<>();
        for (Map.Entry<CarrierPair, Set<String>> entry : officersByPair.entrySet()) {
            CarrierPair pair = entry.getKey();
            Set<String> shared = new TreeSet<>(providersByCarrier.getOrDefault(pair.getLow(), Set.of()));
            shared.retainAll(providersByCarrier.getOrDefault(pair.getHigh(), Set.of()));
            if (shared.isEmpty()) {
                continue;
            }
            List<String> officers = entry.getValue().stream()
                    .map(id -> officerNames.getOrDefault(id, id))
                    .sorted()
                    .collect(Collectors.toList());
            CarrierEntity first = carriers.get(pair.getLow());
            CarrierEntity second = carriers.get(pair.getHigh());
            patterns.add(ChameleonPattern.builder()
                    .carrier1Usdot(pair.getLow())
                    .carrier1Name(first != null ? first.getCarrierName() : null)
                    .carrier2Usdot(pair.getHigh())
                    .carrier2Name(second != null ? second.getCarrierName() : null)
                    .sharedOfficer(officers.get(0))
                    .sharedOfficers(officers)
                    .sharedProviderCount(shared.size())
                    .sharedProviders(new ArrayList<>(shared))
                    .carrier1Violations(first != null ? first.getViolations() : null)
                    .carrier2Violations(second != null ? second.getViolations() : null)
                    .build());
        }
        patterns.sort(Comparator.comparingInt(ChameleonPattern::getSharedProviderCount).reversed());
        log.info("Chameleon candidates: pairsSharingOfficer={}, withSharedProvider={}", officersByPair.size(), patterns.size());
        return patterns;
    }

    /**
     * Stability from provider changes in the last year: none 1.0, one 0.8, two 0.5, more 0.2.
     */
    @Transactional(readOnly = true)
    public double providerStabilityScore(Long usdot) {
        LocalDate since = LocalDate.now(clock).minusDays(365);
        long changes = eventRepository.countSince(usdot, InsuranceEventType.PROVIDER_CHANGE, since);
        if (changes == 0) {
            return 1.0;
        } else if (changes == 1) {
            return 0.8;
        } else if (changes == 2) {
            return 0.5;
        }
        return 0.2;
    }

    @Transactional(readOnly = true)
    public InsuranceStatistics insuranceStatistics() {
        List<CarrierGapSummary> gapSummaries = gapDetector.carriersWithCoverageGaps(MAJOR_GAP_DAYS + 1);
        double averageGap = gapSummaries.stream()
                .flatMap(s -> s.getGaps().stream())
                .mapToInt(CoverageGap::getGapDays)
                .average()
                .orElse(0.0);
        int underinsured = (int) detectUnderinsured(null).stream()
                .map(UnderinsuredCarrier::getCarrierUsdot)
                .distinct()
                .count();
        List<CarrierRiskScore> scores = riskScores(Integer.MAX_VALUE);
        int highRisk = (int) scores.stream().filter(s -> s.getScore() > HIGH_RISK_SCORE).count();

        return InsuranceStatistics.builder()
                .carrierCount(carrierRepository.count())
                .carriersWithGaps(gapSummaries.size())
                .averageGapDays(averageGap)
                .shoppingCarriers(detectShopping(shoppingWindowMonths, shoppingMinProviders).size())
                .underinsuredCarriers(underinsured)
                .highRiskCarriers(highRisk)
                .topRisks(scores.stream().limit(TOP_RISKS).collect(Collectors.toList()))
                .build();
    }

    private Map<Long, String> carrierNames(Collection<Long> usdots) {
        Map<Long, String> names = new HashMap<>();
        for (CarrierEntity carrier : carrierRepository.findAllById(usdots)) {
            names.put(carrier.getUsdot(), carrier.getCarrierName());
        }
        return names;
    }

    private static RiskFactor factor(String name, double points, String detail) {
        return RiskFactor.builder().name(name).points(points).detail(detail).build();
    }

    private static final class CarrierPair implements Comparable<CarrierPair> {
        private final Long low;
        private final Long high;

        CarrierPair(Long low, Long high) {
            this.low = low;
            this.high = high;
        }

        Long getLow() {
            return low;
        }

        Long getHigh() {
            return high;
        }

        @Override
        public int compareTo(CarrierPair other) {
            int cmp = low.compareTo(other.low);
            return cmp != 0 ? cmp : high.compareTo(other.high);
        }
    }
}
