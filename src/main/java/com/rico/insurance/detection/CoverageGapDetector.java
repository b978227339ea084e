package com.rico.insurance.detection;

import com.rico.insurance.persistence.entity.CarrierEntity;
import com.rico.insurance.persistence.entity.CoveragePeriodEntity;
import com.rico.insurance.persistence.entity.InsurancePolicyEntity;
import com.rico.insurance.persistence.repository.CarrierRepository;
import com.rico.insurance.persistence.repository.CoveragePeriodRepository;
import com.rico.insurance.persistence.repository.InsurancePolicyRepository;
import com.rico.insurance.temporal.CoverageInterval;
import com.rico.insurance.temporal.TemporalIntervals;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Derives coverage gaps, overlaps and uncovered-day counts from the carriers' coverage periods.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CoverageGapDetector {

    private final CoveragePeriodRepository coveragePeriodRepository;
    private final InsurancePolicyRepository policyRepository;
    private final CarrierRepository carrierRepository;
    private final Clock clock;

    /**
     * Gaps between adjacent coverage periods (ordered by from date) of at least {@code minGapDays} days,
     * largest first. Zero-day gaps are never reported.
     */
    @Transactional(readOnly = true)
    public List<CoverageGap> detectGaps(Long usdot, int minGapDays) {
        List<CoveragePeriodEntity> periods = coveragePeriodRepository.findByCarrierUsdotOrderByFromDateAscIdAsc(usdot);
        List<CoverageGap> gaps = gapsBetween(periods, providerNames(periods), minGapDays);
        log.debug("Detected gaps: usdot={}, minGapDays={}, gaps={}", usdot, minGapDays, gaps.size());
        return gaps;
    }

    /** Largest gap for the carrier, 0 when it has none. */
    @Transactional(readOnly = true)
    public int maxGapDays(Long usdot) {
        return detectGaps(usdot, 1).stream().mapToInt(CoverageGap::getGapDays).max().orElse(0);
    }

    @Transactional(readOnly = true)
    public List<CoverageOverlap> detectOverlaps(Long usdot) {
        return overlapsWithin(usdot, coveragePeriodRepository.findByCarrierUsdotOrderByFromDateAscIdAsc(usdot));
    }

    /**
     * Overlaps across every carrier.
     */
    @Transactional(readOnly = true)
    public List<CoverageOverlap> detectAllOverlaps() {
        List<CoverageOverlap> overlaps = new ArrayList<>();
        byCarrier(coveragePeriodRepository.findAllByOrderByCarrierUsdotAscIdAsc())
                .forEach((usdot, periods) -> overlaps.addAll(overlapsWithin(usdot, periods)));
        return overlaps;
    }

    @Transactional(readOnly = true)
    public int daysWithoutCoverage(Long usdot, LocalDate windowStart, LocalDate windowEnd) {
        return coverageAccounting(usdot, windowStart, windowEnd).getUncoveredDays();
    }

    /**
     * Covered and uncovered days in {@code [windowStart, windowEnd)}. Overlapping periods are merged first
     * and an open-ended period covers the rest of the window.
     */
    @Transactional(readOnly = true)
    public CoverageAccounting coverageAccounting(Long usdot, LocalDate windowStart, LocalDate windowEnd) {
        if (windowEnd.isBefore(windowStart)) {
            throw new IllegalArgumentException("windowEnd " + windowEnd + " precedes windowStart " + windowStart);
        }
        List<CoverageInterval> intervals = coveragePeriodRepository.findByCarrierUsdotOrderByFromDateAscIdAsc(usdot)
                .stream()
                .map(p -> CoverageInterval.of(p.getFromDate(), p.getToDate()))
                .collect(Collectors.toList());
        int windowDays = TemporalIntervals.windowLength(windowStart, windowEnd);
        int covered = TemporalIntervals.coveredDays(intervals, windowStart, windowEnd);
        return CoverageAccounting.builder()
                .carrierUsdot(usdot)
                .windowStart(windowStart)
                .windowEnd(windowEnd)
                .windowDays(windowDays)
                .coveredDays(covered)
                .uncoveredDays(windowDays - covered)
                .build();
    }

    /**
     * Carriers with no coverage period in force on the given date.
     */
    @Transactional(readOnly = true)
    public List<CarrierEntity> carriersWithoutInsuranceOn(LocalDate date) {
        Set<Long> covered = new HashSet<>(coveragePeriodRepository.findCarriersCoveredOn(date));
        return carrierRepository.findAll().stream()
                .filter(c -> !covered.contains(c.getUsdot()))
                .sorted(Comparator.comparing(CarrierEntity::getUsdot))
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<CoveragePeriodView> coverageTimeline(Long usdot) {
        List<CoveragePeriodEntity> periods = coveragePeriodRepository.findByCarrierUsdotOrderByFromDateAscIdAsc(usdot);
        Map<String, InsurancePolicyEntity> policies = policiesById(periods);
        return periods.stream()
                .map(p -> {
                    InsurancePolicyEntity policy = policies.get(p.getPolicyId());
                    return CoveragePeriodView.builder()
                            .policyId(p.getPolicyId())
                            .providerName(policy != null ? policy.getProviderName() : null)
                            .coverageAmount(policy != null ? policy.getCoverageAmount() : null)
                            .fromDate(p.getFromDate())
                            .toDate(p.getToDate())
                            .status(p.getStatus())
                            .durationDays(p.getDurationDays())
                            .build();
                })
                .collect(Collectors.toList());
    }

    /**
     * Per-carrier gap aggregates for every carrier with at least one gap of {@code minGapDays}, ordered by
     * largest gap.
     */
    @Transactional(readOnly = true)
    public List<CarrierGapSummary> carriersWithCoverageGaps(int minGapDays) {
        Map<Long, List<CoveragePeriodEntity>> grouped = byCarrier(coveragePeriodRepository.findAllByOrderByCarrierUsdotAscIdAsc());
        Map<Long, String> names = carrierRepository.findAllById(grouped.keySet()).stream()
                .collect(Collectors.toMap(CarrierEntity::getUsdot, c -> c.getCarrierName() != null ? c.getCarrierName() : ""));

        List<CarrierGapSummary> summaries = new ArrayList<>();
        for (Map.Entry<Long, List<CoveragePeriodEntity>> entry : grouped.entrySet()) {
            List<CoveragePeriodEntity> periods = new ArrayList<>(entry.getValue());
            periods.sort(Comparator.comparing(CoveragePeriodEntity::getFromDate).thenComparing(CoveragePeriodEntity::getId));
            List<CoverageGap> gaps = gapsBetween(periods, providerNames(periods), minGapDays);
            if (gaps.isEmpty()) {
                continue;
            }
            summaries.add(CarrierGapSummary.builder()
                    .carrierUsdot(entry.getKey())
                    .carrierName(names.get(entry.getKey()))
                    .gapCount(gaps.size())
                    .maxGapDays(gaps.get(0).getGapDays())
                    .totalGapDays(gaps.stream().mapToInt(CoverageGap::getGapDays).sum())
                    .gaps(gaps)
                    .build());
        }
        summaries.sort(Comparator.comparingInt(CarrierGapSummary::getMaxGapDays).reversed());
        return summaries;
    }

    private List<CoverageGap> gapsBetween(List<CoveragePeriodEntity> periods, Map<String, String> providers, int minGapDays) {
        List<CoverageGap> gaps = new ArrayList<>();
        for (int i = 1; i < periods.size(); i++) {
            CoveragePeriodEntity earlier = periods.get(i - 1);
            CoveragePeriodEntity later = periods.get(i);
            Integer gapDays = TemporalIntervals.gapDays(earlier.getToDate(), later.getFromDate());
            if (gapDays == null || gapDays <= 0 || gapDays < minGapDays) {
                continue;
            }
            gaps.add(CoverageGap.builder()
                    .carrierUsdot(later.getCarrierUsdot())
                    .fromPolicyId(earlier.getPolicyId())
                    .toPolicyId(later.getPolicyId())
                    .gapStart(earlier.getToDate())
                    .gapEnd(later.getFromDate())
                    .gapDays(gapDays)
                    .fromProvider(providers.get(earlier.getPolicyId()))
                    .toProvider(providers.get(later.getPolicyId()))
                    .build());
        }
        gaps.sort(Comparator.comparingInt(CoverageGap::getGapDays).reversed());
        return gaps;
    }

    /**
     * Every unordered pair once: pairs are taken in creation order, then oriented so the earlier start is first.
     */
    private List<CoverageOverlap> overlapsWithin(Long usdot, List<CoveragePeriodEntity> periods) {
        LocalDate today = LocalDate.now(clock);
        List<CoveragePeriodEntity> byCreation = new ArrayList<>(periods);
        byCreation.sort(Comparator.comparing(CoveragePeriodEntity::getId));

        List<CoverageOverlap> overlaps = new ArrayList<>();
        for (int i = 0; i < byCreation.size(); i++) {
            for (int j = i + 1; j < byCreation.size(); j++) {
                CoveragePeriodEntity first = byCreation.get(i);
                CoveragePeriodEntity second = byCreation.get(j);
                if (second.getFromDate().isBefore(first.getFromDate())) {
                    CoveragePeriodEntity swap = first;
                    first = second;
                    second = swap;
                }
                CoverageInterval a = CoverageInterval.of(first.getFromDate(), first.getToDate());
                CoverageInterval b = CoverageInterval.of(second.getFromDate(), second.getToDate());
                if (!TemporalIntervals.overlaps(a, b)) {
                    continue;
                }
                int days = TemporalIntervals.overlapDays(a, b, today);
                overlaps.add(CoverageOverlap.builder()
                        .carrierUsdot(usdot)
                        .firstPolicyId(first.getPolicyId())
                        .secondPolicyId(second.getPolicyId())
                        .overlapStart(b.getFrom())
                        .overlapEnd(b.getFrom().plusDays(days))
                        .overlapDays(days)
                        .build());
            }
        }
        return overlaps;
    }

    private Map<String, String> providerNames(List<CoveragePeriodEntity> periods) {
        return policiesById(periods).values().stream()
                .collect(Collectors.toMap(InsurancePolicyEntity::getPolicyId, InsurancePolicyEntity::getProviderName));
    }

    private Map<String, InsurancePolicyEntity> policiesById(List<CoveragePeriodEntity> periods) {
        Set<String> ids = periods.stream().map(CoveragePeriodEntity::getPolicyId).collect(Collectors.toSet());
        if (ids.isEmpty()) {
            return Map.of();
        }
        return policyRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(InsurancePolicyEntity::getPolicyId, Function.identity()));
    }

    private static Map<Long, List<CoveragePeriodEntity>> byCarrier(List<CoveragePeriodEntity> periods) {
        return periods.stream().collect(Collectors.groupingBy(CoveragePeriodEntity::getCarrierUsdot,
                LinkedHashMap::new, Collectors.toList()));
    }
}
