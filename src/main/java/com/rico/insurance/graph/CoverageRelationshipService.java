package com.rico.insurance.graph;

import com.rico.insurance.domain.CoverageStatus;
import com.rico.insurance.persistence.entity.CarrierEntity;
import com.rico.insurance.persistence.entity.CarrierProviderLinkEntity;
import com.rico.insurance.persistence.entity.CoveragePeriodEntity;
import com.rico.insurance.persistence.entity.InsurancePolicyEntity;
import com.rico.insurance.persistence.entity.InsuranceProviderEntity;
import com.rico.insurance.persistence.entity.PolicyProviderLinkEntity;
import com.rico.insurance.persistence.entity.PolicySuccessionEntity;
import com.rico.insurance.persistence.repository.CarrierProviderLinkRepository;
import com.rico.insurance.persistence.repository.CarrierRepository;
import com.rico.insurance.persistence.repository.CoveragePeriodRepository;
import com.rico.insurance.persistence.repository.InsurancePolicyRepository;
import com.rico.insurance.persistence.repository.PolicyProviderLinkRepository;
import com.rico.insurance.persistence.repository.PolicySuccessionRepository;
import com.rico.insurance.persistence.service.InsuranceProviderService;
import com.rico.insurance.temporal.TemporalIntervals;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Maintains the coverage-period (HAD_INSURANCE), provider (PROVIDED_BY, INSURED_BY) and succession
 * (PRECEDED_BY) links with upsert semantics. A link whose endpoint does not exist is a no-op returning false.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CoverageRelationshipService {

    private static final String DATA_SOURCE = "insurance_graph";

    private final CarrierRepository carrierRepository;
    private final InsurancePolicyRepository policyRepository;
    private final CoveragePeriodRepository coveragePeriodRepository;
    private final PolicyProviderLinkRepository policyProviderLinkRepository;
    private final PolicySuccessionRepository successionRepository;
    private final CarrierProviderLinkRepository carrierProviderLinkRepository;
    private final InsuranceProviderService providerService;
    private final Clock clock;

    /**
     * Creates the carrier's coverage period for the policy, or refreshes its end date, status and duration
     * when it already exists. Repeated calls leave exactly one period holding the last call's values.
     */
    public boolean linkCoveragePeriod(String policyId, Long usdot, LocalDate fromDate, LocalDate toDate) {
        if (usdot == null || !carrierRepository.existsById(usdot)) {
            log.debug("Coverage link skipped, carrier missing: usdot={}, policyId={}", usdot, policyId);
            return false;
        }
        Optional<InsurancePolicyEntity> policy = policyRepository.findById(policyId);
        if (policy.isEmpty()) {
            log.debug("Coverage link skipped, policy missing: usdot={}, policyId={}", usdot, policyId);
            return false;
        }
        LocalDate today = LocalDate.now(clock);
        CoverageStatus status = TemporalIntervals.status(policy.get().getCancellationDate(), toDate, today);

        try {
            upsertCoveragePeriod(usdot, policyId, fromDate, toDate, status);
        } catch (DataIntegrityViolationException e) {
            log.warn("Coverage period created concurrently, applying as update: usdot={}, policyId={}",
                    usdot, policyId);
            upsertCoveragePeriod(usdot, policyId, fromDate, toDate, status);
        }
        return true;
    }

    private void upsertCoveragePeriod(Long usdot, String policyId, LocalDate fromDate, LocalDate toDate,
                                      CoverageStatus status) {
        Optional<CoveragePeriodEntity> existingOpt = coveragePeriodRepository.findByCarrierUsdotAndPolicyId(usdot, policyId);
        CoveragePeriodEntity period;
        if (existingOpt.isPresent()) {
            period = existingOpt.get();
            period.setToDate(toDate);
            period.setStatus(status);
            period.setDurationDays(TemporalIntervals.durationDays(period.getFromDate(), toDate));
        } else {
            period = CoveragePeriodEntity.builder()
                    .carrierUsdot(usdot)
                    .policyId(policyId)
                    .fromDate(fromDate)
                    .toDate(toDate)
                    .status(status)
                    .durationDays(TemporalIntervals.durationDays(fromDate, toDate))
                    .build();
        }
        coveragePeriodRepository.saveAndFlush(period);
        log.debug("Upserted coverage period: usdot={}, policyId={}, to={}, status={}, durationDays={}",
                usdot, policyId, toDate, status, period.getDurationDays());
    }

    /**
     * Links a policy to its provider, creating the provider on first reference.
     */
    public boolean linkProvider(String policyId, String providerName) {
        if (providerName == null || providerName.isBlank() || !policyRepository.existsById(policyId)) {
            log.debug("Provider link skipped: policyId={}, provider={}", policyId, providerName);
            return false;
        }
        InsuranceProviderEntity provider = providerService.getOrCreate(providerName, DATA_SOURCE);
        if (!policyProviderLinkRepository.existsByPolicyIdAndProviderId(policyId, provider.getProviderId())) {
            try {
                policyProviderLinkRepository.saveAndFlush(PolicyProviderLinkEntity.builder()
                        .policyId(policyId)
                        .providerId(provider.getProviderId())
                        .build());
            } catch (DataIntegrityViolationException e) {
                log.warn("Provider link already created concurrently: policyId={}, provider={}", policyId, providerName);
            }
        }
        return true;
    }

    /**
     * Links a later policy to the one it replaced. An existing link is left as is.
     */
    public boolean linkSuccession(String earlierPolicyId, String laterPolicyId, Integer gapDays) {
        if (earlierPolicyId.equals(laterPolicyId)
                || !policyRepository.existsById(earlierPolicyId)
                || !policyRepository.existsById(laterPolicyId)) {
            log.debug("Succession link skipped: earlier={}, later={}", earlierPolicyId, laterPolicyId);
            return false;
        }
        if (successionRepository.findByPolicyIdAndPrecededByPolicyId(laterPolicyId, earlierPolicyId).isEmpty()) {
            try {
                successionRepository.saveAndFlush(PolicySuccessionEntity.builder()
                        .policyId(laterPolicyId)
                        .precededByPolicyId(earlierPolicyId)
                        .gapDays(gapDays)
                        .build());
                log.debug("Linked succession: later={}, earlier={}, gapDays={}", laterPolicyId, earlierPolicyId, gapDays);
            } catch (DataIntegrityViolationException e) {
                log.warn("Succession link already created concurrently: later={}, earlier={}", laterPolicyId, earlierPolicyId);
            }
        }
        return true;
    }

    /**
     * Points the carrier's INSURED_BY display cache at the provider and refreshes the denormalized
     * provider/amount on the carrier.
     */
    public boolean linkCarrierToProvider(Long usdot, String providerName, BigDecimal amount) {
        Optional<CarrierEntity> carrierOpt = usdot == null ? Optional.empty() : carrierRepository.findById(usdot);
        if (carrierOpt.isEmpty() || providerName == null || providerName.isBlank()) {
            return false;
        }
        InsuranceProviderEntity provider = providerService.getOrCreate(providerName, DATA_SOURCE);
        CarrierProviderLinkEntity link = carrierProviderLinkRepository
                .findByCarrierUsdotAndProviderId(usdot, provider.getProviderId())
                .orElseGet(() -> CarrierProviderLinkEntity.builder()
                        .carrierUsdot(usdot)
                        .providerId(provider.getProviderId())
                        .build());
        link.setAmount(amount);
        carrierProviderLinkRepository.save(link);

        CarrierEntity carrier = carrierOpt.get();
        carrier.setInsuranceProvider(providerName);
        carrier.setInsuranceAmount(amount);
        carrierRepository.save(carrier);
        return true;
    }
}
