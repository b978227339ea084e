package com.rico.insurance.persistence.service;

import com.rico.insurance.persistence.entity.InsuranceProviderEntity;
import com.rico.insurance.persistence.repository.CarrierProviderLinkRepository;
import com.rico.insurance.persistence.repository.InsuranceProviderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.Optional;

/**
 * Insurance providers are get-or-create singletons keyed by name.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InsuranceProviderService {

    private static final String ID_PREFIX = "PROV-";

    private final InsuranceProviderRepository providerRepository;
    private final CarrierProviderLinkRepository carrierProviderLinkRepository;

    /**
     * Returns the provider with this name, creating it on first reference. A concurrent create of the same
     * name is absorbed by re-reading the winner.
     */
    public InsuranceProviderEntity getOrCreate(String name, String dataSource) {
        Optional<InsuranceProviderEntity> existing = providerRepository.findByName(name);
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            InsuranceProviderEntity created = providerRepository.saveAndFlush(InsuranceProviderEntity.builder()
                    .providerId(uniqueProviderId(name))
                    .name(name)
                    .dataSource(dataSource)
                    .build());
            log.info("Created insurance provider: providerId={}, name={}", created.getProviderId(), name);
            return created;
        } catch (DataIntegrityViolationException e) {
            log.warn("Provider created concurrently, re-reading: name={}", name);
            return providerRepository.findByName(name)
                    .orElseThrow(() -> e);
        }
    }

    @Transactional(readOnly = true)
    public Optional<InsuranceProviderEntity> findByName(String name) {
        return providerRepository.findByName(name);
    }

    /**
     * Recomputes total_carriers_insured from INSURED_BY links.
     */
    @Transactional
    public int recomputeCarrierCount(String name) {
        return providerRepository.findByName(name)
                .map(provider -> {
                    int count = (int) carrierProviderLinkRepository.countCarriersByProvider(provider.getProviderId());
                    provider.setTotalCarriersInsured(count);
                    providerRepository.save(provider);
                    log.debug("Recomputed provider carrier count: name={}, carriers={}", name, count);
                    return count;
                })
                .orElse(0);
    }

    private String uniqueProviderId(String name) {
        String base = providerId(name);
        String candidate = base;
        int suffix = 2;
        while (providerRepository.existsById(candidate)) {
            candidate = base + "-" + suffix++;
        }
        return candidate;
    }

    /** PROV-{name without spaces, upper case, first 10 chars}. */
    public static String providerId(String name) {
        String compact = name.replace(" ", "").toUpperCase(Locale.ROOT);
        return ID_PREFIX + compact.substring(0, Math.min(10, compact.length()));
    }
}
