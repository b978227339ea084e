package com.rico.insurance.persistence.service;

import com.rico.insurance.domain.CarrierPatch;
import com.rico.insurance.exception.DuplicateKeyException;
import com.rico.insurance.exception.NotFoundException;
import com.rico.insurance.persistence.entity.CarrierEntity;
import com.rico.insurance.persistence.entity.CarrierOfficerLinkEntity;
import com.rico.insurance.persistence.entity.PersonEntity;
import com.rico.insurance.persistence.repository.CarrierOfficerLinkRepository;
import com.rico.insurance.persistence.repository.CarrierProviderLinkRepository;
import com.rico.insurance.persistence.repository.CarrierRepository;
import com.rico.insurance.persistence.repository.CoveragePeriodRepository;
import com.rico.insurance.persistence.repository.PersonRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Carrier and officer store used by the insurance services to validate endpoints and join officers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CarrierPersistenceService {

    private final CarrierRepository carrierRepository;
    private final PersonRepository personRepository;
    private final CarrierOfficerLinkRepository officerLinkRepository;
    private final CarrierProviderLinkRepository carrierProviderLinkRepository;
    private final CoveragePeriodRepository coveragePeriodRepository;

    @Value("${rico.fraud.high-risk-oos-rate:0.2}")
    private double highRiskOosRate;

    @Value("${rico.fraud.high-risk-crashes:5}")
    private int highRiskCrashes;

    @Transactional(readOnly = true)
    public Optional<CarrierEntity> getCarrier(Long usdot) {
        return carrierRepository.findById(usdot);
    }

    @Transactional(readOnly = true)
    public boolean carrierExists(Long usdot) {
        return usdot != null && carrierRepository.existsById(usdot);
    }

    @Transactional
    public CarrierEntity createCarrier(CarrierEntity carrier) {
        if (carrierRepository.existsById(carrier.getUsdot())) {
            throw new DuplicateKeyException("Carrier already exists: " + carrier.getUsdot());
        }
        CarrierEntity saved = carrierRepository.save(carrier);
        log.debug("Created carrier: usdot={}, name={}", saved.getUsdot(), saved.getCarrierName());
        return saved;
    }

    /**
     * Applies the non-null fields of the patch.
     */
    @Transactional
    public CarrierEntity updateCarrier(Long usdot, CarrierPatch patch) {
        CarrierEntity carrier = carrierRepository.findById(usdot)
                .orElseThrow(() -> new NotFoundException("Carrier", usdot));
        apply(patch.getCarrierName(), carrier::setCarrierName);
        apply(patch.getPrimaryOfficer(), carrier::setPrimaryOfficer);
        apply(patch.getJbCarrier(), carrier::setJbCarrier);
        apply(patch.getTrucks(), carrier::setTrucks);
        apply(patch.getInspections(), carrier::setInspections);
        apply(patch.getViolations(), carrier::setViolations);
        apply(patch.getOos(), carrier::setOos);
        apply(patch.getCrashes(), carrier::setCrashes);
        apply(patch.getDriverOosRate(), carrier::setDriverOosRate);
        apply(patch.getVehicleOosRate(), carrier::setVehicleOosRate);
        apply(patch.getMcs150Drivers(), carrier::setMcs150Drivers);
        apply(patch.getMcs150Miles(), carrier::setMcs150Miles);
        apply(patch.getAmpd(), carrier::setAmpd);
        apply(patch.getMcs150Date(), carrier::setMcs150Date);
        apply(patch.getInsuranceProvider(), carrier::setInsuranceProvider);
        apply(patch.getInsuranceAmount(), carrier::setInsuranceAmount);
        apply(patch.getDataSource(), carrier::setDataSource);
        return carrierRepository.save(carrier);
    }

    /**
     * Deletes a carrier and detaches its coverage, provider and officer links. Policies and events stay
     * as history. Returns false when the carrier does not exist.
     */
    @Transactional
    public boolean deleteCarrier(Long usdot) {
        if (!carrierRepository.existsById(usdot)) {
            return false;
        }
        int periods = coveragePeriodRepository.deleteByCarrier(usdot);
        int providers = carrierProviderLinkRepository.deleteByCarrier(usdot);
        int officers = officerLinkRepository.deleteByCarrier(usdot);
        carrierRepository.deleteById(usdot);
        log.info("Deleted carrier: usdot={}, coveragePeriods={}, providerLinks={}, officerLinks={}",
                usdot, periods, providers, officers);
        return true;
    }

    /**
     * Carriers whose driver or vehicle OOS rate or crash count exceeds the configured thresholds.
     */
    @Transactional(readOnly = true)
    public List<CarrierEntity> findHighRiskCarriers(int limit) {
        return carrierRepository.findHighRisk(highRiskOosRate, highRiskCrashes, PageRequest.of(0, limit));
    }

    @Transactional
    public PersonEntity savePerson(PersonEntity person) {
        return personRepository.save(person);
    }

    /**
     * MANAGED_BY create-if-absent. False when either endpoint is missing.
     */
    @Transactional
    public boolean linkOfficer(Long usdot, String personId) {
        if (!carrierExists(usdot) || personId == null || !personRepository.existsById(personId)) {
            log.debug("Officer link skipped, endpoint missing: usdot={}, personId={}", usdot, personId);
            return false;
        }
        if (!officerLinkRepository.existsByCarrierUsdotAndPersonId(usdot, personId)) {
            officerLinkRepository.save(CarrierOfficerLinkEntity.builder()
                    .carrierUsdot(usdot)
                    .personId(personId)
                    .build());
        }
        return true;
    }

    @Transactional(readOnly = true)
    public List<PersonEntity> officersOf(Long usdot) {
        List<String> personIds = officerLinkRepository.findByCarrierUsdot(usdot).stream()
                .map(CarrierOfficerLinkEntity::getPersonId)
                .collect(Collectors.toList());
        return personRepository.findAllById(personIds);
    }

    @Transactional(readOnly = true)
    public List<CarrierEntity> carriersManagedBy(String personId) {
        List<Long> usdots = officerLinkRepository.findByPersonId(personId).stream()
                .map(CarrierOfficerLinkEntity::getCarrierUsdot)
                .collect(Collectors.toList());
        return carrierRepository.findAllById(usdots);
    }

    private static <T> void apply(T value, Consumer<T> setter) {
        if (value != null) {
            setter.accept(value);
        }
    }
}
