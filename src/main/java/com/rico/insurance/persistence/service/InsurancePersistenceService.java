package com.rico.insurance.persistence.service;

import com.rico.insurance.domain.FilingStatus;
import com.rico.insurance.domain.InsuranceEvent;
import com.rico.insurance.domain.InsurancePolicy;
import com.rico.insurance.domain.TimelineEntry;
import com.rico.insurance.exception.DuplicateKeyException;
import com.rico.insurance.exception.NotFoundException;
import com.rico.insurance.exception.PolicyValidationException;
import com.rico.insurance.persistence.repository.CarrierRepository;
import com.rico.insurance.persistence.repository.InsuranceEventRepository;
import com.rico.insurance.persistence.repository.InsurancePolicyRepository;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Policy and event store. Validates policies at the boundary, enforces unique policy ids and
 * serves per-carrier listings and the merged timeline.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InsurancePersistenceService {

    private final InsurancePolicyRepository policyRepository;
    private final InsuranceEventRepository eventRepository;
    private final CarrierRepository carrierRepository;
    private final Validator validator;
    private final Clock clock;

    /**
     * Creates a policy. Fails with {@link PolicyValidationException} for malformed input and
     * {@link DuplicateKeyException} when the id is taken.
     */
    @Transactional
    public InsurancePolicy createPolicy(InsurancePolicy policy) {
        validate(policy);
        if (policyRepository.existsById(policy.getPolicyId())) {
            throw new DuplicateKeyException("Policy already exists: " + policy.getPolicyId());
        }
        try {
            InsurancePolicy saved = InsuranceEntityMapper.toDomain(
                    policyRepository.saveAndFlush(InsuranceEntityMapper.toEntity(policy)));
            log.debug("Created policy: policyId={}, usdot={}, provider={}",
                    saved.getPolicyId(), saved.getCarrierUsdot(), saved.getProviderName());
            return saved;
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateKeyException("Policy already exists: " + policy.getPolicyId(), e);
        }
    }

    @Transactional(readOnly = true)
    public Optional<InsurancePolicy> getPolicy(String policyId) {
        return policyRepository.findById(policyId).map(InsuranceEntityMapper::toDomain);
    }

    @Transactional(readOnly = true)
    public boolean policyExists(String policyId) {
        return policyRepository.existsById(policyId);
    }

    /**
     * Policies for a carrier ordered by effective date.
     *
     * @param activeOnly      keep only policies filed as ACTIVE
     * @param includeExpired  when false, drop policies whose expiration date has passed
     */
    @Transactional(readOnly = true)
    public List<InsurancePolicy> listPoliciesForCarrier(Long usdot, boolean activeOnly, boolean includeExpired) {
        LocalDate today = LocalDate.now(clock);
        return policyRepository.findByCarrierUsdotOrderByEffectiveDateAsc(usdot).stream()
                .map(InsuranceEntityMapper::toDomain)
                .filter(p -> !activeOnly || p.getFilingStatus() == FilingStatus.ACTIVE)
                .filter(p -> includeExpired || p.getExpirationDate() == null || !p.getExpirationDate().isBefore(today))
                .collect(Collectors.toList());
    }

    public List<InsurancePolicy> listPoliciesForCarrier(Long usdot) {
        return listPoliciesForCarrier(usdot, false, true);
    }

    /**
     * Records an event. Events are written once: fails with {@link DuplicateKeyException} when the id is
     * taken and with {@link NotFoundException} when the carrier does not exist.
     */
    @Transactional
    public InsuranceEvent createEvent(InsuranceEvent event) {
        if (event.getCarrierUsdot() == null || !carrierRepository.existsById(event.getCarrierUsdot())) {
            throw new NotFoundException("Carrier", event.getCarrierUsdot());
        }
        if (event.getEventDate() == null || event.getEventType() == null) {
            throw new PolicyValidationException("Event requires an event type and an event date");
        }
        if (event.getEventId() == null) {
            throw new PolicyValidationException("Event requires an event id");
        }
        if (eventRepository.existsById(event.getEventId())) {
            throw new DuplicateKeyException("Event already exists: " + event.getEventId());
        }
        InsuranceEvent saved;
        try {
            saved = InsuranceEntityMapper.toDomain(eventRepository.saveAndFlush(InsuranceEntityMapper.toEntity(event)));
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateKeyException("Event already exists: " + event.getEventId(), e);
        }
        log.debug("Created event: eventId={}, usdot={}, type={}, suspicious={}",
                saved.getEventId(), saved.getCarrierUsdot(), saved.getEventType(), saved.isSuspicious());
        return saved;
    }

    @Transactional(readOnly = true)
    public boolean eventExists(String eventId) {
        return eventRepository.existsById(eventId);
    }

    @Transactional(readOnly = true)
    public List<InsuranceEvent> listEventsForCarrier(Long usdot) {
        return eventRepository.findByCarrierUsdotOrderByEventDateAsc(usdot).stream()
                .map(InsuranceEntityMapper::toDomain)
                .collect(Collectors.toList());
    }

    /**
     * Policies and events merged by date ascending; a policy sorts before an event on the same date.
     */
    @Transactional(readOnly = true)
    public List<TimelineEntry> getCarrierTimeline(Long usdot) {
        List<TimelineEntry> entries = new ArrayList<>();
        for (InsurancePolicy policy : listPoliciesForCarrier(usdot)) {
            entries.add(TimelineEntry.builder()
                    .kind(TimelineEntry.Kind.POLICY)
                    .date(policy.getEffectiveDate())
                    .policy(policy)
                    .build());
        }
        for (InsuranceEvent event : listEventsForCarrier(usdot)) {
            entries.add(TimelineEntry.builder()
                    .kind(TimelineEntry.Kind.EVENT)
                    .date(event.getEventDate())
                    .event(event)
                    .build());
        }
        // List.sort is stable, so same-kind entries keep their per-source order
        entries.sort(Comparator.comparing(TimelineEntry::getDate)
                .thenComparing(TimelineEntry::getKind));
        return entries;
    }

    private void validate(InsurancePolicy policy) {
        List<String> violations = new ArrayList<>();
        for (ConstraintViolation<InsurancePolicy> v : validator.validate(policy)) {
            violations.add(v.getPropertyPath() + " " + v.getMessage());
        }
        LocalDate effective = policy.getEffectiveDate();
        if (effective != null) {
            if (policy.getExpirationDate() != null && policy.getExpirationDate().isBefore(effective)) {
                violations.add("expirationDate must not precede effectiveDate");
            }
            if (policy.getCancellationDate() != null && policy.getCancellationDate().isBefore(effective)) {
                violations.add("cancellationDate must not precede effectiveDate");
            }
        }
        if (!violations.isEmpty()) {
            violations.sort(Comparator.naturalOrder());
            log.warn("Rejected policy: policyId={}, violations={}", policy.getPolicyId(), violations);
            throw new PolicyValidationException("Invalid policy " + policy.getPolicyId(), violations);
        }
    }
}
