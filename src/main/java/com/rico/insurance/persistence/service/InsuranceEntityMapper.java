package com.rico.insurance.persistence.service;

import com.rico.insurance.domain.InsuranceEvent;
import com.rico.insurance.domain.InsurancePolicy;
import com.rico.insurance.persistence.entity.InsuranceEventEntity;
import com.rico.insurance.persistence.entity.InsurancePolicyEntity;

import java.util.HashSet;

/**
 * Converts between domain records and JPA entities.
 */
public final class InsuranceEntityMapper {

    private InsuranceEntityMapper() {
    }

    public static InsurancePolicy toDomain(InsurancePolicyEntity e) {
        return InsurancePolicy.builder()
                .policyId(e.getPolicyId())
                .carrierUsdot(e.getCarrierUsdot())
                .providerName(e.getProviderName())
                .policyType(e.getPolicyType())
                .coverageAmount(e.getCoverageAmount())
                .cargoCoverage(e.getCargoCoverage())
                .effectiveDate(e.getEffectiveDate())
                .expirationDate(e.getExpirationDate())
                .cancellationDate(e.getCancellationDate())
                .cancellationReason(e.getCancellationReason())
                .filingStatus(e.getFilingStatus())
                .compliant(e.getCompliant())
                .meetsFederalMinimum(e.getMeetsFederalMinimum())
                .requiredMinimum(e.getRequiredMinimum())
                .dataSource(e.getDataSource())
                .sourceRecordId(e.getSourceRecordId())
                .createdAt(e.getCreatedAt())
                .updatedAt(e.getUpdatedAt())
                .build();
    }

    public static InsurancePolicyEntity toEntity(InsurancePolicy p) {
        return InsurancePolicyEntity.builder()
                .policyId(p.getPolicyId())
                .carrierUsdot(p.getCarrierUsdot())
                .providerName(p.getProviderName())
                .policyType(p.getPolicyType())
                .coverageAmount(p.getCoverageAmount())
                .cargoCoverage(p.getCargoCoverage())
                .effectiveDate(p.getEffectiveDate())
                .expirationDate(p.getExpirationDate())
                .cancellationDate(p.getCancellationDate())
                .cancellationReason(p.getCancellationReason())
                .filingStatus(p.getFilingStatus())
                .compliant(p.getCompliant())
                .meetsFederalMinimum(p.getMeetsFederalMinimum())
                .requiredMinimum(p.getRequiredMinimum())
                .dataSource(p.getDataSource())
                .sourceRecordId(p.getSourceRecordId())
                .build();
    }

    public static InsuranceEvent toDomain(InsuranceEventEntity e) {
        return InsuranceEvent.builder()
                .eventId(e.getEventId())
                .carrierUsdot(e.getCarrierUsdot())
                .eventType(e.getEventType())
                .eventDate(e.getEventDate())
                .previousProvider(e.getPreviousProvider())
                .newProvider(e.getNewProvider())
                .previousCoverage(e.getPreviousCoverage())
                .newCoverage(e.getNewCoverage())
                .coverageChange(e.getCoverageChange())
                .previousPolicyId(e.getPreviousPolicyId())
                .newPolicyId(e.getNewPolicyId())
                .daysWithoutCoverage(e.getDaysWithoutCoverage())
                .complianceViolation(e.isComplianceViolation())
                .violationReason(e.getViolationReason())
                .suspicious(e.isSuspicious())
                .fraudIndicators(e.getFraudIndicators())
                .reason(e.getReason())
                .notes(e.getNotes())
                .dataSource(e.getDataSource())
                .createdAt(e.getCreatedAt())
                .build();
    }

    public static InsuranceEventEntity toEntity(InsuranceEvent ev) {
        return InsuranceEventEntity.builder()
                .eventId(ev.getEventId())
                .carrierUsdot(ev.getCarrierUsdot())
                .eventType(ev.getEventType())
                .eventDate(ev.getEventDate())
                .previousProvider(ev.getPreviousProvider())
                .newProvider(ev.getNewProvider())
                .previousCoverage(ev.getPreviousCoverage())
                .newCoverage(ev.getNewCoverage())
                .coverageChange(ev.getCoverageChange())
                .previousPolicyId(ev.getPreviousPolicyId())
                .newPolicyId(ev.getNewPolicyId())
                .daysWithoutCoverage(ev.getDaysWithoutCoverage())
                .complianceViolation(ev.isComplianceViolation())
                .violationReason(ev.getViolationReason())
                .suspicious(ev.isSuspicious())
                .fraudIndicators(new HashSet<>(ev.getFraudIndicators()))
                .reason(ev.getReason())
                .notes(ev.getNotes())
                .dataSource(ev.getDataSource())
                .build();
    }
}
