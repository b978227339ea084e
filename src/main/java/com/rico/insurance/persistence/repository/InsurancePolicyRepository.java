package com.rico.insurance.persistence.repository;

import com.rico.insurance.domain.FilingStatus;
import com.rico.insurance.persistence.entity.InsurancePolicyEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

/**
 * Repository for insurance policies.
 */
@Repository
public interface InsurancePolicyRepository extends JpaRepository<InsurancePolicyEntity, String> {

    List<InsurancePolicyEntity> findByCarrierUsdotOrderByEffectiveDateAsc(Long carrierUsdot);

    List<InsurancePolicyEntity> findByCarrierUsdotInOrderByEffectiveDateAsc(Collection<Long> carrierUsdots);

    List<InsurancePolicyEntity> findByEffectiveDateGreaterThanEqualOrderByCarrierUsdotAscEffectiveDateAsc(LocalDate since);

    List<InsurancePolicyEntity> findByFilingStatusAndCoverageAmountLessThan(FilingStatus filingStatus, BigDecimal amount);

    long countByCarrierUsdot(Long carrierUsdot);

    @Query("SELECT COUNT(DISTINCT p.providerName) FROM InsurancePolicyEntity p WHERE p.carrierUsdot = :usdot")
    long countDistinctProvidersByCarrier(@Param("usdot") Long usdot);
}
