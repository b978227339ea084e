package com.rico.insurance.persistence.repository;

import com.rico.insurance.persistence.entity.CoveragePeriodEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Repository for HAD_INSURANCE coverage periods.
 */
@Repository
public interface CoveragePeriodRepository extends JpaRepository<CoveragePeriodEntity, Long> {

    Optional<CoveragePeriodEntity> findByCarrierUsdotAndPolicyId(Long carrierUsdot, String policyId);

    List<CoveragePeriodEntity> findByCarrierUsdotOrderByFromDateAscIdAsc(Long carrierUsdot);

    List<CoveragePeriodEntity> findAllByOrderByCarrierUsdotAscIdAsc();

    long countByCarrierUsdotAndPolicyId(Long carrierUsdot, String policyId);

    /** Carriers with at least one coverage period active on the given date. */
    @Query("SELECT DISTINCT c.carrierUsdot FROM CoveragePeriodEntity c WHERE c.fromDate <= :date " +
           "AND (c.toDate IS NULL OR c.toDate > :date)")
    List<Long> findCarriersCoveredOn(@Param("date") LocalDate date);

    @Modifying
    @Query("DELETE FROM CoveragePeriodEntity c WHERE c.carrierUsdot = :usdot")
    int deleteByCarrier(@Param("usdot") Long usdot);
}
