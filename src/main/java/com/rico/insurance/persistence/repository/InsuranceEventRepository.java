package com.rico.insurance.persistence.repository;

import com.rico.insurance.domain.InsuranceEventType;
import com.rico.insurance.persistence.entity.InsuranceEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * Repository for insurance events.
 */
@Repository
public interface InsuranceEventRepository extends JpaRepository<InsuranceEventEntity, String> {

    List<InsuranceEventEntity> findByCarrierUsdotOrderByEventDateAsc(Long carrierUsdot);

    long countByCarrierUsdotAndEventType(Long carrierUsdot, InsuranceEventType eventType);

    boolean existsByCarrierUsdotAndComplianceViolationTrue(Long carrierUsdot);

    @Query("SELECT COUNT(e) FROM InsuranceEventEntity e WHERE e.carrierUsdot = :usdot " +
           "AND e.eventType = :type AND e.eventDate >= :since")
    long countSince(@Param("usdot") Long usdot,
                    @Param("type") InsuranceEventType type,
                    @Param("since") LocalDate since);
}
