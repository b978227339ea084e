package com.rico.insurance.persistence.repository;

import com.rico.insurance.persistence.entity.CarrierOfficerLinkEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for MANAGED_BY links.
 */
@Repository
public interface CarrierOfficerLinkRepository extends JpaRepository<CarrierOfficerLinkEntity, Long> {

    boolean existsByCarrierUsdotAndPersonId(Long carrierUsdot, String personId);

    List<CarrierOfficerLinkEntity> findByCarrierUsdot(Long carrierUsdot);

    List<CarrierOfficerLinkEntity> findByPersonId(String personId);

    @Modifying
    @Query("DELETE FROM CarrierOfficerLinkEntity l WHERE l.carrierUsdot = :usdot")
    int deleteByCarrier(@Param("usdot") Long usdot);
}
