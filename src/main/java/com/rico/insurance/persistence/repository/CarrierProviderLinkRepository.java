package com.rico.insurance.persistence.repository;

import com.rico.insurance.persistence.entity.CarrierProviderLinkEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for INSURED_BY links.
 */
@Repository
public interface CarrierProviderLinkRepository extends JpaRepository<CarrierProviderLinkEntity, Long> {

    Optional<CarrierProviderLinkEntity> findByCarrierUsdotAndProviderId(Long carrierUsdot, String providerId);

    @Query("SELECT COUNT(DISTINCT l.carrierUsdot) FROM CarrierProviderLinkEntity l WHERE l.providerId = :providerId")
    long countCarriersByProvider(@Param("providerId") String providerId);

    @Modifying
    @Query("DELETE FROM CarrierProviderLinkEntity l WHERE l.carrierUsdot = :usdot")
    int deleteByCarrier(@Param("usdot") Long usdot);
}
