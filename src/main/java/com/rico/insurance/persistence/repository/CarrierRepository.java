package com.rico.insurance.persistence.repository;

import com.rico.insurance.persistence.entity.CarrierEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for carriers.
 */
@Repository
public interface CarrierRepository extends JpaRepository<CarrierEntity, Long> {

    @Query("SELECT c FROM CarrierEntity c WHERE c.driverOosRate > :oosRate OR c.vehicleOosRate > :oosRate " +
           "OR c.crashes > :crashes ORDER BY c.crashes DESC NULLS LAST, c.usdot ASC")
    List<CarrierEntity> findHighRisk(@Param("oosRate") double oosRate,
                                     @Param("crashes") int crashes,
                                     Pageable pageable);
}
