package com.rico.insurance.persistence.repository;

import com.rico.insurance.persistence.entity.InsuranceProviderEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for insurance providers.
 */
@Repository
public interface InsuranceProviderRepository extends JpaRepository<InsuranceProviderEntity, String> {

    Optional<InsuranceProviderEntity> findByName(String name);
}
