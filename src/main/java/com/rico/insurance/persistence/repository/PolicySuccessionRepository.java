package com.rico.insurance.persistence.repository;

import com.rico.insurance.persistence.entity.PolicySuccessionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for PRECEDED_BY links.
 */
@Repository
public interface PolicySuccessionRepository extends JpaRepository<PolicySuccessionEntity, Long> {

    Optional<PolicySuccessionEntity> findByPolicyIdAndPrecededByPolicyId(String policyId, String precededByPolicyId);
}
