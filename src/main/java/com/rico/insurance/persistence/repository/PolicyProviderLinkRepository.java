package com.rico.insurance.persistence.repository;

import com.rico.insurance.persistence.entity.PolicyProviderLinkEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for PROVIDED_BY links.
 */
@Repository
public interface PolicyProviderLinkRepository extends JpaRepository<PolicyProviderLinkEntity, Long> {

    boolean existsByPolicyIdAndProviderId(String policyId, String providerId);

    List<PolicyProviderLinkEntity> findByPolicyId(String policyId);
}
