package com.rico.insurance.persistence.repository;

import com.rico.insurance.persistence.entity.EnrichmentJobEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for enrichment jobs.
 */
@Repository
public interface EnrichmentJobRepository extends JpaRepository<EnrichmentJobEntity, String> {

    List<EnrichmentJobEntity> findByStatusOrderByCreatedAtDesc(EnrichmentJobEntity.JobStatus status);
}
