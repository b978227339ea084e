package com.rico.insurance.persistence.repository;

import com.rico.insurance.persistence.entity.PersonEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for persons (carrier officers).
 */
@Repository
public interface PersonRepository extends JpaRepository<PersonEntity, String> {
}
