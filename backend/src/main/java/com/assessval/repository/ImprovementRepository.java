package com.assessval.repository;

import com.assessval.model.property.Improvement;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository for property improvements.
 */
@Repository
public interface ImprovementRepository extends JpaRepository<Improvement, Long> {

    /**
     * Improvements of a property, oldest first.
     */
    List<Improvement> findByPropertyIdOrderByIdAsc(String propertyId);

    /**
     * Improvements of several properties in one query, oldest first.
     */
    List<Improvement> findByPropertyIdInOrderByIdAsc(Collection<String> propertyIds);
}
