package com.assessval.repository;

import com.assessval.model.enums.PropertyType;
import com.assessval.model.property.Property;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for properties.
 */
@Repository
public interface PropertyRepository extends JpaRepository<Property, Long> {

    /**
     * Find property by business identifier (e.g., "BC001").
     */
    Optional<Property> findByPropertyId(String propertyId);

    boolean existsByPropertyId(String propertyId);

    /**
     * All properties in insertion order. Discovery relies on this order to break ties.
     */
    List<Property> findAllByOrderByIdAsc();

    List<Property> findByPropertyType(PropertyType propertyType);
}
