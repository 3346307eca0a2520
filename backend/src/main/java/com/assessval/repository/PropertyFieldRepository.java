package com.assessval.repository;

import com.assessval.model.property.PropertyField;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PropertyFieldRepository extends JpaRepository<PropertyField, Long> {

    List<PropertyField> findByPropertyIdOrderByIdAsc(String propertyId);
}
