package com.assessval.repository;

import com.assessval.model.comparable.ComparableSale;
import com.assessval.model.enums.ComparableSaleStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository for comparable sale entries.
 */
@Repository
public interface ComparableSaleRepository extends JpaRepository<ComparableSale, Long> {

    /**
     * Find comparables recorded for a subject property.
     */
    List<ComparableSale> findByPropertyIdOrderByIdAsc(String propertyId);

    List<ComparableSale> findByStatusOrderByIdAsc(ComparableSaleStatus status);

    List<ComparableSale> findByIdIn(Collection<Long> ids);
}
