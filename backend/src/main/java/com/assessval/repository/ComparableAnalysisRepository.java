package com.assessval.repository;

import com.assessval.model.comparable.ComparableAnalysis;
import com.assessval.model.enums.AnalysisStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for comparable analyses.
 */
@Repository
public interface ComparableAnalysisRepository extends JpaRepository<ComparableAnalysis, Long> {

    /**
     * Find analysis by business identifier.
     */
    Optional<ComparableAnalysis> findByAnalysisId(String analysisId);

    /**
     * Load an analysis for a change to it or its entries. The version is bumped
     * at commit, so entry edits, reconciliation and finalization of the same
     * analysis conflict with each other instead of interleaving.
     */
    @Lock(LockModeType.OPTIMISTIC_FORCE_INCREMENT)
    Optional<ComparableAnalysis> findForChangeByAnalysisId(String analysisId);

    boolean existsByAnalysisId(String analysisId);

    List<ComparableAnalysis> findByPropertyIdOrderByIdAsc(String propertyId);

    long countByStatus(AnalysisStatus status);
}
