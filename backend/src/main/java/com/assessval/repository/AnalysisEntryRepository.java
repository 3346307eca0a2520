package com.assessval.repository;

import com.assessval.model.comparable.AnalysisEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AnalysisEntryRepository extends JpaRepository<AnalysisEntry, Long> {

    List<AnalysisEntry> findByAnalysisIdOrderByIdAsc(String analysisId);
}
