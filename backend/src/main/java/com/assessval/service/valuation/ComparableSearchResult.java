package com.assessval.service.valuation;

import java.util.List;

/**
 * Discovery outcome. {@code subjectFound} separates "subject does not exist"
 * from "subject exists but nothing is comparable".
 */
public record ComparableSearchResult(
    String subjectPropertyId,
    boolean subjectFound,
    List<ComparableCandidate> candidates
) {

    public static ComparableSearchResult subjectMissing(String subjectPropertyId) {
        return new ComparableSearchResult(subjectPropertyId, false, List.of());
    }
}
