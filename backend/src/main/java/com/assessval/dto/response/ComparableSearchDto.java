package com.assessval.dto.response;

import java.util.List;

/**
 * Response DTO for comparable discovery. {@code subjectFound} tells an empty
 * result for an unknown subject apart from a subject with no comparables.
 */
public record ComparableSearchDto(
    String subjectPropertyId,
    boolean subjectFound,
    List<CandidateDto> candidates
) {

    public record CandidateDto(
        PropertyDto property,
        double similarityScore
    ) {}
}
