package com.assessval.dto.response;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Response DTO for a comparable analysis with its entries.
 */
public record ComparableAnalysisDto(
    Long id,
    String analysisId,
    String propertyId,
    String title,
    String description,
    String methodology,
    LocalDate effectiveDate,
    BigDecimal valueConclusion,
    String adjustmentNotes,
    String marketConditions,
    String confidenceLevel,
    String status,
    boolean updatePropertyValue,
    Long createdBy,
    Long reviewedBy,
    String reviewNotes,
    LocalDateTime reviewDate,
    List<AnalysisEntryDto> entries,
    LocalDateTime createdAt,
    LocalDateTime lastUpdated
) {}
