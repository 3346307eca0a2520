package com.assessval.dto.request;

import jakarta.validation.constraints.NotBlank;

import java.time.LocalDate;

/**
 * Request DTO for opening a comparable analysis. The analysis id is generated
 * when omitted.
 */
public record CreateAnalysisRequest(
    String analysisId,

    @NotBlank(message = "propertyId is required")
    String propertyId,

    @NotBlank(message = "title is required")
    String title,

    String description,
    String methodology,
    LocalDate effectiveDate,
    String adjustmentNotes,
    String marketConditions,
    String confidenceLevel,
    Boolean updatePropertyValue,
    Long createdBy
) {}
