package com.assessval.dto.request;

import jakarta.validation.constraints.NotBlank;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * Request DTO for recording a comparable sale against a subject property.
 */
public record CreateComparableSaleRequest(
    @NotBlank(message = "propertyId is required")
    String propertyId,

    @NotBlank(message = "comparablePropertyId is required")
    String comparablePropertyId,

    LocalDate saleDate,
    BigDecimal salePrice,
    BigDecimal adjustedPrice,
    BigDecimal distanceInMiles,
    BigDecimal similarityScore,
    Map<String, Object> adjustmentFactors,
    String notes,
    Long createdBy
) {}
