package com.assessval.dto.response;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Response DTO for a comparable sale.
 */
public record ComparableSaleDto(
    Long id,
    String propertyId,
    String comparablePropertyId,
    LocalDate saleDate,
    BigDecimal salePrice,
    BigDecimal adjustedPrice,
    BigDecimal distanceInMiles,
    BigDecimal similarityScore,
    Map<String, Object> adjustmentFactors,
    String notes,
    String status,
    Long createdBy,
    LocalDateTime createdAt,
    LocalDateTime lastUpdated
) {}
