package com.assessval.dto.response;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Response DTO for a property.
 */
public record PropertyDto(
    Long id,
    String propertyId,
    String address,
    String parcelNumber,
    String propertyType,
    BigDecimal acres,
    BigDecimal currentValue,
    String status,
    Map<String, Object> extraFields,
    LocalDateTime createdAt,
    LocalDateTime lastUpdated
) {}
