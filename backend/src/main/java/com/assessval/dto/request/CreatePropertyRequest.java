package com.assessval.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Request DTO for registering a property.
 */
public record CreatePropertyRequest(
    @NotBlank(message = "propertyId is required")
    String propertyId,

    String address,
    String parcelNumber,

    @NotBlank(message = "propertyType is required")
    String propertyType,

    @NotNull(message = "acres is required")
    BigDecimal acres,

    BigDecimal currentValue,
    String status,
    Map<String, Object> extraFields
) {}
