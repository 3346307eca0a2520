package com.assessval.dto.request;

import jakarta.validation.constraints.NotBlank;

import java.math.BigDecimal;

/**
 * Request DTO for filing an appeal against a property's assessed value.
 */
public record CreateAppealRequest(
    @NotBlank(message = "appealNumber is required")
    String appealNumber,

    @NotBlank(message = "propertyId is required")
    String propertyId,

    Long userId,
    String appealType,

    @NotBlank(message = "reason is required")
    String reason,

    BigDecimal requestedValue
) {}
