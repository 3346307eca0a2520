package com.assessval.dto.request;

import jakarta.validation.constraints.NotBlank;

public record CreateFieldRequest(
    @NotBlank(message = "propertyId is required")
    String propertyId,

    @NotBlank(message = "fieldType is required")
    String fieldType,

    String fieldValue
) {}
