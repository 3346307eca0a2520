package com.assessval.dto.request;

import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO for recording a correction in the lineage ledger. The entity
 * itself is not changed.
 */
public record LineageCorrectionRequest(
    @NotBlank(message = "entityId is required")
    String entityId,

    @NotBlank(message = "fieldName is required")
    String fieldName,

    Object correctedValue,
    Long userId,

    @NotBlank(message = "reason is required")
    String reason
) {}
