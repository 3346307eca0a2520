package com.assessval.dto.response;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Response DTO for an appeal.
 */
public record AppealDto(
    Long id,
    String appealNumber,
    String propertyId,
    Long userId,
    String appealType,
    String reason,
    BigDecimal requestedValue,
    LocalDateTime hearingDate,
    String hearingLocation,
    Long assignedTo,
    String status,
    String decision,
    String decisionReason,
    LocalDateTime createdAt,
    LocalDateTime lastUpdated
) {}
