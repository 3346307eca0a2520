package com.assessval.dto.response;

import java.time.LocalDateTime;

public record PropertyFieldDto(
    Long id,
    String propertyId,
    String fieldType,
    String fieldValue,
    LocalDateTime lastUpdated
) {}
