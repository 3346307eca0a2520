package com.assessval.dto.response;

import java.math.BigDecimal;

public record ImprovementDto(
    Long id,
    String propertyId,
    String improvementType,
    Integer yearBuilt,
    BigDecimal squareFeet,
    Integer bedrooms,
    BigDecimal bathrooms,
    String quality,
    String condition
) {}
