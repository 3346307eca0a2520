package com.assessval.dto.request;

import java.math.BigDecimal;

/**
 * Request DTO for adding an improvement (building, structure) to a property.
 */
public record CreateImprovementRequest(
    String improvementType,
    Integer yearBuilt,
    BigDecimal squareFeet,
    Integer bedrooms,
    BigDecimal bathrooms,
    String quality,
    String condition
) {}
