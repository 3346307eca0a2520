package com.assessval.dto.response;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record AnalysisEntryDto(
    Long id,
    String analysisId,
    Long comparableSaleId,
    boolean includeInFinalValue,
    BigDecimal weight,
    BigDecimal adjustedValue,
    String notes,
    LocalDateTime createdAt
) {}
