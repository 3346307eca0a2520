package com.assessval.dto.request;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public record AddAnalysisEntryRequest(
    @NotNull(message = "comparableSaleId is required")
    Long comparableSaleId,

    Boolean includeInFinalValue,

    @DecimalMin(value = "0", message = "weight must be zero or positive")
    BigDecimal weight,

    BigDecimal adjustedValue,
    String notes
) {}
