package com.assessval.dto.request;

import jakarta.validation.constraints.NotNull;

public record FinalizeAnalysisRequest(
    @NotNull(message = "reviewerId is required")
    Long reviewerId,

    String reviewNotes
) {}
