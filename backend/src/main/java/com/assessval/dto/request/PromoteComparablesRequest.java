package com.assessval.dto.request;

/**
 * Request DTO for turning the top discovery candidates into comparable sales.
 */
public record PromoteComparablesRequest(
    Integer count,
    Long userId
) {}
