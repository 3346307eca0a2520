package com.assessval.service.lineage;

import com.assessval.model.enums.LineageSource;

import java.time.LocalDateTime;

/**
 * One change in a property's history, as read back by valuation logic and UIs.
 */
public record PropertyHistoryPoint(
    LocalDateTime date,
    String fieldName,
    String oldValue,
    String newValue,
    LineageSource source,
    Long userId
) {}
