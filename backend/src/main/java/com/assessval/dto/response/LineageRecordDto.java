package com.assessval.dto.response;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Response DTO for one ledger record. Values are returned in their canonical
 * text form; {@code oldValueKind}/{@code newValueKind} say whether the text is
 * a plain string or JSON.
 */
public record LineageRecordDto(
    Long id,
    String entityId,
    String fieldName,
    String oldValue,
    String oldValueKind,
    String newValue,
    String newValueKind,
    LocalDateTime changeTimestamp,
    String source,
    Long userId,
    Map<String, Object> sourceDetails,
    String batchId
) {}
