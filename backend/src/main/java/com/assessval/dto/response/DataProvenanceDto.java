package com.assessval.dto.response;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Provenance of one property field. {@code currentValue} and
 * {@code currentValueKind} are null when the field is not a property attribute.
 */
public record DataProvenanceDto(
    String propertyId,
    String fieldName,
    String currentValue,
    String currentValueKind,
    OriginDto origin,
    List<LineageRecordDto> changeChain
) {

    public record OriginDto(
        String source,
        LocalDateTime timestamp,
        Long userId,
        Map<String, Object> details
    ) {}
}
