package com.assessval.service.lineage;

import com.assessval.model.lineage.LineageRecord;
import com.assessval.model.lineage.LineageValue;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Where a property field's value came from.
 *
 * @param currentValue value the property holds now, in lineage form; {@code null} when the
 *                     field name is not a property attribute (sub-entity paths such as
 *                     {@code appeal.status})
 * @param origin       first recorded change, or {@code unknown} at the property's creation
 * @param changeChain  every recorded change of the field, oldest first
 */
public record DataProvenance(
    String propertyId,
    String fieldName,
    LineageValue currentValue,
    Origin origin,
    List<LineageRecord> changeChain
) {

    public static final String UNKNOWN_SOURCE = "unknown";

    public record Origin(
        String source,
        LocalDateTime timestamp,
        Long userId,
        String sourceDetails
    ) {

        static Origin of(LineageRecord first) {
            return new Origin(first.getSource().getValue(), first.getChangeTimestamp(),
                first.getUserId(), first.getSourceDetails());
        }

        static Origin unknown(LocalDateTime since) {
            return new Origin(UNKNOWN_SOURCE, since, null, "{}");
        }
    }
}
