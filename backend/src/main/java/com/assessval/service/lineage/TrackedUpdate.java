package com.assessval.service.lineage;

import com.assessval.model.enums.LineageSource;

/**
 * Describes one update call for the {@link MutationTracker}.
 *
 * @param entityKind  kind of the entity being updated (property, field, appeal...)
 * @param lineageKey  business identifier the lineage is filed under
 * @param storageId   id of the updated row, recorded in source details
 * @param fieldPrefix prefix for field names, e.g. {@code field.squareFeet.}; empty for top-level
 * @param operation   name of the update operation, recorded in source details
 * @param source      provenance of the change
 * @param userId      acting user, may be {@code null} for system jobs
 */
public record TrackedUpdate(
    String entityKind,
    String lineageKey,
    Object storageId,
    String fieldPrefix,
    String operation,
    LineageSource source,
    Long userId
) {

    public TrackedUpdate {
        if (lineageKey == null || lineageKey.isBlank()) {
            throw new IllegalArgumentException("lineageKey is required");
        }
        fieldPrefix = fieldPrefix == null ? "" : fieldPrefix;
        source = source == null ? LineageSource.MANUAL : source;
    }

    public static TrackedUpdate of(String entityKind, String lineageKey, Object storageId,
                                   String operation, LineageSource source, Long userId) {
        return new TrackedUpdate(entityKind, lineageKey, storageId, "", operation, source, userId);
    }

    public TrackedUpdate withPrefix(String prefix) {
        return new TrackedUpdate(entityKind, lineageKey, storageId, prefix, operation, source, userId);
    }

    public String qualify(String key) {
        return fieldPrefix + key;
    }
}
