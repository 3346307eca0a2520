package com.assessval.dto.request;

import com.assessval.model.enums.LineageSource;
import jakarta.validation.constraints.NotEmpty;

import java.util.Map;

/**
 * Request DTO for a partial update recorded in the lineage ledger.
 * Only the keys present in {@code changes} are compared and written.
 */
public record TrackedChangesRequest(
    @NotEmpty(message = "changes must name at least one field")
    Map<String, Object> changes,

    String source,
    Long userId
) {

    /**
     * Provenance of the change; {@code manual} when not given.
     */
    public LineageSource lineageSource() {
        return source == null || source.isBlank() ? LineageSource.MANUAL : LineageSource.fromValue(source);
    }
}
