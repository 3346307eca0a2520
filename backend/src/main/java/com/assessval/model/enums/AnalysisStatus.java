package com.assessval.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of a comparable analysis.
 */
public enum AnalysisStatus {
    DRAFT("draft"),
    IN_REVIEW("in_review"),
    FINAL("final");

    private final String value;

    AnalysisStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AnalysisStatus fromValue(String value) {
        for (AnalysisStatus item : values()) {
            if (item.value.equals(value)) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown AnalysisStatus: " + value);
    }
}
