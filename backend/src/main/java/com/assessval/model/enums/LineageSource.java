package com.assessval.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Provenance tag attached to every lineage record.
 */
public enum LineageSource {
    IMPORT("import"),
    MANUAL("manual"),
    API("api"),
    CALCULATED("calculated"),
    VALIDATED("validated"),
    CORRECTION("correction");

    private final String value;

    LineageSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static LineageSource fromValue(String value) {
        for (LineageSource item : values()) {
            if (item.value.equals(value)) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown LineageSource: " + value);
    }
}
