package com.assessval.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a lineage value was serialized. STRING values are stored verbatim,
 * JSON values hold the JSON encoding of a non-string value (including {@code null}).
 */
public enum LineageValueKind {
    STRING("string"),
    JSON("json");

    private final String value;

    LineageValueKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
