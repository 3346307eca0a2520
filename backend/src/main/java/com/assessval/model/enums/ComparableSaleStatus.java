package com.assessval.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a comparable sale entry. Entries are retired, never deleted.
 */
public enum ComparableSaleStatus {
    ACTIVE("active"),
    INACTIVE("inactive"),
    WITHDRAWN("withdrawn");

    private final String value;

    ComparableSaleStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ComparableSaleStatus fromValue(String value) {
        for (ComparableSaleStatus item : values()) {
            if (item.value.equals(value)) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown ComparableSaleStatus: " + value);
    }
}
