package com.assessval.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Assessment category of a property.
 */
public enum PropertyType {
    RESIDENTIAL("Residential"),
    COMMERCIAL("Commercial"),
    AGRICULTURAL("Agricultural"),
    INDUSTRIAL("Industrial"),
    VACANT_LAND("Vacant Land"),
    EXEMPT("Exempt");

    private final String value;

    PropertyType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static PropertyType fromValue(String value) {
        for (PropertyType item : values()) {
            if (item.value.equals(value)) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown PropertyType: " + value);
    }
}
