package com.assessval.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Valuation approach used by an analysis.
 */
public enum Methodology {
    SALES_COMPARISON("sales_comparison"),
    INCOME("income"),
    COST("cost");

    private final String value;

    Methodology(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Methodology fromValue(String value) {
        for (Methodology item : values()) {
            if (item.value.equals(value)) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown Methodology: " + value);
    }
}
