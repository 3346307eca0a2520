package com.assessval.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of a value appeal.
 */
public enum AppealStatus {
    SUBMITTED("submitted"),
    UNDER_REVIEW("under_review"),
    SCHEDULED("scheduled"),
    HEARD("heard"),
    DECIDED("decided"),
    WITHDRAWN("withdrawn");

    private final String value;

    AppealStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AppealStatus fromValue(String value) {
        for (AppealStatus item : values()) {
            if (item.value.equals(value)) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown AppealStatus: " + value);
    }
}
