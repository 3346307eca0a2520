package com.assessval.model.lineage;

import com.assessval.model.enums.LineageValueKind;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Canonical, tagged form of a field value as recorded in the ledger.
 * Two values are equal when both their kind and text are equal.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LineageValue {

    public static final String JSON_NULL = "null";

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", length = 10, nullable = false, updatable = false)
    private LineageValueKind kind;

    @Column(name = "text", columnDefinition = "TEXT", nullable = false, updatable = false)
    private String text;

    public static LineageValue ofString(String text) {
        return new LineageValue(LineageValueKind.STRING, text);
    }

    public static LineageValue ofJson(String json) {
        return new LineageValue(LineageValueKind.JSON, json);
    }

    public static LineageValue nullValue() {
        return ofJson(JSON_NULL);
    }

    public boolean isNull() {
        return kind == LineageValueKind.JSON && JSON_NULL.equals(text);
    }

    @Override
    public String toString() {
        return text;
    }
}
