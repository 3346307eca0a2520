package com.assessval.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Coercion of loosely typed update payload values to the types stored on
 * entities. Normalizing before diffing keeps lineage comparisons type-stable:
 * a payload value of {@code "300000"} for a decimal field is compared as the
 * decimal 300000, not as a string.
 */
public final class PatchValues {

    private PatchValues() {
    }

    public static String asString(String key, Object value) {
        if (value == null || value instanceof String) {
            return (String) value;
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        throw invalid(key, value, "text");
    }

    public static BigDecimal asDecimal(String key, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException e) {
                throw invalid(key, value, "decimal");
            }
        }
        throw invalid(key, value, "decimal");
    }

    /**
     * Decimal bound for a {@code NUMERIC(precision, scale)} column. The result
     * carries the column scale, so the value diffed into lineage is the value
     * the row will hold. Input that the column would have to round or
     * truncate is rejected.
     */
    public static BigDecimal asDecimal(String key, Object value, int precision, int scale) {
        BigDecimal decimal = asDecimal(key, value);
        if (decimal == null) {
            return null;
        }
        BigDecimal scaled;
        try {
            scaled = decimal.setScale(scale, RoundingMode.UNNECESSARY);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(String.format(
                "Field '%s' allows at most %d decimal place(s) but got: %s", key, scale, value));
        }
        if (scaled.precision() - scaled.scale() > precision - scale) {
            throw new IllegalArgumentException(String.format(
                "Field '%s' allows at most %d integer digit(s) but got: %s", key, precision - scale, value));
        }
        return scaled;
    }

    public static Integer asInteger(String key, Object value) {
        BigDecimal decimal = asDecimal(key, value);
        if (decimal == null) {
            return null;
        }
        try {
            return decimal.intValueExact();
        } catch (ArithmeticException e) {
            throw invalid(key, value, "integer");
        }
    }

    public static Long asLong(String key, Object value) {
        BigDecimal decimal = asDecimal(key, value);
        if (decimal == null) {
            return null;
        }
        try {
            return decimal.longValueExact();
        } catch (ArithmeticException e) {
            throw invalid(key, value, "integer");
        }
    }

    public static Boolean asBoolean(String key, Object value) {
        if (value == null || value instanceof Boolean) {
            return (Boolean) value;
        }
        if ("true".equalsIgnoreCase(String.valueOf(value)) || "false".equalsIgnoreCase(String.valueOf(value))) {
            return Boolean.valueOf(String.valueOf(value));
        }
        throw invalid(key, value, "boolean");
    }

    public static LocalDate asDate(String key, Object value) {
        if (value == null || value instanceof LocalDate) {
            return (LocalDate) value;
        }
        try {
            return LocalDate.parse(String.valueOf(value));
        } catch (DateTimeParseException e) {
            throw invalid(key, value, "ISO date");
        }
    }

    public static LocalDateTime asDateTime(String key, Object value) {
        if (value == null || value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        try {
            return LocalDateTime.parse(String.valueOf(value));
        } catch (DateTimeParseException e) {
            throw invalid(key, value, "ISO date-time");
        }
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(String key, Object value) {
        if (value == null || value instanceof Map) {
            return (Map<String, Object>) value;
        }
        throw invalid(key, value, "object");
    }

    private static IllegalArgumentException invalid(String key, Object value, String expected) {
        return new IllegalArgumentException(
            String.format("Field '%s' expects %s but got: %s", key, expected, value));
    }
}
