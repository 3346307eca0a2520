package com.assessval.service.lineage;

import com.assessval.model.lineage.LineageValue;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Canonical serialization of field values for the lineage ledger.
 *
 * Strings are kept verbatim and tagged STRING, as are enums (by their wire
 * value). Everything else, {@code null} included, is JSON-encoded and tagged JSON. Decimals are normalized
 * (trailing zeros stripped, plain notation) so that 300000.00 and 300000 compare
 * equal. Temporal values become their ISO string inside JSON and are not parsed
 * back on read.
 */
@Component
@Slf4j
public class LineageValueCodec {

    private final ObjectMapper objectMapper;

    public LineageValueCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
            .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    public LineageValue encode(Object value) {
        if (value == null) {
            return LineageValue.nullValue();
        }
        if (value instanceof String text) {
            return LineageValue.ofString(text);
        }
        if (value instanceof Enum<?>) {
            return LineageValue.ofString(objectMapper.convertValue(value, String.class));
        }
        Object normalized = value instanceof BigDecimal decimal ? normalize(decimal) : value;
        try {
            return LineageValue.ofJson(objectMapper.writeValueAsString(normalized));
        } catch (JsonProcessingException | RuntimeException e) {
            // never fails the caller's mutation
            log.warn("Lineage value of type {} could not be JSON-encoded, storing string form instead: {}",
                value.getClass().getName(), e.getMessage());
            return LineageValue.ofString(String.valueOf(value));
        }
    }

    /**
     * JSON object for the {@code sourceDetails} column.
     */
    public String encodeDetails(Map<String, Object> details) {
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            log.warn("Lineage source details could not be encoded: {}", e.getMessage());
            return "{}";
        }
    }

    private static BigDecimal normalize(BigDecimal decimal) {
        return decimal.signum() == 0 ? BigDecimal.ZERO : decimal.stripTrailingZeros();
    }
}
