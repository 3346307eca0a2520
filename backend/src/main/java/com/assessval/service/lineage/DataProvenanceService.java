package com.assessval.service.lineage;

import com.assessval.model.lineage.LineageRecord;
import com.assessval.model.lineage.LineageValue;
import com.assessval.model.property.Property;
import com.assessval.service.PropertyService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Provenance of a single property field: its current value, where it
 * originated and every recorded change in order.
 */
@Service
@Transactional(readOnly = true)
@Slf4j
public class DataProvenanceService {

    static final String EXTRA_FIELD_PREFIX = "extraFields.";

    private final PropertyService propertyService;
    private final LineageLedgerService ledgerService;
    private final LineageValueCodec codec;
    private final Clock clock;

    public DataProvenanceService(
            PropertyService propertyService,
            LineageLedgerService ledgerService,
            LineageValueCodec codec,
            Clock clock) {
        this.propertyService = propertyService;
        this.ledgerService = ledgerService;
        this.codec = codec;
        this.clock = clock;
    }

    /**
     * @throws jakarta.persistence.EntityNotFoundException the property does not exist
     */
    public DataProvenance getDataProvenance(String propertyId, String fieldName) {
        if (fieldName == null || fieldName.isBlank()) {
            throw new IllegalArgumentException("fieldName is required");
        }
        Property property = propertyService.getByPropertyId(propertyId);

        List<LineageRecord> chain = new ArrayList<>(ledgerService.byEntityAndField(propertyId, fieldName));
        Collections.reverse(chain);

        DataProvenance.Origin origin;
        if (chain.isEmpty()) {
            LocalDateTime since = property.getCreatedAt() != null ? property.getCreatedAt() : LocalDateTime.now(clock);
            origin = DataProvenance.Origin.unknown(since);
        } else {
            origin = DataProvenance.Origin.of(chain.get(0));
        }

        log.debug("Provenance of {}.{}: {} change(s), origin {}", propertyId, fieldName, chain.size(), origin.source());
        return new DataProvenance(propertyId, fieldName, currentValue(property, fieldName), origin, List.copyOf(chain));
    }

    private LineageValue currentValue(Property property, String fieldName) {
        Map<String, Object> state = propertyService.trackedState(property);
        if (fieldName.startsWith(EXTRA_FIELD_PREFIX)) {
            Object extra = state.get("extraFields");
            String key = fieldName.substring(EXTRA_FIELD_PREFIX.length());
            return codec.encode(extra instanceof Map<?, ?> map ? map.get(key) : null);
        }
        if (!state.containsKey(fieldName)) {
            return null;
        }
        return codec.encode(state.get(fieldName));
    }
}
