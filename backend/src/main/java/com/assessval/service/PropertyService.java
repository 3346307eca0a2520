package com.assessval.service;

import com.assessval.event.SystemActivityPublisher;
import com.assessval.model.enums.LineageSource;
import com.assessval.model.enums.PropertyType;
import com.assessval.model.property.Improvement;
import com.assessval.model.property.Property;
import com.assessval.repository.ImprovementRepository;
import com.assessval.repository.PropertyRepository;
import com.assessval.service.lineage.MutationTracker;
import com.assessval.service.lineage.TrackedUpdate;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Property Service
 *
 * Reads, creation and tracked updates of properties and their improvements.
 * Every property update goes through the {@link MutationTracker}; creation
 * does not produce lineage.
 */
@Service
@Slf4j
public class PropertyService {

    static final String ENTITY_KIND = "property";

    /**
     * Fields a caller may change.
     */
    static final Set<String> UPDATABLE_FIELDS = Set.of(
        "address", "parcelNumber", "propertyType", "acres", "currentValue", "status", "extraFields");

    private final PropertyRepository propertyRepository;
    private final ImprovementRepository improvementRepository;
    private final MutationTracker mutationTracker;
    private final OptimisticUpdateExecutor updateExecutor;
    private final SystemActivityPublisher activityPublisher;
    private final JsonColumns jsonColumns;

    public PropertyService(
            PropertyRepository propertyRepository,
            ImprovementRepository improvementRepository,
            MutationTracker mutationTracker,
            OptimisticUpdateExecutor updateExecutor,
            SystemActivityPublisher activityPublisher,
            JsonColumns jsonColumns) {
        this.propertyRepository = propertyRepository;
        this.improvementRepository = improvementRepository;
        this.mutationTracker = mutationTracker;
        this.updateExecutor = updateExecutor;
        this.activityPublisher = activityPublisher;
        this.jsonColumns = jsonColumns;
    }

    // ========================================================================
    // Reads
    // ========================================================================

    @Transactional(readOnly = true)
    public Optional<Property> findByPropertyId(String propertyId) {
        return propertyRepository.findByPropertyId(propertyId);
    }

    @Transactional(readOnly = true)
    public Property getByPropertyId(String propertyId) {
        return propertyRepository.findByPropertyId(propertyId)
            .orElseThrow(() -> new EntityNotFoundException("Property not found: " + propertyId));
    }

    @Transactional(readOnly = true)
    public List<Property> findAll() {
        return propertyRepository.findAllByOrderByIdAsc();
    }

    @Transactional(readOnly = true)
    public List<Property> findByType(PropertyType propertyType) {
        return propertyRepository.findByPropertyType(propertyType);
    }

    @Transactional(readOnly = true)
    public List<Improvement> getImprovements(String propertyId) {
        return improvementRepository.findByPropertyIdOrderByIdAsc(propertyId);
    }

    // ========================================================================
    // Create
    // ========================================================================

    /**
     * Create a property. Status defaults to "active" and the extension map to
     * an empty object.
     */
    @Transactional
    public Property create(Property property) {
        if (property.getPropertyId() == null || property.getPropertyId().isBlank()) {
            throw new IllegalArgumentException("propertyId is required");
        }
        if (property.getPropertyType() == null || property.getAcres() == null) {
            throw new IllegalArgumentException("propertyType and acres are required");
        }
        if (propertyRepository.existsByPropertyId(property.getPropertyId())) {
            throw new IllegalArgumentException("Property already exists: " + property.getPropertyId());
        }
        if (property.getStatus() == null || property.getStatus().isBlank()) {
            property.setStatus("active");
        }
        if (property.getExtraFields() == null) {
            property.setExtraFields("{}");
        }

        Property saved = propertyRepository.save(property);
        activityPublisher.record("Created new property: " + describe(saved), ENTITY_KIND, saved.getPropertyId());
        return saved;
    }

    /**
     * Attach an improvement to an existing property.
     */
    @Transactional
    public Improvement addImprovement(String propertyId, Improvement improvement) {
        if (!propertyRepository.existsByPropertyId(propertyId)) {
            throw new EntityNotFoundException("Property not found: " + propertyId);
        }
        improvement.setId(null);
        improvement.setPropertyId(propertyId);
        Improvement saved = improvementRepository.save(improvement);
        activityPublisher.record("Added improvement to property", "improvement", propertyId);
        return saved;
    }

    // ========================================================================
    // Tracked update
    // ========================================================================

    /**
     * Update a property and record one lineage entry per changed field.
     * Retried from a fresh read if another update wins the race.
     *
     * @param patch field name to new value; only these fields are compared and changed
     */
    public Property updateProperty(String propertyId, Map<String, Object> patch, LineageSource source, Long userId) {
        Map<String, Object> normalized = normalize(patch);
        return updateExecutor.execute(ENTITY_KIND, propertyId, () -> {
            Property property = getByPropertyId(propertyId);
            return applyPatch(property, normalized, source, userId, "updateProperty");
        });
    }

    /**
     * Apply a patch inside the caller's transaction. Used by workflows that
     * already hold a transaction, such as reconciliation.
     */
    @Transactional
    public Property applyPatch(Property property, Map<String, Object> patch, LineageSource source,
                               Long userId, String operation) {
        Map<String, Object> normalized = normalize(patch);

        TrackedUpdate update = TrackedUpdate.of(
            ENTITY_KIND, property.getPropertyId(), property.getId(), operation, source, userId);
        int changes = mutationTracker.trackUpdate(update, trackedState(property), normalized).size();

        normalized.forEach((key, value) -> apply(property, key, value));
        Property saved = propertyRepository.saveAndFlush(property);

        if (changes > 0) {
            log.info("Property {} updated by {} ({} field change(s), source {})",
                saved.getPropertyId(), operation, changes, source.getValue());
            activityPublisher.record("Updated property: " + describe(saved), ENTITY_KIND, saved.getPropertyId());
        }
        return saved;
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    Map<String, Object> normalize(Map<String, Object> patch) {
        if (patch == null || patch.isEmpty()) {
            throw new IllegalArgumentException("Update must change at least one field");
        }
        Map<String, Object> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : patch.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if ("propertyId".equals(key) || "id".equals(key)) {
                throw new IllegalArgumentException("Property identifiers cannot be changed");
            }
            if (!UPDATABLE_FIELDS.contains(key)) {
                throw new IllegalArgumentException("Unknown property field: " + key);
            }
            normalized.put(key, switch (key) {
                case "propertyType" -> value instanceof PropertyType type ? type
                    : value == null ? null : PropertyType.fromValue(PatchValues.asString(key, value));
                case "acres" -> PatchValues.asDecimal(key, value, 19, 4);
                case "currentValue" -> PatchValues.asDecimal(key, value, 19, 2);
                case "extraFields" -> value == null ? new LinkedHashMap<String, Object>() : PatchValues.asMap(key, value);
                default -> PatchValues.asString(key, value);
            });
        }
        if (normalized.containsKey("propertyType") && normalized.get("propertyType") == null) {
            throw new IllegalArgumentException("propertyType cannot be cleared");
        }
        if (normalized.containsKey("acres") && normalized.get("acres") == null) {
            throw new IllegalArgumentException("acres cannot be cleared");
        }
        if (normalized.containsKey("status") && normalized.get("status") == null) {
            throw new IllegalArgumentException("status cannot be cleared");
        }
        return normalized;
    }

    /**
     * Current values of the tracked attributes, keyed like update payloads.
     */
    public Map<String, Object> trackedState(Property property) {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("address", property.getAddress());
        state.put("parcelNumber", property.getParcelNumber());
        state.put("propertyType", property.getPropertyType());
        state.put("acres", property.getAcres());
        state.put("currentValue", property.getCurrentValue());
        state.put("status", property.getStatus());
        state.put("extraFields", jsonColumns.readMap(property.getExtraFields()));
        return state;
    }

    private void apply(Property property, String key, Object value) {
        switch (key) {
            case "address" -> property.setAddress((String) value);
            case "parcelNumber" -> property.setParcelNumber((String) value);
            case "propertyType" -> property.setPropertyType((PropertyType) value);
            case "acres" -> property.setAcres((BigDecimal) value);
            case "currentValue" -> property.setCurrentValue((BigDecimal) value);
            case "status" -> property.setStatus((String) value);
            case "extraFields" -> property.setExtraFields(jsonColumns.writeMap(PatchValues.asMap(key, value)));
            default -> throw new IllegalArgumentException("Unknown property field: " + key);
        }
    }

    private static String describe(Property property) {
        return property.getAddress() != null ? property.getAddress() : property.getPropertyId();
    }
}
