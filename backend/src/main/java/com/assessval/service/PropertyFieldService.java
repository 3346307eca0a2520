package com.assessval.service;

import com.assessval.event.SystemActivityPublisher;
import com.assessval.model.enums.LineageSource;
import com.assessval.model.property.PropertyField;
import com.assessval.repository.PropertyFieldRepository;
import com.assessval.repository.PropertyRepository;
import com.assessval.service.lineage.MutationTracker;
import com.assessval.service.lineage.TrackedUpdate;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed property fields. Updates are filed in the owning property's lineage
 * as {@code field.<fieldType>.<attribute>}.
 */
@Service
@RequiredArgsConstructor
public class PropertyFieldService {

    private final PropertyFieldRepository fieldRepository;
    private final PropertyRepository propertyRepository;
    private final MutationTracker mutationTracker;
    private final OptimisticUpdateExecutor updateExecutor;
    private final SystemActivityPublisher activityPublisher;

    @Transactional(readOnly = true)
    public PropertyField getField(Long id) {
        return fieldRepository.findById(id)
            .orElseThrow(() -> new EntityNotFoundException("Field not found: " + id));
    }

    @Transactional(readOnly = true)
    public List<PropertyField> getFieldsByProperty(String propertyId) {
        return fieldRepository.findByPropertyIdOrderByIdAsc(propertyId);
    }

    @Transactional
    public PropertyField create(PropertyField field) {
        if (field.getFieldType() == null || field.getFieldType().isBlank()) {
            throw new IllegalArgumentException("fieldType is required");
        }
        if (!propertyRepository.existsByPropertyId(field.getPropertyId())) {
            throw new EntityNotFoundException("Property not found: " + field.getPropertyId());
        }
        field.setId(null);
        return fieldRepository.save(field);
    }

    public PropertyField updateField(Long id, Map<String, Object> patch, LineageSource source, Long userId) {
        Map<String, Object> normalized = normalize(patch);
        return updateExecutor.execute("field", String.valueOf(id), () -> {
            PropertyField field = getField(id);

            Map<String, Object> before = new LinkedHashMap<>();
            before.put("fieldType", field.getFieldType());
            before.put("fieldValue", field.getFieldValue());

            TrackedUpdate update = TrackedUpdate.of("field", field.getPropertyId(), id, "updateField", source, userId)
                .withPrefix("field." + field.getFieldType() + ".");
            int changes = mutationTracker.trackUpdate(update, before, normalized).size();

            if (normalized.containsKey("fieldType")) {
                field.setFieldType((String) normalized.get("fieldType"));
            }
            if (normalized.containsKey("fieldValue")) {
                field.setFieldValue((String) normalized.get("fieldValue"));
            }
            PropertyField saved = fieldRepository.saveAndFlush(field);

            if (changes > 0) {
                activityPublisher.record(
                    "Updated field (" + saved.getFieldType() + ") for property ID: " + saved.getPropertyId(),
                    "field", saved.getPropertyId());
            }
            return saved;
        });
    }

    private static Map<String, Object> normalize(Map<String, Object> patch) {
        if (patch == null || patch.isEmpty()) {
            throw new IllegalArgumentException("Update must change at least one field");
        }
        Map<String, Object> normalized = new LinkedHashMap<>();
        patch.forEach((key, value) -> {
            if (!"fieldType".equals(key) && !"fieldValue".equals(key)) {
                throw new IllegalArgumentException("Unknown field attribute: " + key);
            }
            normalized.put(key, PatchValues.asString(key, value));
        });
        if (normalized.containsKey("fieldType") && normalized.get("fieldType") == null) {
            throw new IllegalArgumentException("fieldType cannot be cleared");
        }
        return normalized;
    }
}
