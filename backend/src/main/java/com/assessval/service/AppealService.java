package com.assessval.service;

import com.assessval.event.SystemActivityPublisher;
import com.assessval.model.enums.AppealStatus;
import com.assessval.model.enums.LineageSource;
import com.assessval.model.lineage.LineageRecord;
import com.assessval.model.property.Appeal;
import com.assessval.repository.AppealRepository;
import com.assessval.repository.PropertyRepository;
import com.assessval.service.lineage.MutationTracker;
import com.assessval.service.lineage.TrackedUpdate;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Appeals against assessed values. Updates are filed in the property's
 * lineage as {@code appeal.<attribute>}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AppealService {

    private static final Set<String> UPDATABLE_FIELDS = Set.of(
        "appealType", "reason", "requestedValue", "hearingDate", "hearingLocation",
        "assignedTo", "status", "decision", "decisionReason");

    private final AppealRepository appealRepository;
    private final PropertyRepository propertyRepository;
    private final MutationTracker mutationTracker;
    private final OptimisticUpdateExecutor updateExecutor;
    private final SystemActivityPublisher activityPublisher;

    @Transactional(readOnly = true)
    public Appeal getAppeal(Long id) {
        return appealRepository.findById(id)
            .orElseThrow(() -> new EntityNotFoundException("Appeal not found: " + id));
    }

    @Transactional(readOnly = true)
    public List<Appeal> getAppealsByProperty(String propertyId) {
        return appealRepository.findByPropertyIdOrderByIdAsc(propertyId);
    }

    /**
     * File a new appeal. Status defaults to submitted, type to value.
     */
    @Transactional
    public Appeal create(Appeal appeal) {
        if (appeal.getAppealNumber() == null || appeal.getAppealNumber().isBlank()) {
            throw new IllegalArgumentException("appealNumber is required");
        }
        if (appealRepository.existsByAppealNumber(appeal.getAppealNumber())) {
            throw new IllegalArgumentException("Appeal already exists: " + appeal.getAppealNumber());
        }
        if (!propertyRepository.existsByPropertyId(appeal.getPropertyId())) {
            throw new EntityNotFoundException("Property not found: " + appeal.getPropertyId());
        }
        appeal.setId(null);
        if (appeal.getStatus() == null) {
            appeal.setStatus(AppealStatus.SUBMITTED);
        }
        if (appeal.getAppealType() == null) {
            appeal.setAppealType("value");
        }
        Appeal saved = appealRepository.save(appeal);
        activityPublisher.record("New appeal filed: " + saved.getAppealNumber(), "appeal", saved.getPropertyId());
        return saved;
    }

    public Appeal updateAppeal(Long id, Map<String, Object> patch, LineageSource source, Long userId) {
        Map<String, Object> normalized = normalize(patch);
        return updateExecutor.execute("appeal", String.valueOf(id), () -> {
            Appeal appeal = getAppeal(id);

            TrackedUpdate update = TrackedUpdate.of("appeal", appeal.getPropertyId(), id, "updateAppeal", source, userId)
                .withPrefix("appeal.");
            List<String> changed = mutationTracker.trackUpdate(update, snapshot(appeal), normalized).stream()
                .map(LineageRecord::getFieldName)
                .toList();

            normalized.forEach((key, value) -> apply(appeal, key, value));
            Appeal saved = appealRepository.saveAndFlush(appeal);

            if (changed.contains("appeal.status") || changed.contains("appeal.decision")) {
                log.info("Appeal {} moved to {} (decision {})",
                    saved.getAppealNumber(), saved.getStatus().getValue(), saved.getDecision());
                activityPublisher.record("Appeal updated for property ID: " + saved.getPropertyId(),
                    "appeal", saved.getPropertyId());
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
            if (!UPDATABLE_FIELDS.contains(key)) {
                throw new IllegalArgumentException("Unknown appeal field: " + key);
            }
            normalized.put(key, switch (key) {
                case "requestedValue" -> PatchValues.asDecimal(key, value, 19, 2);
                case "hearingDate" -> PatchValues.asDateTime(key, value);
                case "assignedTo" -> PatchValues.asLong(key, value);
                case "status" -> value instanceof AppealStatus status ? status
                    : value == null ? null : AppealStatus.fromValue(PatchValues.asString(key, value));
                default -> PatchValues.asString(key, value);
            });
        });
        if (normalized.containsKey("status") && normalized.get("status") == null) {
            throw new IllegalArgumentException("status cannot be cleared");
        }
        return normalized;
    }

    private static Map<String, Object> snapshot(Appeal appeal) {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("appealType", appeal.getAppealType());
        state.put("reason", appeal.getReason());
        state.put("requestedValue", appeal.getRequestedValue());
        state.put("hearingDate", appeal.getHearingDate());
        state.put("hearingLocation", appeal.getHearingLocation());
        state.put("assignedTo", appeal.getAssignedTo());
        state.put("status", appeal.getStatus());
        state.put("decision", appeal.getDecision());
        state.put("decisionReason", appeal.getDecisionReason());
        return state;
    }

    private static void apply(Appeal appeal, String key, Object value) {
        switch (key) {
            case "appealType" -> appeal.setAppealType((String) value);
            case "reason" -> appeal.setReason((String) value);
            case "requestedValue" -> appeal.setRequestedValue((BigDecimal) value);
            case "hearingDate" -> appeal.setHearingDate((LocalDateTime) value);
            case "hearingLocation" -> appeal.setHearingLocation((String) value);
            case "assignedTo" -> appeal.setAssignedTo((Long) value);
            case "status" -> appeal.setStatus((AppealStatus) value);
            case "decision" -> appeal.setDecision((String) value);
            case "decisionReason" -> appeal.setDecisionReason((String) value);
            default -> throw new IllegalArgumentException("Unknown appeal field: " + key);
        }
    }
}
