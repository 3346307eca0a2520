package com.assessval.service.valuation;

import com.assessval.event.SystemActivityPublisher;
import com.assessval.exception.AnalysisFinalizedException;
import com.assessval.model.comparable.AnalysisEntry;
import com.assessval.model.comparable.ComparableAnalysis;
import com.assessval.model.enums.AnalysisStatus;
import com.assessval.model.enums.ConfidenceLevel;
import com.assessval.model.enums.LineageSource;
import com.assessval.model.enums.Methodology;
import com.assessval.repository.AnalysisEntryRepository;
import com.assessval.repository.ComparableAnalysisRepository;
import com.assessval.repository.ComparableSaleRepository;
import com.assessval.repository.PropertyRepository;
import com.assessval.service.OptimisticUpdateExecutor;
import com.assessval.service.PatchValues;
import com.assessval.service.lineage.MutationTracker;
import com.assessval.service.lineage.TrackedUpdate;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Comparable Analysis Service
 *
 * Lifecycle of reconciliation sessions and their entries:
 * draft -> in_review -> final. Entries can be added, changed and removed
 * until the analysis is final. Analysis and entry changes are filed in the
 * subject property's lineage under {@code analysis.<analysisId>.}.
 */
@Service
@Slf4j
public class ComparableAnalysisService {

    /**
     * Fields callers may edit directly. Status and value conclusion only change
     * through review, finalization and reconciliation.
     */
    private static final Set<String> EDITABLE_FIELDS = Set.of(
        "title", "description", "methodology", "effectiveDate", "adjustmentNotes",
        "marketConditions", "confidenceLevel", "updatePropertyValue");

    private static final Set<String> ENTRY_FIELDS = Set.of(
        "includeInFinalValue", "weight", "adjustedValue", "notes");

    private final ComparableAnalysisRepository analysisRepository;
    private final AnalysisEntryRepository entryRepository;
    private final ComparableSaleRepository saleRepository;
    private final PropertyRepository propertyRepository;
    private final MutationTracker mutationTracker;
    private final OptimisticUpdateExecutor updateExecutor;
    private final SystemActivityPublisher activityPublisher;
    private final Clock clock;

    public ComparableAnalysisService(
            ComparableAnalysisRepository analysisRepository,
            AnalysisEntryRepository entryRepository,
            ComparableSaleRepository saleRepository,
            PropertyRepository propertyRepository,
            MutationTracker mutationTracker,
            OptimisticUpdateExecutor updateExecutor,
            SystemActivityPublisher activityPublisher,
            Clock clock) {
        this.analysisRepository = analysisRepository;
        this.entryRepository = entryRepository;
        this.saleRepository = saleRepository;
        this.propertyRepository = propertyRepository;
        this.mutationTracker = mutationTracker;
        this.updateExecutor = updateExecutor;
        this.activityPublisher = activityPublisher;
        this.clock = clock;
    }

    // ========================================================================
    // Reads
    // ========================================================================

    @Transactional(readOnly = true)
    public ComparableAnalysis getAnalysis(String analysisId) {
        return analysisRepository.findByAnalysisId(analysisId)
            .orElseThrow(() -> new EntityNotFoundException("Analysis not found: " + analysisId));
    }

    /**
     * Load an analysis inside the caller's transaction for a change to it or
     * its entries. Concurrent changes to the same analysis fail the later
     * commit with an optimistic-lock conflict.
     */
    @Transactional
    public ComparableAnalysis getAnalysisForChange(String analysisId) {
        return analysisRepository.findForChangeByAnalysisId(analysisId)
            .orElseThrow(() -> new EntityNotFoundException("Analysis not found: " + analysisId));
    }

    @Transactional(readOnly = true)
    public List<ComparableAnalysis> getAnalysesByProperty(String propertyId) {
        return analysisRepository.findByPropertyIdOrderByIdAsc(propertyId);
    }

    @Transactional(readOnly = true)
    public List<AnalysisEntry> getEntries(String analysisId) {
        return entryRepository.findByAnalysisIdOrderByIdAsc(analysisId);
    }

    // ========================================================================
    // Analysis lifecycle
    // ========================================================================

    /**
     * Open a new analysis in draft. A value conclusion supplied by the caller is
     * ignored; only reconciliation sets it.
     */
    @Transactional
    public ComparableAnalysis create(ComparableAnalysis analysis) {
        if (analysis.getTitle() == null || analysis.getTitle().isBlank()) {
            throw new IllegalArgumentException("title is required");
        }
        if (!propertyRepository.existsByPropertyId(analysis.getPropertyId())) {
            throw new EntityNotFoundException("Property not found: " + analysis.getPropertyId());
        }
        if (analysis.getAnalysisId() == null || analysis.getAnalysisId().isBlank()) {
            analysis.setAnalysisId(generateAnalysisId());
        } else if (analysisRepository.existsByAnalysisId(analysis.getAnalysisId())) {
            throw new IllegalArgumentException("Analysis already exists: " + analysis.getAnalysisId());
        }

        analysis.setId(null);
        analysis.setStatus(AnalysisStatus.DRAFT);
        analysis.setValueConclusion(null);
        if (analysis.getMethodology() == null) {
            analysis.setMethodology(Methodology.SALES_COMPARISON);
        }
        if (analysis.getConfidenceLevel() == null) {
            analysis.setConfidenceLevel(ConfidenceLevel.MEDIUM);
        }
        if (analysis.getEffectiveDate() == null) {
            analysis.setEffectiveDate(LocalDate.now(clock));
        }

        ComparableAnalysis saved = analysisRepository.save(analysis);
        activityPublisher.record("Created comparable analysis: " + saved.getTitle(),
            "comparableAnalysis", saved.getPropertyId());
        return saved;
    }

    public ComparableAnalysis updateAnalysis(String analysisId, Map<String, Object> patch,
                                             LineageSource source, Long userId) {
        if (patch == null || patch.isEmpty()) {
            throw new IllegalArgumentException("Update must change at least one field");
        }
        patch.keySet().forEach(key -> {
            if (!EDITABLE_FIELDS.contains(key)) {
                throw new IllegalArgumentException("Field cannot be edited directly: " + key);
            }
        });
        return updateExecutor.execute("comparableAnalysis", analysisId, () -> {
            ComparableAnalysis analysis = requireOpen(analysisId);
            return applyPatch(analysis, patch, source, userId, "updateAnalysis");
        });
    }

    /**
     * Move a draft analysis to review.
     */
    public ComparableAnalysis submitForReview(String analysisId, Long userId) {
        return updateExecutor.execute("comparableAnalysis", analysisId, () -> {
            ComparableAnalysis analysis = requireOpen(analysisId);
            if (analysis.getStatus() != AnalysisStatus.DRAFT) {
                throw new IllegalStateException("Only draft analyses can be submitted for review: " + analysisId);
            }
            Map<String, Object> patch = new LinkedHashMap<>();
            patch.put("status", AnalysisStatus.IN_REVIEW);
            return applyPatch(analysis, patch, LineageSource.MANUAL, userId, "submitForReview");
        });
    }

    /**
     * Make the analysis final. Requires a value conclusion; afterwards neither
     * the analysis nor its entries can change.
     */
    public ComparableAnalysis finalizeAnalysis(String analysisId, Long reviewerId, String reviewNotes) {
        return updateExecutor.execute("comparableAnalysis", analysisId, () -> {
            ComparableAnalysis analysis = requireOpen(analysisId);
            if (analysis.getValueConclusion() == null) {
                throw new IllegalStateException("Analysis has no value conclusion; reconcile it first: " + analysisId);
            }
            Map<String, Object> patch = new LinkedHashMap<>();
            patch.put("status", AnalysisStatus.FINAL);
            patch.put("reviewedBy", reviewerId);
            patch.put("reviewDate", LocalDateTime.now(clock));
            if (reviewNotes != null) {
                patch.put("reviewNotes", reviewNotes);
            }
            ComparableAnalysis saved = applyPatch(analysis, patch, LineageSource.VALIDATED, reviewerId, "finalizeAnalysis");
            log.info("Analysis {} finalized with value {}", analysisId, saved.getValueConclusion().toPlainString());
            return saved;
        });
    }

    /**
     * Apply a tracked patch inside the caller's transaction.
     */
    @Transactional
    public ComparableAnalysis applyPatch(ComparableAnalysis analysis, Map<String, Object> patch,
                                         LineageSource source, Long userId, String operation) {
        Map<String, Object> normalized = normalizeAnalysisPatch(patch);

        TrackedUpdate update = TrackedUpdate.of(
                "comparableAnalysis", analysis.getPropertyId(), analysis.getAnalysisId(), operation, source, userId)
            .withPrefix("analysis." + analysis.getAnalysisId() + ".");
        mutationTracker.trackUpdate(update, snapshot(analysis), normalized);

        normalized.forEach((key, value) -> apply(analysis, key, value));
        return analysisRepository.saveAndFlush(analysis);
    }

    // ========================================================================
    // Entries
    // ========================================================================

    public AnalysisEntry addEntry(String analysisId, AnalysisEntry entry) {
        entry.setWeight(entry.getWeight() == null
            ? BigDecimal.ONE : PatchValues.asDecimal("weight", entry.getWeight(), 19, 6));
        entry.setAdjustedValue(PatchValues.asDecimal("adjustedValue", entry.getAdjustedValue(), 19, 2));
        validateWeight(entry.getWeight());

        return updateExecutor.execute("comparableAnalysis", analysisId, () -> {
            requireOpen(analysisId);
            if (entry.getComparableSaleId() == null || !saleRepository.existsById(entry.getComparableSaleId())) {
                throw new EntityNotFoundException("Comparable sale not found: " + entry.getComparableSaleId());
            }
            entry.setId(null);
            entry.setVersion(null);
            entry.setAnalysisId(analysisId);
            entry.setCreatedAt(LocalDateTime.now(clock));
            return entryRepository.save(entry);
        });
    }

    public AnalysisEntry updateEntry(Long entryId, Map<String, Object> patch, LineageSource source, Long userId) {
        Map<String, Object> normalized = normalizeEntryPatch(patch);
        return updateExecutor.execute("analysisEntry", String.valueOf(entryId), () -> {
            AnalysisEntry entry = getEntry(entryId);
            ComparableAnalysis analysis = requireOpen(entry.getAnalysisId());

            Map<String, Object> before = new LinkedHashMap<>();
            before.put("includeInFinalValue", entry.isIncludeInFinalValue());
            before.put("weight", entry.getWeight());
            before.put("adjustedValue", entry.getAdjustedValue());
            before.put("notes", entry.getNotes());

            TrackedUpdate update = TrackedUpdate.of(
                    "analysisEntry", analysis.getPropertyId(), entryId, "updateAnalysisEntry", source, userId)
                .withPrefix("analysis." + analysis.getAnalysisId() + ".entry." + entryId + ".");
            mutationTracker.trackUpdate(update, before, normalized);

            normalized.forEach((key, value) -> {
                switch (key) {
                    case "includeInFinalValue" -> entry.setIncludeInFinalValue((Boolean) value);
                    case "weight" -> entry.setWeight((BigDecimal) value);
                    case "adjustedValue" -> entry.setAdjustedValue((BigDecimal) value);
                    case "notes" -> entry.setNotes((String) value);
                    default -> throw new IllegalArgumentException("Unknown entry field: " + key);
                }
            });
            return entryRepository.saveAndFlush(entry);
        });
    }

    public void removeEntry(Long entryId) {
        updateExecutor.execute("analysisEntry", String.valueOf(entryId), () -> {
            AnalysisEntry entry = getEntry(entryId);
            requireOpen(entry.getAnalysisId());
            entryRepository.delete(entry);
            return null;
        });
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private AnalysisEntry getEntry(Long entryId) {
        return entryRepository.findById(entryId)
            .orElseThrow(() -> new EntityNotFoundException("Analysis entry not found: " + entryId));
    }

    private ComparableAnalysis requireOpen(String analysisId) {
        ComparableAnalysis analysis = getAnalysisForChange(analysisId);
        if (analysis.isFinal()) {
            throw new AnalysisFinalizedException(analysisId);
        }
        return analysis;
    }

    private static void validateWeight(BigDecimal weight) {
        if (weight == null || weight.signum() < 0) {
            throw new IllegalArgumentException("weight must be zero or positive: " + weight);
        }
    }

    private static Map<String, Object> normalizeEntryPatch(Map<String, Object> patch) {
        if (patch == null || patch.isEmpty()) {
            throw new IllegalArgumentException("Update must change at least one field");
        }
        Map<String, Object> normalized = new LinkedHashMap<>();
        patch.forEach((key, value) -> {
            if (!ENTRY_FIELDS.contains(key)) {
                throw new IllegalArgumentException("Unknown entry field: " + key);
            }
            normalized.put(key, switch (key) {
                case "includeInFinalValue" -> PatchValues.asBoolean(key, value);
                case "weight" -> PatchValues.asDecimal(key, value, 19, 6);
                case "adjustedValue" -> PatchValues.asDecimal(key, value, 19, 2);
                default -> PatchValues.asString(key, value);
            });
        });
        if (normalized.containsKey("includeInFinalValue") && normalized.get("includeInFinalValue") == null) {
            throw new IllegalArgumentException("includeInFinalValue cannot be cleared");
        }
        if (normalized.containsKey("weight")) {
            validateWeight((BigDecimal) normalized.get("weight"));
        }
        return normalized;
    }

    private static Map<String, Object> normalizeAnalysisPatch(Map<String, Object> patch) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        patch.forEach((key, value) -> normalized.put(key, switch (key) {
            case "title", "description", "adjustmentNotes", "marketConditions", "reviewNotes" ->
                PatchValues.asString(key, value);
            case "methodology" -> value instanceof Methodology m ? m
                : value == null ? null : Methodology.fromValue(PatchValues.asString(key, value));
            case "confidenceLevel" -> value instanceof ConfidenceLevel c ? c
                : value == null ? null : ConfidenceLevel.fromValue(PatchValues.asString(key, value));
            case "status" -> value instanceof AnalysisStatus s ? s
                : AnalysisStatus.fromValue(PatchValues.asString(key, value));
            case "effectiveDate" -> PatchValues.asDate(key, value);
            case "valueConclusion" -> PatchValues.asDecimal(key, value, 19, 2);
            case "updatePropertyValue" -> PatchValues.asBoolean(key, value);
            case "reviewedBy" -> PatchValues.asLong(key, value);
            case "reviewDate" -> PatchValues.asDateTime(key, value);
            default -> throw new IllegalArgumentException("Unknown analysis field: " + key);
        }));
        if (normalized.containsKey("title") && normalized.get("title") == null) {
            throw new IllegalArgumentException("title cannot be cleared");
        }
        if (normalized.containsKey("methodology") && normalized.get("methodology") == null) {
            throw new IllegalArgumentException("methodology cannot be cleared");
        }
        if (normalized.containsKey("updatePropertyValue") && normalized.get("updatePropertyValue") == null) {
            throw new IllegalArgumentException("updatePropertyValue cannot be cleared");
        }
        return normalized;
    }

    private static Map<String, Object> snapshot(ComparableAnalysis analysis) {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("title", analysis.getTitle());
        state.put("description", analysis.getDescription());
        state.put("methodology", analysis.getMethodology());
        state.put("effectiveDate", analysis.getEffectiveDate());
        state.put("valueConclusion", analysis.getValueConclusion());
        state.put("adjustmentNotes", analysis.getAdjustmentNotes());
        state.put("marketConditions", analysis.getMarketConditions());
        state.put("confidenceLevel", analysis.getConfidenceLevel());
        state.put("status", analysis.getStatus());
        state.put("updatePropertyValue", analysis.isUpdatePropertyValue());
        state.put("reviewedBy", analysis.getReviewedBy());
        state.put("reviewNotes", analysis.getReviewNotes());
        state.put("reviewDate", analysis.getReviewDate());
        return state;
    }

    private static void apply(ComparableAnalysis analysis, String key, Object value) {
        switch (key) {
            case "title" -> analysis.setTitle((String) value);
            case "description" -> analysis.setDescription((String) value);
            case "methodology" -> analysis.setMethodology((Methodology) value);
            case "effectiveDate" -> analysis.setEffectiveDate((LocalDate) value);
            case "valueConclusion" -> analysis.setValueConclusion((BigDecimal) value);
            case "adjustmentNotes" -> analysis.setAdjustmentNotes((String) value);
            case "marketConditions" -> analysis.setMarketConditions((String) value);
            case "confidenceLevel" -> analysis.setConfidenceLevel((ConfidenceLevel) value);
            case "status" -> analysis.setStatus((AnalysisStatus) value);
            case "updatePropertyValue" -> analysis.setUpdatePropertyValue((Boolean) value);
            case "reviewedBy" -> analysis.setReviewedBy((Long) value);
            case "reviewNotes" -> analysis.setReviewNotes((String) value);
            case "reviewDate" -> analysis.setReviewDate((LocalDateTime) value);
            default -> throw new IllegalArgumentException("Unknown analysis field: " + key);
        }
    }

    private static String generateAnalysisId() {
        return "CA-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
    }
}
