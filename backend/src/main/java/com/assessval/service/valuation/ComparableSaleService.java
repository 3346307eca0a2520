package com.assessval.service.valuation;

import com.assessval.event.SystemActivityPublisher;
import com.assessval.model.comparable.ComparableSale;
import com.assessval.model.enums.ComparableSaleStatus;
import com.assessval.model.enums.LineageSource;
import com.assessval.repository.ComparableSaleRepository;
import com.assessval.repository.PropertyRepository;
import com.assessval.service.JsonColumns;
import com.assessval.service.OptimisticUpdateExecutor;
import com.assessval.service.PatchValues;
import com.assessval.service.lineage.MutationTracker;
import com.assessval.service.lineage.TrackedUpdate;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Comparable sale entries curated by analysts. Entries are never deleted;
 * they are retired by moving them to {@code withdrawn}. Updates are filed in
 * the subject property's lineage as {@code comparableSale.<id>.<attribute>}.
 */
@Service
@Slf4j
public class ComparableSaleService {

    private static final Set<String> UPDATABLE_FIELDS = Set.of(
        "saleDate", "salePrice", "adjustedPrice", "distanceInMiles", "similarityScore",
        "adjustmentFactors", "notes", "status");

    private final ComparableSaleRepository saleRepository;
    private final PropertyRepository propertyRepository;
    private final ComparableDiscoveryService discoveryService;
    private final MutationTracker mutationTracker;
    private final OptimisticUpdateExecutor updateExecutor;
    private final SystemActivityPublisher activityPublisher;
    private final JsonColumns jsonColumns;

    public ComparableSaleService(
            ComparableSaleRepository saleRepository,
            PropertyRepository propertyRepository,
            ComparableDiscoveryService discoveryService,
            MutationTracker mutationTracker,
            OptimisticUpdateExecutor updateExecutor,
            SystemActivityPublisher activityPublisher,
            JsonColumns jsonColumns) {
        this.saleRepository = saleRepository;
        this.propertyRepository = propertyRepository;
        this.discoveryService = discoveryService;
        this.mutationTracker = mutationTracker;
        this.updateExecutor = updateExecutor;
        this.activityPublisher = activityPublisher;
        this.jsonColumns = jsonColumns;
    }

    // ========================================================================
    // Reads
    // ========================================================================

    @Transactional(readOnly = true)
    public ComparableSale getSale(Long id) {
        return saleRepository.findById(id)
            .orElseThrow(() -> new EntityNotFoundException("Comparable sale not found: " + id));
    }

    @Transactional(readOnly = true)
    public List<ComparableSale> getSalesBySubject(String propertyId) {
        return saleRepository.findByPropertyIdOrderByIdAsc(propertyId);
    }

    @Transactional(readOnly = true)
    public List<ComparableSale> getSalesByStatus(ComparableSaleStatus status) {
        return saleRepository.findByStatusOrderByIdAsc(status);
    }

    // ========================================================================
    // Create
    // ========================================================================

    @Transactional
    public ComparableSale create(ComparableSale sale) {
        if (sale.getPropertyId() == null || sale.getComparablePropertyId() == null) {
            throw new IllegalArgumentException("propertyId and comparablePropertyId are required");
        }
        if (sale.getPropertyId().equals(sale.getComparablePropertyId())) {
            throw new IllegalArgumentException("A property cannot be its own comparable");
        }
        if (!propertyRepository.existsByPropertyId(sale.getPropertyId())) {
            throw new EntityNotFoundException("Property not found: " + sale.getPropertyId());
        }
        sale.setId(null);
        if (sale.getStatus() == null) {
            sale.setStatus(ComparableSaleStatus.ACTIVE);
        }
        if (sale.getAdjustmentFactors() == null) {
            sale.setAdjustmentFactors("{}");
        }
        ComparableSale saved = saleRepository.save(sale);
        activityPublisher.record("Added comparable " + saved.getComparablePropertyId(),
            "comparableSale", saved.getPropertyId());
        return saved;
    }

    /**
     * Record the top discovery candidates as active comparable entries carrying
     * their similarity score. Sale data is left for the analyst to fill in.
     */
    @Transactional
    public List<ComparableSale> promoteCandidates(String subjectPropertyId, Integer count, Long userId) {
        ComparableSearchResult search = discoveryService.discover(subjectPropertyId, count);
        if (!search.subjectFound()) {
            throw new EntityNotFoundException("Property not found: " + subjectPropertyId);
        }

        List<ComparableSale> created = new ArrayList<>();
        for (ComparableCandidate candidate : search.candidates()) {
            created.add(create(ComparableSale.builder()
                .propertyId(subjectPropertyId)
                .comparablePropertyId(candidate.property().getPropertyId())
                .similarityScore(BigDecimal.valueOf(candidate.similarityScore()).setScale(4, RoundingMode.HALF_UP))
                .status(ComparableSaleStatus.ACTIVE)
                .createdBy(userId)
                .build()));
        }
        log.info("Promoted {} discovery candidate(s) for {}", created.size(), subjectPropertyId);
        return created;
    }

    // ========================================================================
    // Tracked update
    // ========================================================================

    public ComparableSale updateSale(Long id, Map<String, Object> patch, LineageSource source, Long userId) {
        Map<String, Object> normalized = normalize(patch);
        return updateExecutor.execute("comparableSale", String.valueOf(id), () -> {
            ComparableSale sale = getSale(id);

            TrackedUpdate update = TrackedUpdate.of(
                    "comparableSale", sale.getPropertyId(), id, "updateComparableSale", source, userId)
                .withPrefix("comparableSale." + id + ".");
            mutationTracker.trackUpdate(update, snapshot(sale), normalized);

            normalized.forEach((key, value) -> apply(sale, key, value));
            return saleRepository.saveAndFlush(sale);
        });
    }

    /**
     * Soft-retire an entry.
     */
    public ComparableSale withdraw(Long id, Long userId) {
        Map<String, Object> patch = new LinkedHashMap<>();
        patch.put("status", ComparableSaleStatus.WITHDRAWN);
        ComparableSale sale = updateSale(id, patch, LineageSource.MANUAL, userId);
        activityPublisher.record("Withdrew comparable " + sale.getComparablePropertyId(),
            "comparableSale", sale.getPropertyId());
        return sale;
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private static Map<String, Object> normalize(Map<String, Object> patch) {
        if (patch == null || patch.isEmpty()) {
            throw new IllegalArgumentException("Update must change at least one field");
        }
        Map<String, Object> normalized = new LinkedHashMap<>();
        patch.forEach((key, value) -> {
            if (!UPDATABLE_FIELDS.contains(key)) {
                throw new IllegalArgumentException("Unknown comparable sale field: " + key);
            }
            normalized.put(key, switch (key) {
                case "saleDate" -> PatchValues.asDate(key, value);
                case "salePrice", "adjustedPrice" -> PatchValues.asDecimal(key, value, 19, 2);
                case "distanceInMiles" -> PatchValues.asDecimal(key, value, 10, 3);
                case "similarityScore" -> PatchValues.asDecimal(key, value, 10, 4);
                case "adjustmentFactors" -> value == null ? new LinkedHashMap<String, Object>() : PatchValues.asMap(key, value);
                case "status" -> value instanceof ComparableSaleStatus status ? status
                    : value == null ? null : ComparableSaleStatus.fromValue(PatchValues.asString(key, value));
                default -> PatchValues.asString(key, value);
            });
        });
        if (normalized.containsKey("status") && normalized.get("status") == null) {
            throw new IllegalArgumentException("status cannot be cleared");
        }
        return normalized;
    }

    private Map<String, Object> snapshot(ComparableSale sale) {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("saleDate", sale.getSaleDate());
        state.put("salePrice", sale.getSalePrice());
        state.put("adjustedPrice", sale.getAdjustedPrice());
        state.put("distanceInMiles", sale.getDistanceInMiles());
        state.put("similarityScore", sale.getSimilarityScore());
        state.put("adjustmentFactors", jsonColumns.readMap(sale.getAdjustmentFactors()));
        state.put("notes", sale.getNotes());
        state.put("status", sale.getStatus());
        return state;
    }

    private void apply(ComparableSale sale, String key, Object value) {
        switch (key) {
            case "saleDate" -> sale.setSaleDate((LocalDate) value);
            case "salePrice" -> sale.setSalePrice((BigDecimal) value);
            case "adjustedPrice" -> sale.setAdjustedPrice((BigDecimal) value);
            case "distanceInMiles" -> sale.setDistanceInMiles((BigDecimal) value);
            case "similarityScore" -> sale.setSimilarityScore((BigDecimal) value);
            case "adjustmentFactors" -> sale.setAdjustmentFactors(jsonColumns.writeMap(PatchValues.asMap(key, value)));
            case "notes" -> sale.setNotes((String) value);
            case "status" -> sale.setStatus((ComparableSaleStatus) value);
            default -> throw new IllegalArgumentException("Unknown comparable sale field: " + key);
        }
    }
}
