package com.assessval.service.valuation;

import com.assessval.config.ValuationProperties;
import com.assessval.model.property.Improvement;
import com.assessval.model.property.Property;
import com.assessval.repository.ImprovementRepository;
import com.assessval.repository.PropertyRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Comparable Discovery Service
 *
 * Ranks every other property by similarity to a subject property.
 *
 * Scoring (additive):
 * - 100 when the property types match
 * - when both sides have an improvement, using the first improvement of each:
 *   - size: (1 - min(|candidate - subject| / subject, 1)) * 50
 *   - bedrooms: 25 for the same count, 15 when one apart
 *   - bathrooms: same scheme as bedrooms
 *
 * A metric only scores when both sides have a non-zero value. "First" means the
 * improvement recorded earliest; nothing else about it is considered. Candidates
 * are sorted by score descending with ties kept in insertion order.
 *
 * Read-only: discovery never writes.
 */
@Service
@Transactional(readOnly = true)
@Slf4j
public class ComparableDiscoveryService {

    static final double PROPERTY_TYPE_POINTS = 100;
    static final double SQUARE_FOOTAGE_POINTS = 50;
    static final double ROOM_EXACT_POINTS = 25;
    static final double ROOM_NEAR_POINTS = 15;

    private final PropertyRepository propertyRepository;
    private final ImprovementRepository improvementRepository;
    private final ValuationProperties properties;

    public ComparableDiscoveryService(
            PropertyRepository propertyRepository,
            ImprovementRepository improvementRepository,
            ValuationProperties properties) {
        this.propertyRepository = propertyRepository;
        this.improvementRepository = improvementRepository;
        this.properties = properties;
    }

    // ========================================================================
    // Public API
    // ========================================================================

    /**
     * Find up to {@code count} comparables for a subject property, best first.
     * Returns an empty list when the subject does not exist.
     */
    public List<ComparableCandidate> findComparables(String subjectPropertyId, Integer count) {
        return discover(subjectPropertyId, count).candidates();
    }

    /**
     * Same as {@link #findComparables} but tells a missing subject apart from
     * an empty result.
     */
    public ComparableSearchResult discover(String subjectPropertyId, Integer count) {
        int limit = resolveCount(count);

        Optional<Property> subjectOpt = propertyRepository.findByPropertyId(subjectPropertyId);
        if (subjectOpt.isEmpty()) {
            log.info("Comparable search for unknown property {}", subjectPropertyId);
            return ComparableSearchResult.subjectMissing(subjectPropertyId);
        }
        Property subject = subjectOpt.get();

        List<Property> pool = propertyRepository.findAllByOrderByIdAsc().stream()
            .filter(p -> !subjectPropertyId.equals(p.getPropertyId()))
            .toList();

        Map<String, Improvement> firstImprovements = firstImprovementByProperty(pool, subjectPropertyId);
        Improvement subjectImprovement = firstImprovements.get(subjectPropertyId);

        List<ComparableCandidate> scored = new ArrayList<>(pool.size());
        for (Property candidate : pool) {
            double score = computeSimilarity(
                subject, subjectImprovement, candidate, firstImprovements.get(candidate.getPropertyId()));
            scored.add(new ComparableCandidate(candidate, score));
        }

        // List.sort is stable, so equal scores keep pool order
        scored.sort(Comparator.comparingDouble(ComparableCandidate::similarityScore).reversed());

        List<ComparableCandidate> result = List.copyOf(scored.subList(0, Math.min(limit, scored.size())));
        log.info("Comparable search for {}: {} candidate(s) scored, returning {}",
            subjectPropertyId, scored.size(), result.size());
        return new ComparableSearchResult(subjectPropertyId, true, result);
    }

    // ========================================================================
    // Scoring
    // ========================================================================

    /**
     * Similarity of a candidate to the subject. Improvements may be {@code null}
     * when a property has none.
     */
    public double computeSimilarity(Property subject, Improvement subjectImprovement,
                                    Property candidate, Improvement candidateImprovement) {
        double score = subject.getPropertyType() == candidate.getPropertyType() ? PROPERTY_TYPE_POINTS : 0;

        if (subjectImprovement == null || candidateImprovement == null) {
            return score;
        }

        score += squareFootageTerm(subjectImprovement.getSquareFeet(), candidateImprovement.getSquareFeet());
        score += roomCountTerm(toDecimal(subjectImprovement.getBedrooms()), toDecimal(candidateImprovement.getBedrooms()));
        score += roomCountTerm(subjectImprovement.getBathrooms(), candidateImprovement.getBathrooms());
        return score;
    }

    /**
     * Full points at identical size, falling linearly to zero at 100% deviation
     * and pinned at zero beyond.
     */
    double squareFootageTerm(BigDecimal subjectSqft, BigDecimal candidateSqft) {
        if (!hasValue(subjectSqft) || !hasValue(candidateSqft)) {
            return 0;
        }
        double subject = subjectSqft.doubleValue();
        double ratio = Math.abs(candidateSqft.doubleValue() - subject) / subject;
        return (1 - Math.min(ratio, 1)) * SQUARE_FOOTAGE_POINTS;
    }

    double roomCountTerm(BigDecimal subjectCount, BigDecimal candidateCount) {
        if (!hasValue(subjectCount) || !hasValue(candidateCount)) {
            return 0;
        }
        BigDecimal diff = candidateCount.subtract(subjectCount).abs();
        if (diff.signum() == 0) {
            return ROOM_EXACT_POINTS;
        }
        if (diff.compareTo(BigDecimal.ONE) == 0) {
            return ROOM_NEAR_POINTS;
        }
        return 0;
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private Map<String, Improvement> firstImprovementByProperty(List<Property> pool, String subjectPropertyId) {
        List<String> ids = new ArrayList<>(pool.size() + 1);
        ids.add(subjectPropertyId);
        pool.forEach(p -> ids.add(p.getPropertyId()));

        Map<String, Improvement> first = new HashMap<>();
        for (Improvement improvement : improvementRepository.findByPropertyIdInOrderByIdAsc(ids)) {
            first.putIfAbsent(improvement.getPropertyId(), improvement);
        }
        return first;
    }

    private int resolveCount(Integer count) {
        ValuationProperties.Discovery config = properties.getDiscovery();
        int requested = count == null ? config.getDefaultCount() : count;
        if (requested < 0) {
            throw new IllegalArgumentException("count must not be negative: " + requested);
        }
        return Math.min(requested, config.getMaxCount());
    }

    private static boolean hasValue(BigDecimal value) {
        return value != null && value.signum() != 0;
    }

    private static BigDecimal toDecimal(Integer value) {
        return value == null ? null : BigDecimal.valueOf(value);
    }
}
