package com.assessval.service.valuation;

import com.assessval.event.SystemActivityPublisher;
import com.assessval.exception.AnalysisFinalizedException;
import com.assessval.exception.NoParticipatingEntriesException;
import com.assessval.model.comparable.AnalysisEntry;
import com.assessval.model.comparable.ComparableAnalysis;
import com.assessval.model.comparable.ComparableSale;
import com.assessval.model.enums.ComparableSaleStatus;
import com.assessval.model.enums.LineageSource;
import com.assessval.model.property.Property;
import com.assessval.repository.AnalysisEntryRepository;
import com.assessval.repository.ComparableSaleRepository;
import com.assessval.service.OptimisticUpdateExecutor;
import com.assessval.service.PropertyService;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Reconciliation Service
 *
 * Turns the weighted entries of a comparable analysis into one value conclusion:
 * sum(value * weight) / sum(weight) over the included entries that resolve to a
 * value. The conclusion is written to the analysis, and to the subject property
 * when the analysis asks for it, through the lineage-tracked update paths.
 */
@Service
@Slf4j
public class ReconciliationService {

    static final int CONCLUSION_SCALE = 2;

    private final ComparableAnalysisService analysisService;
    private final AnalysisEntryRepository entryRepository;
    private final ComparableSaleRepository saleRepository;
    private final PropertyService propertyService;
    private final OptimisticUpdateExecutor updateExecutor;
    private final SystemActivityPublisher activityPublisher;

    public ReconciliationService(
            ComparableAnalysisService analysisService,
            AnalysisEntryRepository entryRepository,
            ComparableSaleRepository saleRepository,
            PropertyService propertyService,
            OptimisticUpdateExecutor updateExecutor,
            SystemActivityPublisher activityPublisher) {
        this.analysisService = analysisService;
        this.entryRepository = entryRepository;
        this.saleRepository = saleRepository;
        this.propertyService = propertyService;
        this.updateExecutor = updateExecutor;
        this.activityPublisher = activityPublisher;
    }

    /**
     * Reconcile an analysis and persist its conclusion.
     *
     * @throws EntityNotFoundException        the analysis, an included entry's sale, or the subject is missing
     * @throws AnalysisFinalizedException     the analysis is already final
     * @throws NoParticipatingEntriesException no included entry carries a usable value and weight
     */
    public ReconciliationResult reconcile(String analysisId, Long userId) {
        return updateExecutor.execute("comparableAnalysis", analysisId, () -> {
            ComparableAnalysis analysis = analysisService.getAnalysisForChange(analysisId);
            if (analysis.isFinal()) {
                throw new AnalysisFinalizedException(analysisId);
            }

            List<AnalysisEntry> entries = entryRepository.findByAnalysisIdOrderByIdAsc(analysisId);
            Tally tally = calculate(entries, loadIncludedSales(entries));
            if (tally.totalWeight().signum() == 0) {
                log.warn("Analysis {} has nothing to reconcile: {}", analysisId, tally.warnings());
                throw new NoParticipatingEntriesException(analysisId, tally.warnings());
            }

            BigDecimal conclusion = tally.conclusion();
            Map<String, Object> analysisPatch = new LinkedHashMap<>();
            analysisPatch.put("valueConclusion", conclusion);
            analysisService.applyPatch(analysis, analysisPatch, LineageSource.CALCULATED, userId, "reconcileAnalysis");

            boolean propertyUpdated = false;
            if (analysis.isUpdatePropertyValue()) {
                Property subject = propertyService.getByPropertyId(analysis.getPropertyId());
                Map<String, Object> propertyPatch = new LinkedHashMap<>();
                propertyPatch.put("currentValue", conclusion);
                propertyService.applyPatch(subject, propertyPatch, LineageSource.CALCULATED, userId, "reconcileAnalysis");
                propertyUpdated = true;
            }

            log.info("Reconciled analysis {} to {} from {} entries",
                analysisId, conclusion.toPlainString(), tally.participating());
            activityPublisher.record(
                String.format("Reconciled analysis %s to %s", analysisId, conclusion.toPlainString()),
                "comparableAnalysis", analysis.getPropertyId());

            return new ReconciliationResult(analysisId, conclusion, tally.participating(),
                tally.totalWeight(), propertyUpdated, tally.warnings());
        });
    }

    /**
     * Weighted computation over already loaded data. Every included entry's sale
     * must be present in {@code salesById}.
     */
    public Tally calculate(List<AnalysisEntry> entries, Map<Long, ComparableSale> salesById) {
        BigDecimal weightedSum = BigDecimal.ZERO;
        BigDecimal totalWeight = BigDecimal.ZERO;
        int participating = 0;
        List<String> warnings = new ArrayList<>();

        for (AnalysisEntry entry : entries) {
            if (!entry.isIncludeInFinalValue()) {
                continue;
            }
            ComparableSale sale = salesById.get(entry.getComparableSaleId());
            if (sale == null) {
                throw new EntityNotFoundException("Comparable sale not found: " + entry.getComparableSaleId());
            }
            BigDecimal value = effectiveValue(entry, sale);
            if (value == null) {
                warnings.add(String.format("Entry %d (sale %d) has no adjusted value, adjusted price or sale price; excluded",
                    entry.getId(), sale.getId()));
                continue;
            }
            if (sale.getStatus() != null && sale.getStatus() != ComparableSaleStatus.ACTIVE) {
                warnings.add(String.format("Entry %d uses sale %d with status %s",
                    entry.getId(), sale.getId(), sale.getStatus().getValue()));
            }
            BigDecimal weight = entry.getWeight() == null ? BigDecimal.ONE : entry.getWeight();
            weightedSum = weightedSum.add(value.multiply(weight));
            totalWeight = totalWeight.add(weight);
            participating++;
        }
        return new Tally(weightedSum, totalWeight, participating, List.copyOf(warnings));
    }

    static BigDecimal effectiveValue(AnalysisEntry entry, ComparableSale sale) {
        if (entry.getAdjustedValue() != null) {
            return entry.getAdjustedValue();
        }
        if (sale.getAdjustedPrice() != null) {
            return sale.getAdjustedPrice();
        }
        return sale.getSalePrice();
    }

    private Map<Long, ComparableSale> loadIncludedSales(List<AnalysisEntry> entries) {
        Set<Long> saleIds = entries.stream()
            .filter(AnalysisEntry::isIncludeInFinalValue)
            .map(AnalysisEntry::getComparableSaleId)
            .collect(Collectors.toSet());
        if (saleIds.isEmpty()) {
            return Map.of();
        }
        return saleRepository.findByIdIn(saleIds).stream()
            .collect(Collectors.toMap(ComparableSale::getId, Function.identity()));
    }

    /**
     * Running sums of one reconciliation.
     */
    public record Tally(BigDecimal weightedSum, BigDecimal totalWeight, int participating, List<String> warnings) {

        public BigDecimal conclusion() {
            return weightedSum.divide(totalWeight, MathContext.DECIMAL128)
                .setScale(CONCLUSION_SCALE, RoundingMode.HALF_EVEN);
        }
    }
}
