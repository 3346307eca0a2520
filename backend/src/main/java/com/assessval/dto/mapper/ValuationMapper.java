package com.assessval.dto.mapper;

import com.assessval.dto.request.AddAnalysisEntryRequest;
import com.assessval.dto.request.CreateAnalysisRequest;
import com.assessval.dto.request.CreateComparableSaleRequest;
import com.assessval.dto.response.AnalysisEntryDto;
import com.assessval.dto.response.ComparableAnalysisDto;
import com.assessval.dto.response.ComparableSaleDto;
import com.assessval.model.comparable.AnalysisEntry;
import com.assessval.model.comparable.ComparableAnalysis;
import com.assessval.model.comparable.ComparableSale;
import com.assessval.model.enums.ConfidenceLevel;
import com.assessval.model.enums.Methodology;
import com.assessval.service.JsonColumns;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Mapper for comparable sales, analyses and analysis entries.
 */
@Component
public class ValuationMapper {

    private final JsonColumns jsonColumns;

    public ValuationMapper(JsonColumns jsonColumns) {
        this.jsonColumns = jsonColumns;
    }

    public ComparableSaleDto toDto(ComparableSale entity) {
        return new ComparableSaleDto(
            entity.getId(),
            entity.getPropertyId(),
            entity.getComparablePropertyId(),
            entity.getSaleDate(),
            entity.getSalePrice(),
            entity.getAdjustedPrice(),
            entity.getDistanceInMiles(),
            entity.getSimilarityScore(),
            jsonColumns.readMap(entity.getAdjustmentFactors()),
            entity.getNotes(),
            entity.getStatus() != null ? entity.getStatus().getValue() : null,
            entity.getCreatedBy(),
            entity.getCreatedAt(),
            entity.getLastUpdated()
        );
    }

    public List<ComparableSaleDto> toSaleDtoList(List<ComparableSale> entities) {
        return entities.stream().map(this::toDto).toList();
    }

    public ComparableAnalysisDto toDto(ComparableAnalysis entity, List<AnalysisEntry> entries) {
        return new ComparableAnalysisDto(
            entity.getId(),
            entity.getAnalysisId(),
            entity.getPropertyId(),
            entity.getTitle(),
            entity.getDescription(),
            entity.getMethodology() != null ? entity.getMethodology().getValue() : null,
            entity.getEffectiveDate(),
            entity.getValueConclusion(),
            entity.getAdjustmentNotes(),
            entity.getMarketConditions(),
            entity.getConfidenceLevel() != null ? entity.getConfidenceLevel().getValue() : null,
            entity.getStatus() != null ? entity.getStatus().getValue() : null,
            entity.isUpdatePropertyValue(),
            entity.getCreatedBy(),
            entity.getReviewedBy(),
            entity.getReviewNotes(),
            entity.getReviewDate(),
            entries.stream().map(this::toDto).toList(),
            entity.getCreatedAt(),
            entity.getLastUpdated()
        );
    }

    public AnalysisEntryDto toDto(AnalysisEntry entity) {
        return new AnalysisEntryDto(
            entity.getId(),
            entity.getAnalysisId(),
            entity.getComparableSaleId(),
            entity.isIncludeInFinalValue(),
            entity.getWeight(),
            entity.getAdjustedValue(),
            entity.getNotes(),
            entity.getCreatedAt()
        );
    }

    public ComparableSale toEntity(CreateComparableSaleRequest request) {
        return ComparableSale.builder()
            .propertyId(request.propertyId())
            .comparablePropertyId(request.comparablePropertyId())
            .saleDate(request.saleDate())
            .salePrice(request.salePrice())
            .adjustedPrice(request.adjustedPrice())
            .distanceInMiles(request.distanceInMiles())
            .similarityScore(request.similarityScore())
            .adjustmentFactors(request.adjustmentFactors() != null
                ? jsonColumns.writeMap(request.adjustmentFactors()) : null)
            .notes(request.notes())
            .createdBy(request.createdBy())
            .build();
    }

    public ComparableAnalysis toEntity(CreateAnalysisRequest request) {
        return ComparableAnalysis.builder()
            .analysisId(request.analysisId())
            .propertyId(request.propertyId())
            .title(request.title())
            .description(request.description())
            .methodology(request.methodology() != null ? Methodology.fromValue(request.methodology()) : null)
            .effectiveDate(request.effectiveDate())
            .adjustmentNotes(request.adjustmentNotes())
            .marketConditions(request.marketConditions())
            .confidenceLevel(request.confidenceLevel() != null
                ? ConfidenceLevel.fromValue(request.confidenceLevel()) : null)
            .updatePropertyValue(Boolean.TRUE.equals(request.updatePropertyValue()))
            .createdBy(request.createdBy())
            .build();
    }

    public AnalysisEntry toEntity(AddAnalysisEntryRequest request) {
        return AnalysisEntry.builder()
            .comparableSaleId(request.comparableSaleId())
            .includeInFinalValue(request.includeInFinalValue() == null || request.includeInFinalValue())
            .weight(request.weight() != null ? request.weight() : BigDecimal.ONE)
            .adjustedValue(request.adjustedValue())
            .notes(request.notes())
            .build();
    }
}
