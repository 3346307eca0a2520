package com.assessval.dto.mapper;

import com.assessval.dto.request.*;
import com.assessval.dto.response.*;
import com.assessval.model.enums.PropertyType;
import com.assessval.model.property.Appeal;
import com.assessval.model.property.Improvement;
import com.assessval.model.property.Property;
import com.assessval.model.property.PropertyField;
import com.assessval.service.JsonColumns;
import com.assessval.service.valuation.ComparableSearchResult;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Mapper for converting between property-side entities and DTOs.
 */
@Component
public class PropertyMapper {

    private final JsonColumns jsonColumns;

    public PropertyMapper(JsonColumns jsonColumns) {
        this.jsonColumns = jsonColumns;
    }

    // ========================================================================
    // Entity -> DTO Conversions
    // ========================================================================

    public PropertyDto toDto(Property entity) {
        if (entity == null) {
            return null;
        }
        return new PropertyDto(
            entity.getId(),
            entity.getPropertyId(),
            entity.getAddress(),
            entity.getParcelNumber(),
            entity.getPropertyType() != null ? entity.getPropertyType().getValue() : null,
            entity.getAcres(),
            entity.getCurrentValue(),
            entity.getStatus(),
            jsonColumns.readMap(entity.getExtraFields()),
            entity.getCreatedAt(),
            entity.getLastUpdated()
        );
    }

    public List<PropertyDto> toPropertyDtoList(List<Property> entities) {
        return entities.stream().map(this::toDto).toList();
    }

    public ImprovementDto toDto(Improvement entity) {
        return new ImprovementDto(
            entity.getId(),
            entity.getPropertyId(),
            entity.getImprovementType(),
            entity.getYearBuilt(),
            entity.getSquareFeet(),
            entity.getBedrooms(),
            entity.getBathrooms(),
            entity.getQuality(),
            entity.getCondition()
        );
    }

    public PropertyFieldDto toDto(PropertyField entity) {
        return new PropertyFieldDto(
            entity.getId(),
            entity.getPropertyId(),
            entity.getFieldType(),
            entity.getFieldValue(),
            entity.getLastUpdated()
        );
    }

    public AppealDto toDto(Appeal entity) {
        return new AppealDto(
            entity.getId(),
            entity.getAppealNumber(),
            entity.getPropertyId(),
            entity.getUserId(),
            entity.getAppealType(),
            entity.getReason(),
            entity.getRequestedValue(),
            entity.getHearingDate(),
            entity.getHearingLocation(),
            entity.getAssignedTo(),
            entity.getStatus() != null ? entity.getStatus().getValue() : null,
            entity.getDecision(),
            entity.getDecisionReason(),
            entity.getCreatedAt(),
            entity.getLastUpdated()
        );
    }

    public ComparableSearchDto toDto(ComparableSearchResult result) {
        List<ComparableSearchDto.CandidateDto> candidates = result.candidates().stream()
            .map(candidate -> new ComparableSearchDto.CandidateDto(
                toDto(candidate.property()), candidate.similarityScore()))
            .toList();
        return new ComparableSearchDto(result.subjectPropertyId(), result.subjectFound(), candidates);
    }

    // ========================================================================
    // DTO -> Entity Conversions
    // ========================================================================

    public Property toEntity(CreatePropertyRequest request) {
        return Property.builder()
            .propertyId(request.propertyId())
            .address(request.address())
            .parcelNumber(request.parcelNumber())
            .propertyType(PropertyType.fromValue(request.propertyType()))
            .acres(request.acres())
            .currentValue(request.currentValue())
            .status(request.status())
            .extraFields(request.extraFields() != null ? jsonColumns.writeMap(request.extraFields()) : null)
            .build();
    }

    public Improvement toEntity(CreateImprovementRequest request) {
        return Improvement.builder()
            .improvementType(request.improvementType())
            .yearBuilt(request.yearBuilt())
            .squareFeet(request.squareFeet())
            .bedrooms(request.bedrooms())
            .bathrooms(request.bathrooms())
            .quality(request.quality())
            .condition(request.condition())
            .build();
    }

    public PropertyField toEntity(CreateFieldRequest request) {
        return PropertyField.builder()
            .propertyId(request.propertyId())
            .fieldType(request.fieldType())
            .fieldValue(request.fieldValue())
            .build();
    }

    public Appeal toEntity(CreateAppealRequest request) {
        return Appeal.builder()
            .appealNumber(request.appealNumber())
            .propertyId(request.propertyId())
            .userId(request.userId())
            .appealType(request.appealType())
            .reason(request.reason())
            .requestedValue(request.requestedValue())
            .build();
    }
}
