package com.assessval.dto.mapper;

import com.assessval.dto.response.DataProvenanceDto;
import com.assessval.dto.response.LineageRecordDto;
import com.assessval.model.lineage.LineageRecord;
import com.assessval.service.JsonColumns;
import com.assessval.service.lineage.DataProvenance;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class LineageMapper {

    private final JsonColumns jsonColumns;

    public LineageMapper(JsonColumns jsonColumns) {
        this.jsonColumns = jsonColumns;
    }

    public LineageRecordDto toDto(LineageRecord record) {
        return new LineageRecordDto(
            record.getId(),
            record.getEntityId(),
            record.getFieldName(),
            record.getOldValue().getText(),
            record.getOldValue().getKind().getValue(),
            record.getNewValue().getText(),
            record.getNewValue().getKind().getValue(),
            record.getChangeTimestamp(),
            record.getSource().getValue(),
            record.getUserId(),
            jsonColumns.readMap(record.getSourceDetails()),
            record.getBatchId()
        );
    }

    public List<LineageRecordDto> toDtoList(List<LineageRecord> records) {
        return records.stream().map(this::toDto).toList();
    }

    public Map<String, List<LineageRecordDto>> toGroupedDto(Map<String, List<LineageRecord>> grouped) {
        Map<String, List<LineageRecordDto>> result = new LinkedHashMap<>();
        grouped.forEach((field, records) -> result.put(field, toDtoList(records)));
        return result;
    }

    public DataProvenanceDto toProvenanceDto(DataProvenance provenance) {
        DataProvenance.Origin origin = provenance.origin();
        return new DataProvenanceDto(
            provenance.propertyId(),
            provenance.fieldName(),
            provenance.currentValue() != null ? provenance.currentValue().getText() : null,
            provenance.currentValue() != null ? provenance.currentValue().getKind().getValue() : null,
            new DataProvenanceDto.OriginDto(
                origin.source(),
                origin.timestamp(),
                origin.userId(),
                jsonColumns.readMap(origin.sourceDetails())),
            toDtoList(provenance.changeChain())
        );
    }
}
