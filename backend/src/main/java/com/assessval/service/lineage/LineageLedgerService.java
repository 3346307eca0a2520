package com.assessval.service.lineage;

import com.assessval.config.ValuationProperties;
import com.assessval.event.SystemActivityPublisher;
import com.assessval.model.enums.LineageSource;
import com.assessval.model.lineage.LineageRecord;
import com.assessval.model.lineage.LineageValue;
import com.assessval.repository.LineageRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Lineage Ledger
 *
 * Append-only store of field-level change records. There is no update or
 * delete path: a mistaken record is answered with a forward-dated
 * {@code correction} record. Every read returns newest first.
 */
@Service
@Transactional(readOnly = true)
@Slf4j
public class LineageLedgerService {

    private final LineageRecordRepository lineageRecordRepository;
    private final LineageValueCodec codec;
    private final SystemActivityPublisher activityPublisher;
    private final ValuationProperties properties;
    private final Clock clock;

    public LineageLedgerService(
            LineageRecordRepository lineageRecordRepository,
            LineageValueCodec codec,
            SystemActivityPublisher activityPublisher,
            ValuationProperties properties,
            Clock clock) {
        this.lineageRecordRepository = lineageRecordRepository;
        this.codec = codec;
        this.activityPublisher = activityPublisher;
        this.properties = properties;
        this.clock = clock;
    }

    // ========================================================================
    // Append
    // ========================================================================

    /**
     * Append one batch. Runs in the caller's transaction when there is one, so
     * the batch is stored together with the entity change or not at all.
     */
    @Transactional
    public List<LineageRecord> append(List<LineageRecord> batch) {
        if (batch.isEmpty()) {
            return batch;
        }
        List<LineageRecord> saved = lineageRecordRepository.saveAll(batch);

        LineageRecord first = saved.get(0);
        log.info("Lineage batch {}: {} change(s) for {} from {}",
            first.getBatchId(), saved.size(), first.getEntityId(), first.getSource().getValue());
        activityPublisher.record(
            String.format("Recorded %d field change(s) (%s)", saved.size(), first.getSource().getValue()),
            "lineage",
            first.getEntityId());
        return saved;
    }

    /**
     * Record a correction for a field. The new record's old value is the most
     * recent recorded value of the field ({@code null} when the field has no
     * history). The entity itself is not touched.
     */
    @Transactional
    public LineageRecord recordCorrection(String entityId, String fieldName, Object correctedValue,
                                          Long userId, String reason) {
        if (entityId == null || entityId.isBlank() || fieldName == null || fieldName.isBlank()) {
            throw new IllegalArgumentException("entityId and fieldName are required for a correction");
        }

        LineageValue previous = lineageRecordRepository
            .findByEntityIdAndFieldNameOrderByChangeTimestampDescIdDesc(entityId, fieldName)
            .stream()
            .findFirst()
            .map(LineageRecord::getNewValue)
            .orElse(LineageValue.nullValue());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("updateOperation", "recordCorrection");
        details.put("reason", reason);

        LocalDateTime now = LocalDateTime.now(clock);
        LineageRecord correction = LineageRecord.builder()
            .entityId(entityId)
            .fieldName(fieldName)
            .oldValue(previous)
            .newValue(codec.encode(correctedValue))
            .changeTimestamp(now)
            .source(LineageSource.CORRECTION)
            .userId(userId)
            .sourceDetails(codec.encodeDetails(details))
            .batchId(UUID.randomUUID().toString())
            .createdAt(now)
            .build();

        return append(List.of(correction)).get(0);
    }

    // ========================================================================
    // Reads
    // ========================================================================

    public List<LineageRecord> byEntityAndField(String entityId, String fieldName) {
        return lineageRecordRepository.findByEntityIdAndFieldNameOrderByChangeTimestampDescIdDesc(entityId, fieldName);
    }

    public List<LineageRecord> byEntity(String entityId) {
        return lineageRecordRepository.findByEntityIdOrderByChangeTimestampDescIdDesc(entityId);
    }

    public List<LineageRecord> byUser(Long userId, Integer limit) {
        return lineageRecordRepository.findByUserIdOrderByChangeTimestampDescIdDesc(userId, page(limit));
    }

    /**
     * Records whose change timestamp falls within {@code [start, end]}.
     */
    public List<LineageRecord> byDateRange(LocalDateTime start, LocalDateTime end, Integer limit) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Both start and end are required");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("start must not be after end");
        }
        return lineageRecordRepository.findByChangeTimestampBetweenOrderByChangeTimestampDescIdDesc(
            start, end, page(limit));
    }

    public List<LineageRecord> bySource(LineageSource source, Integer limit) {
        return lineageRecordRepository.findBySourceOrderByChangeTimestampDescIdDesc(source, page(limit));
    }

    public List<LineageRecord> byBatch(String batchId) {
        return lineageRecordRepository.findByBatchIdOrderByIdAsc(batchId);
    }

    /**
     * Records of an entity grouped by field name. Groups appear in order of the
     * field's most recent change.
     */
    public Map<String, List<LineageRecord>> groupedByField(String entityId) {
        Map<String, List<LineageRecord>> grouped = new LinkedHashMap<>();
        for (LineageRecord record : byEntity(entityId)) {
            grouped.computeIfAbsent(record.getFieldName(), k -> new ArrayList<>()).add(record);
        }
        return grouped;
    }

    /**
     * History of a property as seen by valuation logic.
     */
    public List<PropertyHistoryPoint> getPropertyHistory(String propertyId) {
        return byEntity(propertyId).stream()
            .map(record -> new PropertyHistoryPoint(
                record.getChangeTimestamp(),
                record.getFieldName(),
                record.getOldValue().getText(),
                record.getNewValue().getText(),
                record.getSource(),
                record.getUserId()))
            .toList();
    }

    private Pageable page(Integer limit) {
        ValuationProperties.Lineage config = properties.getLineage();
        int effective = limit == null ? config.getDefaultLimit() : limit;
        if (effective <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + effective);
        }
        return PageRequest.of(0, Math.min(effective, config.getMaxLimit()));
    }
}
