package com.assessval.controller;

import com.assessval.dto.mapper.LineageMapper;
import com.assessval.dto.request.LineageCorrectionRequest;
import com.assessval.dto.response.DataProvenanceDto;
import com.assessval.dto.response.LineageRecordDto;
import com.assessval.model.enums.LineageSource;
import com.assessval.model.lineage.LineageRecord;
import com.assessval.service.lineage.DataProvenanceService;
import com.assessval.service.lineage.LineageLedgerService;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * REST controller for the data lineage ledger. Read-only apart from
 * corrections, which append new records.
 */
@RestController
@RequestMapping("/api/data-lineage")
public class LineageController {

    private final LineageLedgerService ledgerService;
    private final DataProvenanceService provenanceService;
    private final LineageMapper lineageMapper;

    public LineageController(LineageLedgerService ledgerService, DataProvenanceService provenanceService,
                             LineageMapper lineageMapper) {
        this.ledgerService = ledgerService;
        this.provenanceService = provenanceService;
        this.lineageMapper = lineageMapper;
    }

    @GetMapping("/property/{propertyId}")
    public ResponseEntity<List<LineageRecordDto>> byProperty(@PathVariable String propertyId) {
        return ResponseEntity.ok(lineageMapper.toDtoList(ledgerService.byEntity(propertyId)));
    }

    /**
     * Records of one property grouped by field name, newest first within each group.
     */
    @GetMapping("/property/{propertyId}/grouped")
    public ResponseEntity<Map<String, List<LineageRecordDto>>> byPropertyGrouped(@PathVariable String propertyId) {
        return ResponseEntity.ok(lineageMapper.toGroupedDto(ledgerService.groupedByField(propertyId)));
    }

    @GetMapping("/property/{propertyId}/field/{fieldName}")
    public ResponseEntity<List<LineageRecordDto>> byField(
            @PathVariable String propertyId,
            @PathVariable String fieldName) {
        return ResponseEntity.ok(lineageMapper.toDtoList(ledgerService.byEntityAndField(propertyId, fieldName)));
    }

    /**
     * Current value, origin and oldest-first change chain of one property field.
     * Extension attributes are addressed as {@code extraFields.<key>}.
     */
    @GetMapping("/property/{propertyId}/field/{fieldName}/provenance")
    public ResponseEntity<DataProvenanceDto> provenance(
            @PathVariable String propertyId,
            @PathVariable String fieldName) {
        return ResponseEntity.ok(lineageMapper.toProvenanceDto(provenanceService.getDataProvenance(propertyId, fieldName)));
    }

    @GetMapping("/user/{userId}")
    public ResponseEntity<List<LineageRecordDto>> byUser(
            @PathVariable Long userId,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(lineageMapper.toDtoList(ledgerService.byUser(userId, limit)));
    }

    @GetMapping("/source/{source}")
    public ResponseEntity<List<LineageRecordDto>> bySource(
            @PathVariable String source,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(lineageMapper.toDtoList(
            ledgerService.bySource(LineageSource.fromValue(source), limit)));
    }

    @GetMapping("/date-range")
    public ResponseEntity<List<LineageRecordDto>> byDateRange(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime startDate,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime endDate,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(lineageMapper.toDtoList(ledgerService.byDateRange(startDate, endDate, limit)));
    }

    @GetMapping("/batch/{batchId}")
    public ResponseEntity<List<LineageRecordDto>> byBatch(@PathVariable String batchId) {
        return ResponseEntity.ok(lineageMapper.toDtoList(ledgerService.byBatch(batchId)));
    }

    @PostMapping("/corrections")
    public ResponseEntity<LineageRecordDto> recordCorrection(@Valid @RequestBody LineageCorrectionRequest request) {
        LineageRecord saved = ledgerService.recordCorrection(
            request.entityId(), request.fieldName(), request.correctedValue(), request.userId(), request.reason());
        return ResponseEntity.status(HttpStatus.CREATED).body(lineageMapper.toDto(saved));
    }
}
