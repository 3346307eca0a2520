package com.assessval.controller;

import com.assessval.dto.mapper.ValuationMapper;
import com.assessval.dto.request.AddAnalysisEntryRequest;
import com.assessval.dto.request.CreateAnalysisRequest;
import com.assessval.dto.request.FinalizeAnalysisRequest;
import com.assessval.dto.request.TrackedChangesRequest;
import com.assessval.dto.response.AnalysisEntryDto;
import com.assessval.dto.response.ComparableAnalysisDto;
import com.assessval.model.comparable.AnalysisEntry;
import com.assessval.model.comparable.ComparableAnalysis;
import com.assessval.service.valuation.ComparableAnalysisService;
import com.assessval.service.valuation.ReconciliationResult;
import com.assessval.service.valuation.ReconciliationService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for comparable analyses: entries, reconciliation, review
 * and finalization.
 */
@RestController
@RequestMapping("/api/comparable-analyses")
public class ComparableAnalysisController {

    private final ComparableAnalysisService analysisService;
    private final ReconciliationService reconciliationService;
    private final ValuationMapper valuationMapper;

    public ComparableAnalysisController(
            ComparableAnalysisService analysisService,
            ReconciliationService reconciliationService,
            ValuationMapper valuationMapper) {
        this.analysisService = analysisService;
        this.reconciliationService = reconciliationService;
        this.valuationMapper = valuationMapper;
    }

    // ========================================================================
    // Analyses
    // ========================================================================

    @GetMapping
    public ResponseEntity<List<ComparableAnalysisDto>> getAnalyses(@RequestParam String propertyId) {
        return ResponseEntity.ok(analysisService.getAnalysesByProperty(propertyId).stream()
            .map(this::toDto)
            .toList());
    }

    @GetMapping("/{analysisId}")
    public ResponseEntity<ComparableAnalysisDto> getAnalysis(@PathVariable String analysisId) {
        return ResponseEntity.ok(toDto(analysisService.getAnalysis(analysisId)));
    }

    @PostMapping
    public ResponseEntity<ComparableAnalysisDto> createAnalysis(@Valid @RequestBody CreateAnalysisRequest request) {
        ComparableAnalysis saved = analysisService.create(valuationMapper.toEntity(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(toDto(saved));
    }

    @PatchMapping("/{analysisId}")
    public ResponseEntity<ComparableAnalysisDto> updateAnalysis(
            @PathVariable String analysisId,
            @Valid @RequestBody TrackedChangesRequest request) {
        ComparableAnalysis saved = analysisService.updateAnalysis(
            analysisId, request.changes(), request.lineageSource(), request.userId());
        return ResponseEntity.ok(toDto(saved));
    }

    // ========================================================================
    // Entries
    // ========================================================================

    @GetMapping("/{analysisId}/entries")
    public ResponseEntity<List<AnalysisEntryDto>> getEntries(@PathVariable String analysisId) {
        analysisService.getAnalysis(analysisId);
        return ResponseEntity.ok(analysisService.getEntries(analysisId).stream()
            .map(valuationMapper::toDto)
            .toList());
    }

    @PostMapping("/{analysisId}/entries")
    public ResponseEntity<AnalysisEntryDto> addEntry(
            @PathVariable String analysisId,
            @Valid @RequestBody AddAnalysisEntryRequest request) {
        AnalysisEntry saved = analysisService.addEntry(analysisId, valuationMapper.toEntity(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(valuationMapper.toDto(saved));
    }

    @PatchMapping("/entries/{entryId}")
    public ResponseEntity<AnalysisEntryDto> updateEntry(
            @PathVariable Long entryId,
            @Valid @RequestBody TrackedChangesRequest request) {
        AnalysisEntry saved = analysisService.updateEntry(
            entryId, request.changes(), request.lineageSource(), request.userId());
        return ResponseEntity.ok(valuationMapper.toDto(saved));
    }

    @DeleteMapping("/entries/{entryId}")
    public ResponseEntity<Void> removeEntry(@PathVariable Long entryId) {
        analysisService.removeEntry(entryId);
        return ResponseEntity.noContent().build();
    }

    // ========================================================================
    // Workflow
    // ========================================================================

    /**
     * Compute and store the weighted value conclusion. Responds 422 when no
     * included entry has a usable value.
     */
    @PostMapping("/{analysisId}/reconcile")
    public ResponseEntity<ReconciliationResult> reconcile(
            @PathVariable String analysisId,
            @RequestParam(required = false) Long userId) {
        return ResponseEntity.ok(reconciliationService.reconcile(analysisId, userId));
    }

    @PostMapping("/{analysisId}/submit")
    public ResponseEntity<ComparableAnalysisDto> submitForReview(
            @PathVariable String analysisId,
            @RequestParam(required = false) Long userId) {
        return ResponseEntity.ok(toDto(analysisService.submitForReview(analysisId, userId)));
    }

    @PostMapping("/{analysisId}/finalize")
    public ResponseEntity<ComparableAnalysisDto> finalizeAnalysis(
            @PathVariable String analysisId,
            @Valid @RequestBody FinalizeAnalysisRequest request) {
        ComparableAnalysis saved = analysisService.finalizeAnalysis(
            analysisId, request.reviewerId(), request.reviewNotes());
        return ResponseEntity.ok(toDto(saved));
    }

    private ComparableAnalysisDto toDto(ComparableAnalysis analysis) {
        return valuationMapper.toDto(analysis, analysisService.getEntries(analysis.getAnalysisId()));
    }
}
