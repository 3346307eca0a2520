package com.assessval.controller;

import com.assessval.dto.mapper.PropertyMapper;
import com.assessval.dto.mapper.ValuationMapper;
import com.assessval.dto.request.CreateImprovementRequest;
import com.assessval.dto.request.CreatePropertyRequest;
import com.assessval.dto.request.PromoteComparablesRequest;
import com.assessval.dto.request.TrackedChangesRequest;
import com.assessval.dto.response.ComparableSaleDto;
import com.assessval.dto.response.ComparableSearchDto;
import com.assessval.dto.response.ImprovementDto;
import com.assessval.dto.response.PropertyDto;
import com.assessval.model.enums.PropertyType;
import com.assessval.model.property.Property;
import com.assessval.service.PropertyService;
import com.assessval.service.lineage.LineageLedgerService;
import com.assessval.service.lineage.PropertyHistoryPoint;
import com.assessval.service.valuation.ComparableDiscoveryService;
import com.assessval.service.valuation.ComparableSaleService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for properties, their improvements and comparable discovery.
 */
@RestController
@RequestMapping("/api/properties")
public class PropertyController {

    private final PropertyService propertyService;
    private final ComparableDiscoveryService discoveryService;
    private final ComparableSaleService saleService;
    private final LineageLedgerService ledgerService;
    private final PropertyMapper propertyMapper;
    private final ValuationMapper valuationMapper;

    public PropertyController(
            PropertyService propertyService,
            ComparableDiscoveryService discoveryService,
            ComparableSaleService saleService,
            LineageLedgerService ledgerService,
            PropertyMapper propertyMapper,
            ValuationMapper valuationMapper) {
        this.propertyService = propertyService;
        this.discoveryService = discoveryService;
        this.saleService = saleService;
        this.ledgerService = ledgerService;
        this.propertyMapper = propertyMapper;
        this.valuationMapper = valuationMapper;
    }

    // ========================================================================
    // Read Operations
    // ========================================================================

    @GetMapping
    public ResponseEntity<List<PropertyDto>> getAllProperties(
            @RequestParam(required = false) String propertyType) {
        List<Property> properties = propertyType != null && !propertyType.isEmpty()
            ? propertyService.findByType(PropertyType.fromValue(propertyType))
            : propertyService.findAll();
        return ResponseEntity.ok(propertyMapper.toPropertyDtoList(properties));
    }

    @GetMapping("/{propertyId}")
    public ResponseEntity<PropertyDto> getProperty(@PathVariable String propertyId) {
        return propertyService.findByPropertyId(propertyId)
            .map(propertyMapper::toDto)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{propertyId}/improvements")
    public ResponseEntity<List<ImprovementDto>> getImprovements(@PathVariable String propertyId) {
        return ResponseEntity.ok(propertyService.getImprovements(propertyId).stream()
            .map(propertyMapper::toDto)
            .toList());
    }

    /**
     * Change history of a property, newest first.
     */
    @GetMapping("/{propertyId}/history")
    public ResponseEntity<List<PropertyHistoryPoint>> getHistory(@PathVariable String propertyId) {
        return ResponseEntity.ok(ledgerService.getPropertyHistory(propertyId));
    }

    // ========================================================================
    // Create / Update Operations
    // ========================================================================

    @PostMapping
    public ResponseEntity<PropertyDto> createProperty(@Valid @RequestBody CreatePropertyRequest request) {
        Property saved = propertyService.create(propertyMapper.toEntity(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(propertyMapper.toDto(saved));
    }

    @PostMapping("/{propertyId}/improvements")
    public ResponseEntity<ImprovementDto> addImprovement(
            @PathVariable String propertyId,
            @RequestBody CreateImprovementRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(propertyMapper.toDto(propertyService.addImprovement(propertyId, propertyMapper.toEntity(request))));
    }

    /**
     * Partial update; each changed field is written to the lineage ledger.
     */
    @PatchMapping("/{propertyId}")
    public ResponseEntity<PropertyDto> updateProperty(
            @PathVariable String propertyId,
            @Valid @RequestBody TrackedChangesRequest request) {
        Property saved = propertyService.updateProperty(
            propertyId, request.changes(), request.lineageSource(), request.userId());
        return ResponseEntity.ok(propertyMapper.toDto(saved));
    }

    // ========================================================================
    // Comparable Discovery
    // ========================================================================

    /**
     * Rank other properties by similarity to this one. An unknown subject
     * yields an empty list with {@code subjectFound=false}.
     */
    @GetMapping("/{propertyId}/comparables")
    public ResponseEntity<ComparableSearchDto> findComparables(
            @PathVariable String propertyId,
            @RequestParam(required = false) Integer count) {
        return ResponseEntity.ok(propertyMapper.toDto(discoveryService.discover(propertyId, count)));
    }

    @PostMapping("/{propertyId}/comparables/promote")
    public ResponseEntity<List<ComparableSaleDto>> promoteComparables(
            @PathVariable String propertyId,
            @RequestBody(required = false) PromoteComparablesRequest request) {
        Integer count = request != null ? request.count() : null;
        Long userId = request != null ? request.userId() : null;
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(valuationMapper.toSaleDtoList(saleService.promoteCandidates(propertyId, count, userId)));
    }
}
