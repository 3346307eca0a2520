package com.assessval.controller;

import com.assessval.dto.mapper.ValuationMapper;
import com.assessval.dto.request.CreateComparableSaleRequest;
import com.assessval.dto.request.TrackedChangesRequest;
import com.assessval.dto.response.ComparableSaleDto;
import com.assessval.model.comparable.ComparableSale;
import com.assessval.model.enums.ComparableSaleStatus;
import com.assessval.service.valuation.ComparableSaleService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for comparable sales. Sales are never deleted; withdrawing
 * one retires it with a lineage record.
 */
@RestController
@RequestMapping("/api/comparable-sales")
public class ComparableSaleController {

    private final ComparableSaleService saleService;
    private final ValuationMapper valuationMapper;

    public ComparableSaleController(ComparableSaleService saleService, ValuationMapper valuationMapper) {
        this.saleService = saleService;
        this.valuationMapper = valuationMapper;
    }

    @GetMapping
    public ResponseEntity<List<ComparableSaleDto>> getSales(
            @RequestParam(required = false) String propertyId,
            @RequestParam(required = false) String status) {
        List<ComparableSale> sales;
        if (propertyId != null && !propertyId.isEmpty()) {
            sales = saleService.getSalesBySubject(propertyId);
            if (status != null && !status.isEmpty()) {
                ComparableSaleStatus stat = ComparableSaleStatus.fromValue(status);
                sales = sales.stream().filter(s -> s.getStatus() == stat).toList();
            }
        } else if (status != null && !status.isEmpty()) {
            sales = saleService.getSalesByStatus(ComparableSaleStatus.fromValue(status));
        } else {
            throw new IllegalArgumentException("propertyId or status is required");
        }
        return ResponseEntity.ok(valuationMapper.toSaleDtoList(sales));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ComparableSaleDto> getSale(@PathVariable Long id) {
        return ResponseEntity.ok(valuationMapper.toDto(saleService.getSale(id)));
    }

    @PostMapping
    public ResponseEntity<ComparableSaleDto> createSale(@Valid @RequestBody CreateComparableSaleRequest request) {
        ComparableSale saved = saleService.create(valuationMapper.toEntity(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(valuationMapper.toDto(saved));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<ComparableSaleDto> updateSale(
            @PathVariable Long id,
            @Valid @RequestBody TrackedChangesRequest request) {
        ComparableSale saved = saleService.updateSale(id, request.changes(), request.lineageSource(), request.userId());
        return ResponseEntity.ok(valuationMapper.toDto(saved));
    }

    @PostMapping("/{id}/withdraw")
    public ResponseEntity<ComparableSaleDto> withdrawSale(
            @PathVariable Long id,
            @RequestParam(required = false) Long userId) {
        return ResponseEntity.ok(valuationMapper.toDto(saleService.withdraw(id, userId)));
    }
}
