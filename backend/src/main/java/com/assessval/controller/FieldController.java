package com.assessval.controller;

import com.assessval.dto.mapper.PropertyMapper;
import com.assessval.dto.request.CreateFieldRequest;
import com.assessval.dto.request.TrackedChangesRequest;
import com.assessval.dto.response.PropertyFieldDto;
import com.assessval.model.property.PropertyField;
import com.assessval.service.PropertyFieldService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for per-property characteristic fields.
 */
@RestController
@RequestMapping("/api/fields")
public class FieldController {

    private final PropertyFieldService fieldService;
    private final PropertyMapper propertyMapper;

    public FieldController(PropertyFieldService fieldService, PropertyMapper propertyMapper) {
        this.fieldService = fieldService;
        this.propertyMapper = propertyMapper;
    }

    @GetMapping
    public ResponseEntity<List<PropertyFieldDto>> getFields(@RequestParam String propertyId) {
        return ResponseEntity.ok(fieldService.getFieldsByProperty(propertyId).stream()
            .map(propertyMapper::toDto)
            .toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<PropertyFieldDto> getField(@PathVariable Long id) {
        return ResponseEntity.ok(propertyMapper.toDto(fieldService.getField(id)));
    }

    @PostMapping
    public ResponseEntity<PropertyFieldDto> createField(@Valid @RequestBody CreateFieldRequest request) {
        PropertyField saved = fieldService.create(propertyMapper.toEntity(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(propertyMapper.toDto(saved));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<PropertyFieldDto> updateField(
            @PathVariable Long id,
            @Valid @RequestBody TrackedChangesRequest request) {
        PropertyField saved = fieldService.updateField(id, request.changes(), request.lineageSource(), request.userId());
        return ResponseEntity.ok(propertyMapper.toDto(saved));
    }
}
