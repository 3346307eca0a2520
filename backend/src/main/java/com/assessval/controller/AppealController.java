package com.assessval.controller;

import com.assessval.dto.mapper.PropertyMapper;
import com.assessval.dto.request.CreateAppealRequest;
import com.assessval.dto.request.TrackedChangesRequest;
import com.assessval.dto.response.AppealDto;
import com.assessval.model.property.Appeal;
import com.assessval.service.AppealService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for assessment appeals.
 */
@RestController
@RequestMapping("/api/appeals")
public class AppealController {

    private final AppealService appealService;
    private final PropertyMapper propertyMapper;

    public AppealController(AppealService appealService, PropertyMapper propertyMapper) {
        this.appealService = appealService;
        this.propertyMapper = propertyMapper;
    }

    @GetMapping
    public ResponseEntity<List<AppealDto>> getAppeals(@RequestParam String propertyId) {
        return ResponseEntity.ok(appealService.getAppealsByProperty(propertyId).stream()
            .map(propertyMapper::toDto)
            .toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<AppealDto> getAppeal(@PathVariable Long id) {
        return ResponseEntity.ok(propertyMapper.toDto(appealService.getAppeal(id)));
    }

    @PostMapping
    public ResponseEntity<AppealDto> createAppeal(@Valid @RequestBody CreateAppealRequest request) {
        Appeal saved = appealService.create(propertyMapper.toEntity(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(propertyMapper.toDto(saved));
    }

    /**
     * Partial update; status and decision changes are also reported as system activity.
     */
    @PatchMapping("/{id}")
    public ResponseEntity<AppealDto> updateAppeal(
            @PathVariable Long id,
            @Valid @RequestBody TrackedChangesRequest request) {
        Appeal saved = appealService.updateAppeal(id, request.changes(), request.lineageSource(), request.userId());
        return ResponseEntity.ok(propertyMapper.toDto(saved));
    }
}
