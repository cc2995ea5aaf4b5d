package com.privacygraph.main.controller;

import com.privacygraph.common.model.DeleteOutcome;
import com.privacygraph.common.model.RelationshipRecord;
import com.privacygraph.common.model.RelationshipView;
import com.privacygraph.common.model.UpdateOutcome;
import com.privacygraph.main.dto.CreateRelationshipRequest;
import com.privacygraph.main.dto.OperationResponse;
import com.privacygraph.main.dto.UpdateRelationshipRequest;
import com.privacygraph.main.service.RelationshipService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/v1/relationships")
@RequiredArgsConstructor
@Tag(name = "Relationships", description = "Directed, typed relationships between entities")
public class RelationshipController {

    private final RelationshipService relationshipService;

    @PostMapping
    @Operation(summary = "Create a relationship", description = "Endpoints are not checked unless ontology enforcement is on")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "201", description = "Relationship created"),
        @ApiResponse(responseCode = "400", description = "Blank endpoint or type"),
        @ApiResponse(responseCode = "422", description = "Rejected by the ontology (enforcement on)"),
        @ApiResponse(responseCode = "500", description = "Storage failure")
    })
    public ResponseEntity<OperationResponse> create(@Valid @RequestBody CreateRelationshipRequest request) {
        log.info("Received create relationship request: {} -[{}]-> {}",
                request.getSourceId(), request.getRelationshipType(), request.getTargetId());
        return relationshipService.create(request.getSourceId(), request.getTargetId(),
                        request.getRelationshipType(), request.getProperties())
                .map(id -> ResponseEntity.status(HttpStatus.CREATED).body(new OperationResponse(id, "CREATED")))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                        .body(new OperationResponse(null, "FAILED")));
    }

    @GetMapping
    @Operation(summary = "Query relationships", description = "By entity (either endpoint) and/or by type")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Relationships listed")
    })
    public ResponseEntity<List<RelationshipRecord>> get(
            @Parameter(description = "Entity id on either side") @RequestParam(required = false) String entityId,
            @Parameter(description = "Relationship type") @RequestParam(required = false) String type,
            @RequestParam(defaultValue = "0") int limit) {
        log.info("Received relationship query: entityId={}, type={}, limit={}", entityId, type, limit);
        return ResponseEntity.ok(relationshipService.get(entityId, type, limit));
    }

    @GetMapping("/between")
    @Operation(summary = "Relationships of an ordered pair", description = "Oldest first")
    public ResponseEntity<List<RelationshipRecord>> findBetween(@RequestParam String sourceId,
                                                                @RequestParam String targetId) {
        log.info("Received pair query: {} -> {}", sourceId, targetId);
        return ResponseEntity.ok(relationshipService.findBetween(sourceId, targetId));
    }

    @GetMapping("/all")
    @Operation(summary = "List all relationships",
               description = "Optionally with endpoint name, type and version, read from one snapshot")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Relationships listed")
    })
    public ResponseEntity<List<RelationshipView>> listAll(
            @RequestParam(defaultValue = "0") int limit,
            @RequestParam(defaultValue = "false") boolean withEntityDetails) {
        log.info("Received list relationships request: limit={}, withEntityDetails={}", limit, withEntityDetails);
        return ResponseEntity.ok(relationshipService.listAll(limit, withEntityDetails));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a relationship by ID")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Relationship found"),
        @ApiResponse(responseCode = "404", description = "Relationship not found")
    })
    public ResponseEntity<RelationshipRecord> getById(@PathVariable String id) {
        log.info("Received get relationship request: id={}", id);
        return relationshipService.getById(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PutMapping
    @Operation(summary = "Update a relationship of a pair", description = "Updates the oldest relationship from source to target")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Relationship updated"),
        @ApiResponse(responseCode = "404", description = "No relationship between the pair")
    })
    public ResponseEntity<OperationResponse> updatePair(@RequestBody UpdateRelationshipRequest request) {
        log.info("Received pair update request: {} -> {}", request.getSourceId(), request.getTargetId());
        if (isBlank(request.getSourceId()) || isBlank(request.getTargetId())) {
            throw new IllegalArgumentException("sourceId and targetId are required");
        }
        UpdateOutcome outcome = relationshipService.update(request.getSourceId(), request.getTargetId(),
                request.getRelationshipType(), request.getProperties());
        return ResponseEntity.status(EntityController.statusOf(outcome)).body(new OperationResponse(null, outcome.name()));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update a relationship by ID")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Relationship updated"),
        @ApiResponse(responseCode = "404", description = "Relationship not found")
    })
    public ResponseEntity<OperationResponse> updateById(@PathVariable String id,
                                                        @RequestBody UpdateRelationshipRequest request) {
        log.info("Received update relationship request: id={}", id);
        UpdateOutcome outcome = relationshipService.updateById(id, request.getRelationshipType(), request.getProperties());
        return ResponseEntity.status(EntityController.statusOf(outcome)).body(new OperationResponse(id, outcome.name()));
    }

    @DeleteMapping
    @Operation(summary = "Delete a relationship of a pair", description = "Deletes the oldest relationship from source to target")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Relationship deleted"),
        @ApiResponse(responseCode = "404", description = "No relationship between the pair")
    })
    public ResponseEntity<OperationResponse> deletePair(@RequestParam String sourceId, @RequestParam String targetId) {
        log.info("Received pair delete request: {} -> {}", sourceId, targetId);
        DeleteOutcome outcome = relationshipService.delete(sourceId, targetId);
        return ResponseEntity.status(EntityController.statusOf(outcome)).body(new OperationResponse(null, outcome.name()));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a relationship by ID")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Relationship deleted"),
        @ApiResponse(responseCode = "404", description = "Relationship not found")
    })
    public ResponseEntity<OperationResponse> deleteById(@PathVariable String id) {
        log.info("Received delete relationship request: id={}", id);
        DeleteOutcome outcome = relationshipService.deleteById(id);
        return ResponseEntity.status(EntityController.statusOf(outcome)).body(new OperationResponse(id, outcome.name()));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
