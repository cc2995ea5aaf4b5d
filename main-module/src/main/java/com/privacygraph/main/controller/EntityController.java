package com.privacygraph.main.controller;

import com.privacygraph.common.model.DeleteOutcome;
import com.privacygraph.common.model.EntityCollection;
import com.privacygraph.common.model.EntityRecord;
import com.privacygraph.common.model.SimilarEntity;
import com.privacygraph.common.model.UpdateOutcome;
import com.privacygraph.main.dto.CreateEntityRequest;
import com.privacygraph.main.dto.OperationResponse;
import com.privacygraph.main.dto.SimilarityRequest;
import com.privacygraph.main.dto.SimilarityResponse;
import com.privacygraph.main.dto.UpdateEntityRequest;
import com.privacygraph.main.service.EntityService;
import com.privacygraph.main.service.SimilaritySearchService;
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
import java.util.Optional;

@Slf4j
@RestController
@RequestMapping("/api/v1/entities/{collection}")
@RequiredArgsConstructor
@Tag(name = "Entities", description = "Assets, processing activities, data elements, data subject types and vendors")
public class EntityController {

    private final EntityService entityService;
    private final SimilaritySearchService similaritySearchService;

    @PostMapping
    @Operation(summary = "Create an entity",
               description = "Create an entity in the collection; its embedding is computed from name and description")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "201", description = "Entity created"),
        @ApiResponse(responseCode = "400", description = "Unknown collection or blank name"),
        @ApiResponse(responseCode = "422", description = "Rejected by the ontology (enforcement on)"),
        @ApiResponse(responseCode = "500", description = "Embedding or storage failure, nothing was written")
    })
    public ResponseEntity<OperationResponse> create(
            @Parameter(description = "Collection path segment", example = "assets") @PathVariable String collection,
            @Valid @RequestBody CreateEntityRequest request) {
        EntityCollection target = resolve(collection);
        log.info("Received create request: collection={}, name={}", target.collectionName(), request.getName());

        Optional<String> id = switch (target) {
            case PROCESSING_ACTIVITIES -> entityService.createProcessingActivity(request.getName(),
                    request.getDescription(), request.getPurpose(), request.getLegalBasis(), request.getProperties());
            case DATA_ELEMENTS -> entityService.createDataElement(request.getName(), request.getDescription(),
                    request.getDataType(), request.getProperties());
            default -> entityService.create(target, request.getName(), request.getDescription(), request.getProperties());
        };
        return id.map(created -> ResponseEntity.status(HttpStatus.CREATED).body(new OperationResponse(created, "CREATED")))
                 .orElseGet(() -> ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                         .body(new OperationResponse(null, "FAILED")));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get an entity by ID")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Entity found"),
        @ApiResponse(responseCode = "404", description = "Entity not found in this collection")
    })
    public ResponseEntity<EntityRecord> get(@PathVariable String collection, @PathVariable String id) {
        EntityCollection target = resolve(collection);
        log.info("Received get request: collection={}, id={}", target.collectionName(), id);
        return entityService.get(target, id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping
    @Operation(summary = "List entities", description = "Entities of the collection ordered by name")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Entities listed")
    })
    public ResponseEntity<List<EntityRecord>> list(
            @PathVariable String collection,
            @Parameter(description = "Maximum number of entities, default 100") @RequestParam(defaultValue = "0") int limit) {
        EntityCollection target = resolve(collection);
        log.info("Received list request: collection={}, limit={}", target.collectionName(), limit);
        return ResponseEntity.ok(entityService.list(target, limit));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update an entity",
               description = "Partial update; a new name or description recomputes the embedding")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Entity updated"),
        @ApiResponse(responseCode = "404", description = "Entity not found"),
        @ApiResponse(responseCode = "500", description = "Update failed, nothing was written")
    })
    public ResponseEntity<OperationResponse> update(@PathVariable String collection, @PathVariable String id,
                                                    @RequestBody UpdateEntityRequest request) {
        EntityCollection target = resolve(collection);
        log.info("Received update request: collection={}, id={}", target.collectionName(), id);
        UpdateOutcome outcome = entityService.update(target, id, request.getName(), request.getDescription(),
                request.getProperties());
        return ResponseEntity.status(statusOf(outcome)).body(new OperationResponse(id, outcome.name()));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete an entity", description = "Deletes the entity and every relationship touching it")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Entity deleted"),
        @ApiResponse(responseCode = "404", description = "Entity not found"),
        @ApiResponse(responseCode = "500", description = "Delete failed, nothing was removed")
    })
    public ResponseEntity<OperationResponse> delete(@PathVariable String collection, @PathVariable String id) {
        EntityCollection target = resolve(collection);
        log.info("Received delete request: collection={}, id={}", target.collectionName(), id);
        DeleteOutcome outcome = entityService.delete(target, id);
        return ResponseEntity.status(statusOf(outcome)).body(new OperationResponse(id, outcome.name()));
    }

    @PostMapping("/similar")
    @Operation(summary = "Find similar entities",
               description = "Entities of the collection closest to the given name and description")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Search completed"),
        @ApiResponse(responseCode = "503", description = "Embedding model unavailable")
    })
    public ResponseEntity<SimilarityResponse> findSimilar(@PathVariable String collection,
                                                          @Valid @RequestBody SimilarityRequest request) {
        EntityCollection target = resolve(collection);
        int limit = request.getLimit() != null ? request.getLimit() : 0;
        log.info("Received similarity request: collection={}, name={}, limit={}",
                target.collectionName(), request.getName(), limit);

        List<SimilarEntity> results = similaritySearchService.findSimilar(target, request.getName(),
                request.getDescription(), limit);
        return ResponseEntity.ok(new SimilarityResponse(target.collectionName(),
                similaritySearchService.nearDuplicateThreshold(), results));
    }

    static EntityCollection resolve(String collection) {
        return EntityCollection.resolve(collection)
                .orElseThrow(() -> new IllegalArgumentException("Unknown entity collection: " + collection));
    }

    static HttpStatus statusOf(UpdateOutcome outcome) {
        return switch (outcome) {
            case UPDATED -> HttpStatus.OK;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    static HttpStatus statusOf(DeleteOutcome outcome) {
        return switch (outcome) {
            case DELETED -> HttpStatus.OK;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
