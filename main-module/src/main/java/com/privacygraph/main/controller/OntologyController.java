package com.privacygraph.main.controller;

import com.privacygraph.common.model.EntityType;
import com.privacygraph.common.model.EntityTypeProperty;
import com.privacygraph.common.model.RelationshipOntologyEntry;
import com.privacygraph.main.service.OntologyService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/v1/ontology")
@RequiredArgsConstructor
@Tag(name = "Ontology", description = "Read-only catalog of entity types and allowed relationships")
public class OntologyController {

    private final OntologyService ontologyService;

    @GetMapping("/entity-types")
    @Operation(summary = "List entity types")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Entity types listed"),
        @ApiResponse(responseCode = "503", description = "Engine not ready")
    })
    public ResponseEntity<List<EntityType>> listEntityTypes() {
        log.info("Received list entity types request");
        return ResponseEntity.ok(ontologyService.listEntityTypes());
    }

    @GetMapping("/entity-types/{type}/properties")
    @Operation(summary = "List declared properties of an entity type", description = "Empty for an unknown type")
    public ResponseEntity<List<EntityTypeProperty>> listEntityTypeProperties(@PathVariable String type) {
        log.info("Received list properties request: type={}", type);
        return ResponseEntity.ok(ontologyService.listEntityTypeProperties(type));
    }

    @GetMapping("/relationships")
    @Operation(summary = "List the relationship ontology")
    public ResponseEntity<List<RelationshipOntologyEntry>> listRelationshipOntology() {
        log.info("Received list relationship ontology request");
        return ResponseEntity.ok(ontologyService.listRelationshipOntology());
    }

    @GetMapping("/relationships/allowed")
    @Operation(summary = "Relationship types declared between two entity types")
    public ResponseEntity<List<String>> allowedRelationshipTypes(@RequestParam String sourceType,
                                                                 @RequestParam String targetType) {
        log.info("Received allowed relationships request: {} -> {}", sourceType, targetType);
        return ResponseEntity.ok(ontologyService.allowedRelationshipTypes(sourceType, targetType));
    }
}
