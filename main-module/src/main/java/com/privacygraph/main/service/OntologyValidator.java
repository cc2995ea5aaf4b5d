package com.privacygraph.main.service;

import com.privacygraph.common.model.EntityCollection;
import com.privacygraph.common.model.EntityRecord;
import com.privacygraph.common.model.EntityTypeProperty;
import com.privacygraph.main.config.PrivacyGraphProperties;
import com.privacygraph.main.exception.GraphOperationException;
import com.privacygraph.main.exception.OntologyViolationException;
import com.privacygraph.storage.kv.GraphStorage;
import com.privacygraph.storage.kv.GraphStorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks new entities and relationships against the catalog when
 * {@code privacy-graph.ontology.enforce} is on. With enforcement off every check passes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OntologyValidator {

    private final OntologyService ontologyService;
    private final GraphStorage storage;
    private final PrivacyGraphProperties properties;

    public boolean isEnforced() {
        return properties.getOntology().isEnforce();
    }

    public void validateEntity(EntityCollection collection, Map<String, Object> entityProperties) {
        if (!isEnforced()) {
            return;
        }
        List<String> violations = new ArrayList<>();
        for (EntityTypeProperty declared : ontologyService.listEntityTypeProperties(collection.typeName())) {
            Object value = entityProperties.get(declared.propertyName());
            if (value == null) {
                if (declared.required()) {
                    violations.add(collection.typeName() + " requires property '" + declared.propertyName() + "'");
                }
            } else if (!declared.dataType().accepts(value)) {
                violations.add("Property '" + declared.propertyName() + "' of " + collection.typeName()
                        + " must be " + declared.dataType());
            }
        }
        reject(violations);
    }

    public void validateRelationship(String sourceId, String targetId, String relationshipType) {
        if (!isEnforced()) {
            return;
        }
        Optional<EntityRecord> source = findEntity(sourceId);
        Optional<EntityRecord> target = findEntity(targetId);

        List<String> violations = new ArrayList<>();
        if (source.isEmpty()) {
            violations.add("Source entity " + sourceId + " does not exist");
        }
        if (target.isEmpty()) {
            violations.add("Target entity " + targetId + " does not exist");
        }
        if (violations.isEmpty()) {
            String sourceType = source.get().typeName();
            String targetType = target.get().typeName();
            boolean declared = ontologyService.listRelationshipOntology().stream()
                    .anyMatch(entry -> entry.matches(sourceType, targetType, relationshipType));
            if (!declared) {
                violations.add(relationshipType + " is not a declared relationship from "
                        + sourceType + " to " + targetType);
            }
        }
        reject(violations);
    }

    private Optional<EntityRecord> findEntity(String id) {
        try {
            return storage.findEntity(id);
        } catch (GraphStorageException e) {
            throw new GraphOperationException("Failed to resolve entity " + id, e);
        }
    }

    private static void reject(List<String> violations) {
        if (!violations.isEmpty()) {
            log.info("Rejected by ontology: {}", violations);
            throw new OntologyViolationException(violations);
        }
    }
}
