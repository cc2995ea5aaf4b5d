package com.privacygraph.main.service;

import com.privacygraph.common.model.EntityType;
import com.privacygraph.common.model.EntityTypeProperty;
import com.privacygraph.common.model.RelationshipOntologyEntry;
import com.privacygraph.main.exception.GraphOperationException;
import com.privacygraph.storage.kv.GraphStorage;
import com.privacygraph.storage.kv.GraphStorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only access to the entity type catalog and the relationship ontology.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OntologyService {

    private final GraphStorage storage;
    private final EngineStatus engineStatus;

    public List<EntityType> listEntityTypes() {
        engineStatus.requireReady();
        try {
            return storage.listEntityTypes();
        } catch (GraphStorageException e) {
            throw new GraphOperationException("Failed to list entity types", e);
        }
    }

    public Optional<EntityType> findEntityType(String entityType) {
        if (entityType == null || entityType.isBlank()) {
            return Optional.empty();
        }
        return listEntityTypes().stream()
                .filter(type -> type.name().equalsIgnoreCase(entityType.trim()))
                .findFirst();
    }

    /**
     * Declared properties of a type, by type name. An unknown type has none.
     */
    public List<EntityTypeProperty> listEntityTypeProperties(String entityType) {
        Optional<EntityType> type = findEntityType(entityType);
        if (type.isEmpty()) {
            log.debug("No entity type named '{}'", entityType);
            return List.of();
        }
        try {
            return storage.listEntityTypeProperties(type.get().typeId());
        } catch (GraphStorageException e) {
            throw new GraphOperationException("Failed to list properties of " + entityType, e);
        }
    }

    public List<RelationshipOntologyEntry> listRelationshipOntology() {
        engineStatus.requireReady();
        try {
            return storage.listRelationshipOntology();
        } catch (GraphStorageException e) {
            throw new GraphOperationException("Failed to list relationship ontology", e);
        }
    }

    /**
     * Relationship types declared between two entity types, in catalog order.
     */
    public List<String> allowedRelationshipTypes(String sourceType, String targetType) {
        Set<String> allowed = new LinkedHashSet<>();
        for (RelationshipOntologyEntry entry : listRelationshipOntology()) {
            if (entry.matches(sourceType, targetType, entry.relationshipType())) {
                allowed.add(entry.relationshipType());
            }
        }
        return List.copyOf(allowed);
    }
}
