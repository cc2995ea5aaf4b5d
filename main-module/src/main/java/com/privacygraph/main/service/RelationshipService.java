package com.privacygraph.main.service;

import com.privacygraph.common.model.DeleteOutcome;
import com.privacygraph.common.model.RelationshipRecord;
import com.privacygraph.common.model.RelationshipView;
import com.privacygraph.common.model.UpdateOutcome;
import com.privacygraph.common.serialization.PropertiesCodec;
import com.privacygraph.main.config.PrivacyGraphProperties;
import com.privacygraph.main.exception.GraphOperationException;
import com.privacygraph.storage.kv.GraphStorage;
import com.privacygraph.storage.kv.GraphStorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Directed, typed edges between entity ids.
 * Pair-keyed update and delete act on the oldest relationship of the ordered pair.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RelationshipService {

    private final GraphStorage storage;
    private final PropertiesCodec propertiesCodec;
    private final OntologyValidator ontologyValidator;
    private final EngineStatus engineStatus;
    private final PrivacyGraphProperties properties;
    private final Clock clock;

    /**
     * @return id of the new relationship, empty when the write failed
     */
    public Optional<String> create(String sourceId, String targetId, String relationshipType,
                                   Map<String, ?> relationshipProperties) {
        engineStatus.requireReady();
        requireNotBlank(sourceId, "Source id");
        requireNotBlank(targetId, "Target id");
        requireNotBlank(relationshipType, "Relationship type");
        ontologyValidator.validateRelationship(sourceId, targetId, relationshipType);

        String id = UUID.randomUUID().toString();
        RelationshipRecord relationship = RelationshipRecord.forNewRelationship(id, sourceId, targetId,
                relationshipType, propertiesCodec.normalize(relationshipProperties), now());
        try {
            storage.insertRelationship(relationship);
        } catch (GraphStorageException e) {
            log.error("Failed to create {} relationship {} -> {}", relationshipType, sourceId, targetId, e);
            return Optional.empty();
        }
        log.info("Created relationship {}: {} -[{}]-> {}", id, sourceId, relationshipType, targetId);
        return Optional.of(id);
    }

    /**
     * Relationships touching an entity (as source or target) and/or of a type. Both filters are optional.
     */
    public List<RelationshipRecord> get(String entityId, String relationshipType, int limit) {
        engineStatus.requireReady();
        int effectiveLimit = properties.getStore().effectiveLimit(limit);
        try {
            return storage.findRelationships(blankToNull(entityId), blankToNull(relationshipType), effectiveLimit);
        } catch (GraphStorageException e) {
            throw new GraphOperationException("Failed to query relationships", e);
        }
    }

    public Optional<RelationshipRecord> getById(String relationshipId) {
        engineStatus.requireReady();
        try {
            return storage.getRelationship(relationshipId);
        } catch (GraphStorageException e) {
            throw new GraphOperationException("Failed to read relationship " + relationshipId, e);
        }
    }

    public List<RelationshipRecord> findBetween(String sourceId, String targetId) {
        engineStatus.requireReady();
        try {
            return storage.findRelationshipsBetween(sourceId, targetId);
        } catch (GraphStorageException e) {
            throw new GraphOperationException("Failed to query relationships " + sourceId + " -> " + targetId, e);
        }
    }

    public UpdateOutcome update(String sourceId, String targetId, String relationshipType,
                                Map<String, ?> relationshipProperties) {
        engineStatus.requireReady();
        if (relationshipType == null && relationshipProperties == null) {
            return UpdateOutcome.UPDATED;
        }
        UnaryOperator<RelationshipRecord> change = changes(relationshipType, relationshipProperties);
        try {
            Optional<RelationshipRecord> updated = storage.updateFirstRelationshipBetween(sourceId, targetId, change);
            if (updated.isEmpty()) {
                log.info("No relationship {} -> {} to update", sourceId, targetId);
                return UpdateOutcome.NOT_FOUND;
            }
            log.info("Updated relationship {} ({} -> {})", updated.get().id(), sourceId, targetId);
            return UpdateOutcome.UPDATED;
        } catch (GraphStorageException e) {
            log.error("Failed to update relationship {} -> {}", sourceId, targetId, e);
            return UpdateOutcome.FAILED;
        }
    }

    public UpdateOutcome updateById(String relationshipId, String relationshipType,
                                    Map<String, ?> relationshipProperties) {
        engineStatus.requireReady();
        if (relationshipType == null && relationshipProperties == null) {
            return UpdateOutcome.UPDATED;
        }
        try {
            Optional<RelationshipRecord> updated = storage.updateRelationship(relationshipId,
                    changes(relationshipType, relationshipProperties));
            if (updated.isEmpty()) {
                return UpdateOutcome.NOT_FOUND;
            }
            log.info("Updated relationship {}", relationshipId);
            return UpdateOutcome.UPDATED;
        } catch (GraphStorageException e) {
            log.error("Failed to update relationship {}", relationshipId, e);
            return UpdateOutcome.FAILED;
        }
    }

    public DeleteOutcome delete(String sourceId, String targetId) {
        engineStatus.requireReady();
        try {
            Optional<RelationshipRecord> deleted = storage.deleteFirstRelationshipBetween(sourceId, targetId);
            if (deleted.isEmpty()) {
                log.info("No relationship {} -> {} to delete", sourceId, targetId);
                return DeleteOutcome.NOT_FOUND;
            }
            log.info("Deleted relationship {} ({} -[{}]-> {})", deleted.get().id(), sourceId,
                    deleted.get().relationshipType(), targetId);
            return DeleteOutcome.DELETED;
        } catch (GraphStorageException e) {
            log.error("Failed to delete relationship {} -> {}", sourceId, targetId, e);
            return DeleteOutcome.FAILED;
        }
    }

    public DeleteOutcome deleteById(String relationshipId) {
        engineStatus.requireReady();
        try {
            if (storage.deleteRelationship(relationshipId).isEmpty()) {
                return DeleteOutcome.NOT_FOUND;
            }
            log.info("Deleted relationship {}", relationshipId);
            return DeleteOutcome.DELETED;
        } catch (GraphStorageException e) {
            log.error("Failed to delete relationship {}", relationshipId, e);
            return DeleteOutcome.FAILED;
        }
    }

    /**
     * All relationships, oldest first. With details each edge carries its endpoints' name, type and version,
     * all read from one snapshot.
     */
    public List<RelationshipView> listAll(int limit, boolean withEntityDetails) {
        engineStatus.requireReady();
        int effectiveLimit = properties.getStore().effectiveLimit(limit);
        try {
            List<RelationshipView> relationships = storage.listRelationships(effectiveLimit, withEntityDetails);
            log.debug("Listed {} relationships (details={})", relationships.size(), withEntityDetails);
            return relationships;
        } catch (GraphStorageException e) {
            throw new GraphOperationException("Failed to list relationships", e);
        }
    }

    private UnaryOperator<RelationshipRecord> changes(String relationshipType, Map<String, ?> relationshipProperties) {
        if (relationshipType != null) {
            requireNotBlank(relationshipType, "Relationship type");
        }
        Map<String, Object> normalized = propertiesCodec.normalizeNullable(relationshipProperties);
        Instant now = now();
        return current -> current.withChanges(relationshipType, normalized, now);
    }

    private static void requireNotBlank(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " cannot be blank");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private Instant now() {
        return Instant.now(clock);
    }
}
