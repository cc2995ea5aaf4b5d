package com.privacygraph.main.service;

import com.privacygraph.common.model.DeleteOutcome;
import com.privacygraph.common.model.EntityCollection;
import com.privacygraph.common.model.EntityRecord;
import com.privacygraph.common.model.UpdateOutcome;
import com.privacygraph.common.serialization.PropertiesCodec;
import com.privacygraph.common.serialization.StoredEmbedding;
import com.privacygraph.main.config.PrivacyGraphProperties;
import com.privacygraph.main.embedding.EmbeddingProvider;
import com.privacygraph.main.exception.EmbeddingException;
import com.privacygraph.main.exception.GraphOperationException;
import com.privacygraph.storage.kv.CascadeDeletion;
import com.privacygraph.storage.kv.EntityChange;
import com.privacygraph.storage.kv.GraphStorageException;
import com.privacygraph.storage.service.EntityStorageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entity store for all five collections.
 * Every persisted entity carries an embedding computed from its current name and description.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntityService {

    static final String PURPOSE = "purpose";
    static final String LEGAL_BASIS = "legal_basis";
    static final String DATA_TYPE = "data_type";

    private final EntityStorageService entityStorage;
    private final EmbeddingProvider embeddingProvider;
    private final PropertiesCodec propertiesCodec;
    private final OntologyValidator ontologyValidator;
    private final EngineStatus engineStatus;
    private final PrivacyGraphProperties properties;
    private final Clock clock;

    /**
     * Create an entity. The embedding is computed before anything is written.
     * @return the new id, empty when the embedding or the write failed
     */
    public Optional<String> create(EntityCollection collection, String name, String description,
                                   Map<String, ?> entityProperties) {
        engineStatus.requireReady();
        requireName(name);

        Map<String, Object> normalized = normalize(entityProperties);
        ontologyValidator.validateEntity(collection, normalized);

        float[] vector;
        try {
            vector = embeddingProvider.embed(name, description);
        } catch (EmbeddingException e) {
            log.error("Not creating {} '{}': {}", collection.typeName(), name, e.getMessage(), e);
            return Optional.empty();
        }

        String id = UUID.randomUUID().toString();
        EntityRecord entity = EntityRecord.forNewEntity(id, collection, name, description, normalized, now());
        try {
            entityStorage.create(entity, new StoredEmbedding(entity.version(), vector));
        } catch (GraphStorageException e) {
            log.error("Failed to create {} '{}'", collection.typeName(), name, e);
            return Optional.empty();
        }
        log.info("Created {} {} '{}'", collection.typeName(), id, name);
        return Optional.of(id);
    }

    public Optional<String> createProcessingActivity(String name, String description, String purpose,
                                                     String legalBasis, Map<String, ?> entityProperties) {
        Map<String, Object> merged = withConvenienceFields(entityProperties, PURPOSE, purpose, LEGAL_BASIS, legalBasis);
        return create(EntityCollection.PROCESSING_ACTIVITIES, name, description, merged);
    }

    public Optional<String> createDataElement(String name, String description, String dataType,
                                              Map<String, ?> entityProperties) {
        Map<String, Object> merged = withConvenienceFields(entityProperties, DATA_TYPE, dataType);
        return create(EntityCollection.DATA_ELEMENTS, name, description, merged);
    }

    public Optional<EntityRecord> get(EntityCollection collection, String id) {
        engineStatus.requireReady();
        try {
            return entityStorage.get(collection, id);
        } catch (GraphStorageException e) {
            throw new GraphOperationException("Failed to read " + collection.typeName() + " " + id, e);
        }
    }

    /**
     * Partial update. Null arguments are left unchanged. When the name or the description changes
     * the embedding is recomputed from the merged pair inside the same transaction.
     */
    public UpdateOutcome update(EntityCollection collection, String id, String name, String description,
                                Map<String, ?> entityProperties) {
        engineStatus.requireReady();
        if (name == null && description == null && entityProperties == null) {
            log.debug("Nothing to update for {} {}", collection.typeName(), id);
            return UpdateOutcome.UPDATED;
        }
        if (name != null) {
            requireName(name);
        }

        Map<String, Object> normalized = entityProperties == null ? null : normalize(entityProperties);
        boolean textChanged = name != null || description != null;
        Instant now = now();
        try {
            Optional<EntityChange> change = entityStorage.update(collection, id, current -> {
                EntityRecord updated = current.withChanges(name, description, normalized, now);
                if (!textChanged) {
                    return EntityChange.of(updated);
                }
                float[] vector = embeddingProvider.embed(updated.name(), updated.description());
                return new EntityChange(updated, new StoredEmbedding(updated.version(), vector));
            });
            if (change.isEmpty()) {
                log.info("{} {} not found for update", collection.typeName(), id);
                return UpdateOutcome.NOT_FOUND;
            }
            log.info("Updated {} {} to version {}", collection.typeName(), id, change.get().record().version());
            return UpdateOutcome.UPDATED;
        } catch (GraphStorageException e) {
            log.error("Failed to update {} {}", collection.typeName(), id, e);
            return UpdateOutcome.FAILED;
        }
    }

    /**
     * Delete an entity together with every relationship that references it.
     */
    public DeleteOutcome delete(EntityCollection collection, String id) {
        engineStatus.requireReady();
        try {
            Optional<CascadeDeletion> deletion = entityStorage.delete(collection, id);
            if (deletion.isEmpty()) {
                log.info("{} {} not found for delete", collection.typeName(), id);
                return DeleteOutcome.NOT_FOUND;
            }
            log.info("Deleted {} {} and {} relationships", collection.typeName(), id,
                    deletion.get().removedRelationshipIds().size());
            return DeleteOutcome.DELETED;
        } catch (GraphStorageException e) {
            log.error("Failed to delete {} {}", collection.typeName(), id, e);
            return DeleteOutcome.FAILED;
        }
    }

    public List<EntityRecord> list(EntityCollection collection, int limit) {
        engineStatus.requireReady();
        int effectiveLimit = properties.getStore().effectiveLimit(limit);
        try {
            List<EntityRecord> entities = entityStorage.list(collection, effectiveLimit);
            log.debug("Listed {} {} (limit {})", entities.size(), collection.collectionName(), effectiveLimit);
            return entities;
        } catch (GraphStorageException e) {
            throw new GraphOperationException("Failed to list " + collection.collectionName(), e);
        }
    }

    private Map<String, Object> normalize(Map<String, ?> entityProperties) {
        Map<String, Object> normalized = propertiesCodec.normalize(entityProperties);
        if (normalized.containsKey(PropertiesCodec.RAW_PROPERTIES_KEY)
                && (entityProperties == null || !entityProperties.containsKey(PropertiesCodec.RAW_PROPERTIES_KEY))) {
            log.warn("Properties could not be stored as JSON, keeping their string form");
        }
        return normalized;
    }

    /**
     * Merges key/value pairs into a copy of the properties, skipping blank values.
     */
    private static Map<String, Object> withConvenienceFields(Map<String, ?> entityProperties, String... keyValues) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (entityProperties != null) {
            merged.putAll(entityProperties);
        }
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            String value = keyValues[i + 1];
            if (value != null && !value.isBlank()) {
                merged.put(keyValues[i], value);
            }
        }
        return merged;
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Entity name cannot be blank");
        }
    }

    private Instant now() {
        return Instant.now(clock);
    }
}
