package com.privacygraph.storage.service;

import com.privacygraph.common.model.EntityCollection;
import com.privacygraph.common.model.EntityRecord;
import com.privacygraph.common.model.SimilarEntity;
import com.privacygraph.common.serialization.StoredEmbedding;
import com.privacygraph.storage.index.IndexHit;
import com.privacygraph.storage.index.VectorIndex;
import com.privacygraph.storage.index.VersionedVector;
import com.privacygraph.storage.kv.CascadeDeletion;
import com.privacygraph.storage.kv.EntityChange;
import com.privacygraph.storage.kv.EntityUpdateFunction;
import com.privacygraph.storage.kv.GraphStorage;
import com.privacygraph.storage.kv.GraphStorageException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Service
@RequiredArgsConstructor
@Slf4j
public class EntityStorageServiceImpl implements EntityStorageService {

    private final GraphStorage storage;
    private final VectorIndex vectorIndex;

    /** Коллекции, индекс которых не удалось восстановить: коллекция -> причина */
    private final Map<EntityCollection, String> indexFailures = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        if (!storage.isOpen()) {
            log.warn("Graph storage is not open, vector indexes are not restored");
            return;
        }

        log.info("Restoring vector indexes from graph storage...");
        int total = 0;
        for (EntityCollection collection : EntityCollection.values()) {
            try {
                total += rebuildIndex(collection);
            } catch (GraphStorageException | RuntimeException e) {
                log.error("Failed to restore vector index for {}", collection, e);
                indexFailures.put(collection, String.valueOf(e.getMessage()));
            }
        }
        log.info("Vector index restore complete - {} vectors across {} collections",
                total, EntityCollection.values().length);
    }

    @Override
    public void create(EntityRecord entity, StoredEmbedding embedding) throws GraphStorageException {
        if (!vectorIndex.accepts(entity.collection(), embedding.vector())) {
            throw new GraphStorageException(dimensionMismatch(entity.collection(), embedding.vector()));
        }
        storage.insertEntity(entity, embedding);
        index(entity.collection(), entity.id(), embedding);
        log.debug("Created {} {} '{}'", entity.typeName(), entity.id(), entity.name());
    }

    @Override
    public Optional<EntityRecord> get(EntityCollection collection, String id) throws GraphStorageException {
        return storage.getEntity(collection, id);
    }

    @Override
    public Optional<EntityChange> update(EntityCollection collection, String id, EntityUpdateFunction update)
            throws GraphStorageException {
        Optional<EntityChange> change = storage.updateEntity(collection, id, current -> {
            EntityChange result = update.apply(current);
            if (result.embeddingChanged() && !vectorIndex.accepts(collection, result.embedding().vector())) {
                // Откатывает транзакцию обновления
                throw new IllegalArgumentException(dimensionMismatch(collection, result.embedding().vector()));
            }
            return result;
        });
        change.filter(EntityChange::embeddingChanged).ifPresent(c -> index(collection, id, c.embedding()));
        return change;
    }

    @Override
    public Optional<CascadeDeletion> delete(EntityCollection collection, String id) throws GraphStorageException {
        Optional<CascadeDeletion> deletion = storage.deleteEntity(collection, id);
        if (deletion.isPresent()) {
            vectorIndex.remove(collection, id);
            log.debug("Deleted {} {} with {} relationships",
                    collection.typeName(), id, deletion.get().removedRelationshipIds().size());
        }
        return deletion;
    }

    @Override
    public List<EntityRecord> list(EntityCollection collection, int limit) throws GraphStorageException {
        return storage.listEntities(collection, limit);
    }

    @Override
    public List<SimilarEntity> findNearest(EntityCollection collection, float[] queryVector, int limit)
            throws GraphStorageException {
        List<IndexHit> hits = vectorIndex.search(collection, queryVector, limit);
        if (hits.isEmpty()) {
            return List.of();
        }

        List<String> ids = new ArrayList<>(hits.size());
        for (IndexHit hit : hits) {
            ids.add(hit.entityId());
        }
        Map<String, EntityRecord> entities = storage.getEntities(collection, ids);

        List<SimilarEntity> results = new ArrayList<>(hits.size());
        for (IndexHit hit : hits) {
            EntityRecord entity = entities.get(hit.entityId());
            // Сущность могла быть удалена между поиском и чтением
            if (entity != null) {
                results.add(new SimilarEntity(entity.id(), entity.name(), entity.description(), hit.distance()));
            }
        }
        return results;
    }

    @Override
    public Map<EntityCollection, String> indexFailures() {
        return Map.copyOf(indexFailures);
    }

    @Override
    public int rebuildIndex(EntityCollection collection) throws GraphStorageException {
        Map<String, StoredEmbedding> embeddings = storage.loadEmbeddings(collection);
        Map<String, VersionedVector> vectors = new HashMap<>();
        embeddings.forEach((id, embedding) ->
                vectors.put(id, new VersionedVector(embedding.entityVersion(), embedding.vector())));

        vectorIndex.rebuild(collection, vectors);
        indexFailures.remove(collection);
        log.info("Restored vector index for {} with {} vectors", collection, vectors.size());
        return vectors.size();
    }

    /**
     * Индексация после коммита: запись уже зафиксирована, поэтому ошибка индекса только логируется
     */
    private void index(EntityCollection collection, String id, StoredEmbedding embedding) {
        try {
            vectorIndex.upsert(collection, id, embedding.entityVersion(), embedding.vector());
        } catch (RuntimeException e) {
            log.error("Entity {} in {} is stored but not indexed: {}", id, collection, e.getMessage(), e);
        }
    }

    private static String dimensionMismatch(EntityCollection collection, float[] vector) {
        return "Embedding of dimension " + vector.length + " does not match the vector index of "
                + collection.collectionName();
    }
}
