package com.privacygraph.storage.index;

import com.github.jelmerk.hnswlib.core.DistanceFunctions;
import com.github.jelmerk.hnswlib.core.SearchResult;
import com.github.jelmerk.hnswlib.core.hnsw.HnswIndex;
import com.privacygraph.common.model.EntityCollection;
import com.privacygraph.storage.similarity.VectorSimilarity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * HNSW индекс на hnswlib, по одному графу на коллекцию сущностей.
 * Маленькие коллекции (не больше exactSearchThreshold векторов) ищутся точным перебором.
 */
@Component
@Slf4j
public class HnswVectorIndex implements VectorIndex {

    private static final Comparator<IndexHit> BY_DISTANCE =
            Comparator.comparingDouble(IndexHit::distance).thenComparing(IndexHit::entityId);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final VectorSimilarity vectorSimilarity;

    // Параметры HNSW
    private final int maxElements;
    private final int m;
    private final int efConstruction;
    private final int efSearch;
    private final int exactSearchThreshold;

    /** Состояние индекса одной коллекции */
    private static class CollectionIndex {
        /** Размерность векторов (-1 если не определена) */
        int dimension = -1;

        /** Актуальные векторы: ID -> вектор */
        Map<String, float[]> vectors = new HashMap<>();

        /** Версии сущностей, из которых посчитаны векторы */
        Map<String, Long> versions = new HashMap<>();

        /** Удалённые сущности: ID не переиспользуются, запоздавший upsert не должен их вернуть */
        Set<String> removed = new HashSet<>();

        HnswIndex<String, float[], VectorItem, Float> hnswIndex;

        /** Ёмкость графа и число занятых узлов (удалённые узлы тоже считаются) */
        int capacity;
        int usedSlots;
    }

    private final Map<EntityCollection, CollectionIndex> collectionIndices = new EnumMap<>(EntityCollection.class);

    public HnswVectorIndex(
            VectorSimilarity vectorSimilarity,
            @Value("${privacy-graph.index.max-elements:10000}") int maxElements,
            @Value("${privacy-graph.index.m:16}") int m,
            @Value("${privacy-graph.index.ef-construction:200}") int efConstruction,
            @Value("${privacy-graph.index.ef-search:100}") int efSearch,
            @Value("${privacy-graph.index.exact-search-threshold:2000}") int exactSearchThreshold) {
        this.vectorSimilarity = vectorSimilarity;
        this.maxElements = maxElements;
        this.m = m;
        this.efConstruction = efConstruction;
        this.efSearch = efSearch;
        this.exactSearchThreshold = exactSearchThreshold;
        log.info("Initialized HNSW index with maxElements={}, m={}, efConstruction={}, efSearch={}, exactSearchThreshold={}",
                maxElements, m, efConstruction, efSearch, exactSearchThreshold);
    }

    @Override
    public void upsert(EntityCollection collection, String entityId, long version, float[] vector) {
        lock.writeLock().lock();
        try {
            CollectionIndex index = collectionIndices.computeIfAbsent(collection, c -> new CollectionIndex());
            if (index.removed.contains(entityId)) {
                log.debug("Ignoring vector for removed entity {} in {}", entityId, collection);
                return;
            }
            checkDimension(index, collection, vector);

            Long knownVersion = index.versions.get(entityId);
            if (knownVersion != null && knownVersion > version) {
                log.debug("Ignoring stale vector for {} in {}: version {} < {}",
                        entityId, collection, version, knownVersion);
                return;
            }

            float[] copy = Arrays.copyOf(vector, vector.length);
            if (index.hnswIndex == null) {
                rebuildGraph(index, Math.max(maxElements, 16));
            }
            if (index.vectors.remove(entityId) != null) {
                index.hnswIndex.remove(entityId, knownVersion != null ? knownVersion : version);
            }
            if (index.usedSlots >= index.capacity) {
                rebuildGraph(index, Math.max(index.capacity * 2, (index.vectors.size() + 1) * 2));
            }

            index.hnswIndex.add(new VectorItem(entityId, copy, version));
            index.usedSlots++;
            index.vectors.put(entityId, copy);
            index.versions.put(entityId, version);
            log.debug("Indexed vector {} (version {}) in {}, size={}", entityId, version, collection, index.vectors.size());

        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean remove(EntityCollection collection, String entityId) {
        lock.writeLock().lock();
        try {
            CollectionIndex index = collectionIndices.computeIfAbsent(collection, c -> new CollectionIndex());
            index.removed.add(entityId);
            if (!index.vectors.containsKey(entityId)) {
                return false;
            }

            index.vectors.remove(entityId);
            Long version = index.versions.remove(entityId);
            if (index.hnswIndex != null) {
                index.hnswIndex.remove(entityId, version != null ? version : Long.MAX_VALUE);
            }
            log.debug("Removed vector {} from {}", entityId, collection);
            return true;

        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<IndexHit> search(EntityCollection collection, float[] queryVector, int k) {
        lock.readLock().lock();
        try {
            CollectionIndex index = collectionIndices.get(collection);
            if (index == null || index.vectors.isEmpty() || k <= 0) {
                return List.of();
            }

            if (queryVector.length != index.dimension) {
                throw new IllegalArgumentException(
                    String.format("Query vector dimension mismatch for %s. Expected: %d, got: %d",
                        collection, index.dimension, queryVector.length));
            }

            if (index.vectors.size() <= exactSearchThreshold || index.hnswIndex == null) {
                return linearSearch(index, queryVector, k);
            }

            log.debug("Performing HNSW search for k={} on {} vectors in {}", k, index.vectors.size(), collection);
            List<IndexHit> results = new ArrayList<>();
            for (SearchResult<VectorItem, Float> hnswResult : index.hnswIndex.findNearest(queryVector, k)) {
                String id = hnswResult.item().id();
                if (index.vectors.containsKey(id)) {
                    results.add(new IndexHit(id, clamp(hnswResult.distance())));
                }
            }
            results.sort(BY_DISTANCE);
            return results.size() > k ? results.subList(0, k) : results;

        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void rebuild(EntityCollection collection, Map<String, VersionedVector> vectors) {
        lock.writeLock().lock();
        try {
            if (vectors.isEmpty()) {
                collectionIndices.remove(collection);
                log.info("Rebuilt empty index for {}", collection);
                return;
            }

            CollectionIndex index = new CollectionIndex();
            for (Map.Entry<String, VersionedVector> entry : vectors.entrySet()) {
                float[] vector = entry.getValue().vector();
                checkDimension(index, collection, vector);
                index.vectors.put(entry.getKey(), Arrays.copyOf(vector, vector.length));
                index.versions.put(entry.getKey(), entry.getValue().version());
            }
            rebuildGraph(index, Math.max(maxElements, vectors.size() * 2));
            collectionIndices.put(collection, index);
            log.info("Rebuilt HNSW index for {} with {} vectors, dimension={}",
                    collection, index.vectors.size(), index.dimension);

        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int size(EntityCollection collection) {
        lock.readLock().lock();
        try {
            CollectionIndex index = collectionIndices.get(collection);
            return index == null ? 0 : index.vectors.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean accepts(EntityCollection collection, float[] vector) {
        if (vector == null || vector.length == 0) {
            return false;
        }
        lock.readLock().lock();
        try {
            CollectionIndex index = collectionIndices.get(collection);
            return index == null || index.vectors.isEmpty() || index.dimension == vector.length;
        } finally {
            lock.readLock().unlock();
        }
    }

    private void checkDimension(CollectionIndex index, EntityCollection collection, float[] vector) {
        if (vector == null || vector.length == 0) {
            throw new IllegalArgumentException("Vector cannot be null or empty");
        }
        if (index.dimension == -1) {
            index.dimension = vector.length;
        } else if (index.vectors.isEmpty() && index.dimension != vector.length) {
            // Пустая коллекция принимает новую размерность, граф строится заново
            index.dimension = vector.length;
            index.hnswIndex = null;
        } else if (index.dimension != vector.length) {
            throw new IllegalArgumentException(
                String.format("Vector dimension mismatch for %s. Expected: %d, got: %d",
                    collection, index.dimension, vector.length));
        }
    }

    /**
     * Новый граф из актуальных векторов; удалённые узлы старого графа при этом освобождаются
     */
    private void rebuildGraph(CollectionIndex index, int capacity) {
        HnswIndex<String, float[], VectorItem, Float> hnswIndex =
            HnswIndex.newBuilder(index.dimension, DistanceFunctions.FLOAT_COSINE_DISTANCE, capacity)
                .withM(m)
                .withEfConstruction(efConstruction)
                .withEf(efSearch)
                .withRemoveEnabled()
                .build();

        for (Map.Entry<String, float[]> entry : index.vectors.entrySet()) {
            hnswIndex.add(new VectorItem(entry.getKey(), entry.getValue(), index.versions.getOrDefault(entry.getKey(), 0L)));
        }

        index.hnswIndex = hnswIndex;
        index.capacity = capacity;
        index.usedSlots = index.vectors.size();
        log.debug("Built HNSW graph with capacity={} and {} vectors", capacity, index.usedSlots);
    }

    /**
     * Точный перебор для маленьких коллекций
     */
    private List<IndexHit> linearSearch(CollectionIndex index, float[] queryVector, int k) {
        List<IndexHit> results = new ArrayList<>(index.vectors.size());
        for (Map.Entry<String, float[]> entry : index.vectors.entrySet()) {
            results.add(new IndexHit(entry.getKey(), vectorSimilarity.cosineDistance(queryVector, entry.getValue())));
        }

        results.sort(BY_DISTANCE);
        int resultSize = Math.min(k, results.size());

        log.debug("Linear search found {} results, returning top {}", results.size(), resultSize);
        return new ArrayList<>(results.subList(0, resultSize));
    }

    private static double clamp(float distance) {
        return Math.max(0.0, Math.min(2.0, distance));
    }
}
