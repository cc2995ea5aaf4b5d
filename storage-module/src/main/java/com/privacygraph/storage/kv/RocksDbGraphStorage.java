package com.privacygraph.storage.kv;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.privacygraph.common.model.EntityCollection;
import com.privacygraph.common.model.EntityRecord;
import com.privacygraph.common.model.EntityType;
import com.privacygraph.common.model.EntityTypeProperty;
import com.privacygraph.common.model.RelationshipOntologyEntry;
import com.privacygraph.common.model.RelationshipRecord;
import com.privacygraph.common.model.RelationshipView;
import com.privacygraph.common.serialization.EmbeddingDeserializer;
import com.privacygraph.common.serialization.EmbeddingSerializer;
import com.privacygraph.common.serialization.StoredEmbedding;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.DBOptions;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.Snapshot;
import org.rocksdb.Transaction;
import org.rocksdb.TransactionDB;
import org.rocksdb.TransactionDBOptions;
import org.rocksdb.WriteOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

@Component
@Slf4j
public class RocksDbGraphStorage implements GraphStorage {
    private static final String EMBEDDINGS_CF = "embeddings";                     // collection:entityId -> эмбеддинг
    private static final String RELATIONSHIPS_CF = "relationships";               // relationshipId -> связь
    private static final String ENDPOINT_INDEX_CF = "relationships_by_endpoint";  // entityId:relationshipId -> relationshipId
    private static final String ENTITY_TYPES_CF = "entity_types";
    private static final String ENTITY_TYPE_PROPERTIES_CF = "entity_type_properties";
    private static final String RELATIONSHIP_ONTOLOGY_CF = "relationship_ontology";

    private static final Comparator<EntityRecord> BY_NAME =
            Comparator.comparing(EntityRecord::name).thenComparing(EntityRecord::id);
    private static final Comparator<RelationshipRecord> OLDEST_FIRST =
            Comparator.comparing(RelationshipRecord::createdAt, Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparing(RelationshipRecord::id);

    @Value("${privacy-graph.storage.data-path:./data}")
    private String dataPath;

    @Value("${privacy-graph.storage.lock-timeout-ms:1000}")
    private long lockTimeoutMs = 1000;

    private TransactionDB db;
    private DBOptions dbOptions;
    private TransactionDBOptions transactionDbOptions;
    private volatile boolean open;
    private final Map<String, ColumnFamilyHandle> columnFamilyHandles = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private final EmbeddingSerializer embeddingSerializer = new EmbeddingSerializer();
    private final EmbeddingDeserializer embeddingDeserializer = new EmbeddingDeserializer();

    @FunctionalInterface
    private interface TransactionCallback<T> {
        T execute(Transaction txn, ReadOptions readOptions) throws Exception;
    }

    @FunctionalInterface
    private interface SnapshotCallback<T> {
        T read(ReadOptions readOptions) throws Exception;
    }

    @PostConstruct
    public void initialize() {
        RocksDB.loadLibrary();

        try {
            Path dbPath = Paths.get(dataPath);
            dbPath.toFile().mkdirs();

            List<String> familyNames = columnFamilyNames();
            List<ColumnFamilyDescriptor> columnFamilyDescriptors = new ArrayList<>();
            columnFamilyDescriptors.add(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY));
            for (String name : familyNames) {
                columnFamilyDescriptors.add(new ColumnFamilyDescriptor(name.getBytes(StandardCharsets.UTF_8)));
            }

            List<ColumnFamilyHandle> handles = new ArrayList<>();

            dbOptions = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
            transactionDbOptions = new TransactionDBOptions()
                .setTransactionLockTimeout(lockTimeoutMs);

            db = TransactionDB.open(dbOptions, transactionDbOptions, dbPath.toString(), columnFamilyDescriptors, handles);

            columnFamilyHandles.put("default", handles.get(0));
            for (int i = 0; i < familyNames.size(); i++) {
                columnFamilyHandles.put(familyNames.get(i), handles.get(i + 1));
            }
            open = true;

            log.info("RocksDB graph storage initialized at path: {} with {} column families", dbPath, handles.size());

        } catch (RocksDBException e) {
            // Сервис поднимается в состоянии "не готов", health отдаёт DOWN
            log.error("Failed to initialize RocksDB graph storage at {}", dataPath, e);
            open = false;
        }
    }

    private static List<String> columnFamilyNames() {
        List<String> names = new ArrayList<>();
        for (EntityCollection collection : EntityCollection.values()) {
            names.add(entityFamilyName(collection));
        }
        names.addAll(List.of(EMBEDDINGS_CF, RELATIONSHIPS_CF, ENDPOINT_INDEX_CF,
                ENTITY_TYPES_CF, ENTITY_TYPE_PROPERTIES_CF, RELATIONSHIP_ONTOLOGY_CF));
        return names;
    }

    private static String entityFamilyName(EntityCollection collection) {
        return "entities_" + collection.name().toLowerCase();
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    // ---------------------------------------------------------------- сущности

    @Override
    public void insertEntity(EntityRecord entity, StoredEmbedding embedding) throws GraphStorageException {
        if (embedding == null) {
            throw new GraphStorageException("Entity " + entity.id() + " cannot be stored without an embedding");
        }
        inTransaction("insert entity " + entity.id(), (txn, readOptions) -> {
            ColumnFamilyHandle family = entityFamily(entity.collection());
            byte[] key = bytes(entity.id());
            if (txn.getForUpdate(readOptions, family, key, true) != null) {
                throw new GraphStorageException("Entity already exists: " + entity.id());
            }
            txn.put(family, key, objectMapper.writeValueAsBytes(entity));
            txn.put(handle(EMBEDDINGS_CF), embeddingKey(entity.collection(), entity.id()),
                    embeddingSerializer.serialize(embedding));
            return null;
        });
    }

    @Override
    public Optional<EntityRecord> getEntity(EntityCollection collection, String id) throws GraphStorageException {
        return withSnapshot("get entity " + id, readOptions -> readEntity(readOptions, collection, id));
    }

    @Override
    public Map<String, EntityRecord> getEntities(EntityCollection collection, List<String> ids)
            throws GraphStorageException {
        return withSnapshot("get entities", readOptions -> {
            Map<String, EntityRecord> found = new LinkedHashMap<>();
            for (String id : ids) {
                readEntity(readOptions, collection, id).ifPresent(entity -> found.put(id, entity));
            }
            return found;
        });
    }

    @Override
    public Optional<EntityRecord> findEntity(String id) throws GraphStorageException {
        return withSnapshot("find entity " + id, readOptions -> findInAnyCollection(readOptions, id));
    }

    @Override
    public Optional<EntityChange> updateEntity(EntityCollection collection, String id, EntityUpdateFunction update)
            throws GraphStorageException {
        return inTransaction("update entity " + id, (txn, readOptions) -> {
            ColumnFamilyHandle family = entityFamily(collection);
            byte[] key = bytes(id);
            byte[] current = txn.getForUpdate(readOptions, family, key, true);
            if (current == null) {
                return Optional.empty();
            }

            EntityChange change = update.apply(objectMapper.readValue(current, EntityRecord.class));
            txn.put(family, key, objectMapper.writeValueAsBytes(change.record()));
            if (change.embeddingChanged()) {
                txn.put(handle(EMBEDDINGS_CF), embeddingKey(collection, id),
                        embeddingSerializer.serialize(change.embedding()));
            }
            return Optional.of(change);
        });
    }

    @Override
    public Optional<CascadeDeletion> deleteEntity(EntityCollection collection, String id) throws GraphStorageException {
        return inTransaction("delete entity " + id, (txn, readOptions) -> {
            ColumnFamilyHandle family = entityFamily(collection);
            byte[] key = bytes(id);
            byte[] current = txn.getForUpdate(readOptions, family, key, true);
            if (current == null) {
                return Optional.empty();
            }
            EntityRecord entity = objectMapper.readValue(current, EntityRecord.class);

            // Сначала связи, потом сама сущность - всё в одной транзакции
            List<String> removed = new ArrayList<>();
            for (String relationshipId : endpointRelationshipIds(txn, readOptions, id)) {
                byte[] relationshipBytes = txn.getForUpdate(readOptions, handle(RELATIONSHIPS_CF), bytes(relationshipId), true);
                if (relationshipBytes == null) {
                    continue;
                }
                RelationshipRecord relationship = objectMapper.readValue(relationshipBytes, RelationshipRecord.class);
                if (relationship.touches(id)) {
                    deleteRelationshipRows(txn, relationship);
                    removed.add(relationshipId);
                }
            }

            txn.delete(family, key);
            txn.delete(handle(EMBEDDINGS_CF), embeddingKey(collection, id));
            return Optional.of(new CascadeDeletion(entity, List.copyOf(removed)));
        });
    }

    @Override
    public List<EntityRecord> listEntities(EntityCollection collection, int limit) throws GraphStorageException {
        return withSnapshot("list " + collection.collectionName(), readOptions -> {
            List<EntityRecord> entities = new ArrayList<>();
            try (RocksIterator iterator = db.newIterator(entityFamily(collection), readOptions)) {
                iterator.seekToFirst();
                while (iterator.isValid()) {
                    entities.add(objectMapper.readValue(iterator.value(), EntityRecord.class));
                    iterator.next();
                }
            }
            entities.sort(BY_NAME);
            return limit(entities, limit);
        });
    }

    @Override
    public Optional<StoredEmbedding> getEmbedding(EntityCollection collection, String id) throws GraphStorageException {
        return withSnapshot("get embedding " + id, readOptions -> {
            byte[] value = db.get(handle(EMBEDDINGS_CF), readOptions, embeddingKey(collection, id));
            return value == null ? Optional.empty() : Optional.of(embeddingDeserializer.deserialize(value));
        });
    }

    @Override
    public Map<String, StoredEmbedding> loadEmbeddings(EntityCollection collection) throws GraphStorageException {
        return withSnapshot("load embeddings of " + collection.collectionName(), readOptions -> {
            Map<String, StoredEmbedding> embeddings = new HashMap<>();
            String prefix = collection.name() + ":";
            try (RocksIterator iterator = db.newIterator(handle(EMBEDDINGS_CF), readOptions)) {
                iterator.seek(bytes(prefix));
                while (iterator.isValid()) {
                    String key = string(iterator.key());
                    if (!key.startsWith(prefix)) {
                        break;
                    }
                    embeddings.put(key.substring(prefix.length()), embeddingDeserializer.deserialize(iterator.value()));
                    iterator.next();
                }
            }
            return embeddings;
        });
    }

    // ---------------------------------------------------------------- связи

    @Override
    public void insertRelationship(RelationshipRecord relationship) throws GraphStorageException {
        inTransaction("insert relationship " + relationship.id(), (txn, readOptions) -> {
            byte[] key = bytes(relationship.id());
            if (txn.getForUpdate(readOptions, handle(RELATIONSHIPS_CF), key, true) != null) {
                throw new GraphStorageException("Relationship already exists: " + relationship.id());
            }
            txn.put(handle(RELATIONSHIPS_CF), key, objectMapper.writeValueAsBytes(relationship));
            txn.put(handle(ENDPOINT_INDEX_CF), endpointKey(relationship.sourceId(), relationship.id()), key);
            txn.put(handle(ENDPOINT_INDEX_CF), endpointKey(relationship.targetId(), relationship.id()), key);
            return null;
        });
    }

    @Override
    public Optional<RelationshipRecord> getRelationship(String id) throws GraphStorageException {
        return withSnapshot("get relationship " + id, readOptions -> readRelationship(readOptions, id));
    }

    @Override
    public List<RelationshipRecord> findRelationships(String entityId, String relationshipType, int limit)
            throws GraphStorageException {
        return withSnapshot("find relationships", readOptions -> {
            List<RelationshipRecord> candidates = entityId != null
                    ? relationshipsOf(readOptions, entityId)
                    : allRelationships(readOptions);

            List<RelationshipRecord> result = new ArrayList<>();
            for (RelationshipRecord relationship : candidates) {
                if (relationshipType == null || relationshipType.equals(relationship.relationshipType())) {
                    result.add(relationship);
                }
            }
            result.sort(OLDEST_FIRST);
            return limit(result, limit);
        });
    }

    @Override
    public List<RelationshipRecord> findRelationshipsBetween(String sourceId, String targetId)
            throws GraphStorageException {
        return withSnapshot("find relationships between " + sourceId + " and " + targetId, readOptions -> {
            List<RelationshipRecord> result = new ArrayList<>();
            for (RelationshipRecord relationship : relationshipsOf(readOptions, sourceId)) {
                if (relationship.sourceId().equals(sourceId) && relationship.targetId().equals(targetId)) {
                    result.add(relationship);
                }
            }
            result.sort(OLDEST_FIRST);
            return result;
        });
    }

    @Override
    public Optional<RelationshipRecord> updateRelationship(String id, UnaryOperator<RelationshipRecord> update)
            throws GraphStorageException {
        return inTransaction("update relationship " + id, (txn, readOptions) ->
                updateLocked(txn, readOptions, id, update));
    }

    @Override
    public Optional<RelationshipRecord> updateFirstRelationshipBetween(String sourceId, String targetId,
                                                                       UnaryOperator<RelationshipRecord> update)
            throws GraphStorageException {
        return inTransaction("update relationship " + sourceId + " -> " + targetId, (txn, readOptions) -> {
            Optional<RelationshipRecord> first = firstBetween(txn, readOptions, sourceId, targetId);
            if (first.isEmpty()) {
                return Optional.empty();
            }
            return updateLocked(txn, readOptions, first.get().id(), update);
        });
    }

    @Override
    public Optional<RelationshipRecord> deleteRelationship(String id) throws GraphStorageException {
        return inTransaction("delete relationship " + id, (txn, readOptions) -> deleteLocked(txn, readOptions, id));
    }

    @Override
    public Optional<RelationshipRecord> deleteFirstRelationshipBetween(String sourceId, String targetId)
            throws GraphStorageException {
        return inTransaction("delete relationship " + sourceId + " -> " + targetId, (txn, readOptions) -> {
            Optional<RelationshipRecord> first = firstBetween(txn, readOptions, sourceId, targetId);
            if (first.isEmpty()) {
                return Optional.empty();
            }
            return deleteLocked(txn, readOptions, first.get().id());
        });
    }

    @Override
    public List<RelationshipView> listRelationships(int limit, boolean withEntityDetails) throws GraphStorageException {
        // Связи и данные концов читаются из одного снимка
        return withSnapshot("list relationships", readOptions -> {
            List<RelationshipRecord> relationships = allRelationships(readOptions);
            relationships.sort(OLDEST_FIRST);
            relationships = limit(relationships, limit);

            List<RelationshipView> views = new ArrayList<>(relationships.size());
            if (!withEntityDetails) {
                for (RelationshipRecord relationship : relationships) {
                    views.add(RelationshipView.of(relationship));
                }
                return views;
            }

            Map<String, Optional<EntityRecord>> endpoints = new HashMap<>();
            for (RelationshipRecord relationship : relationships) {
                EntityRecord source = resolveEndpoint(readOptions, endpoints, relationship.sourceId());
                EntityRecord target = resolveEndpoint(readOptions, endpoints, relationship.targetId());
                views.add(RelationshipView.withEndpoints(relationship, source, target));
            }
            return views;
        });
    }

    // ---------------------------------------------------------------- онтология

    @Override
    public void putEntityType(EntityType entityType) throws GraphStorageException {
        put(ENTITY_TYPES_CF, entityType.typeId(), entityType);
    }

    @Override
    public List<EntityType> listEntityTypes() throws GraphStorageException {
        List<EntityType> types = scan(ENTITY_TYPES_CF, "", EntityType.class);
        types.sort(Comparator.comparing(EntityType::name));
        return types;
    }

    @Override
    public void putEntityTypeProperty(EntityTypeProperty property) throws GraphStorageException {
        put(ENTITY_TYPE_PROPERTIES_CF, property.typeId() + ":" + property.propertyName(), property);
    }

    @Override
    public List<EntityTypeProperty> listEntityTypeProperties(String typeId) throws GraphStorageException {
        List<EntityTypeProperty> properties = scan(ENTITY_TYPE_PROPERTIES_CF, typeId + ":", EntityTypeProperty.class);
        properties.sort(Comparator.comparing(EntityTypeProperty::propertyName));
        return properties;
    }

    @Override
    public void putRelationshipOntologyEntry(RelationshipOntologyEntry entry) throws GraphStorageException {
        String key = entry.sourceTypeId() + ":" + entry.targetTypeId() + ":" + entry.relationshipType();
        put(RELATIONSHIP_ONTOLOGY_CF, key, entry);
    }

    @Override
    public List<RelationshipOntologyEntry> listRelationshipOntology() throws GraphStorageException {
        List<RelationshipOntologyEntry> entries = scan(RELATIONSHIP_ONTOLOGY_CF, "", RelationshipOntologyEntry.class);
        entries.sort(Comparator.comparing(RelationshipOntologyEntry::sourceType, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(RelationshipOntologyEntry::targetType, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(RelationshipOntologyEntry::relationshipType));
        return entries;
    }

    // ---------------------------------------------------------------- транзакции и снимки

    private <T> T inTransaction(String operation, TransactionCallback<T> callback) throws GraphStorageException {
        ensureOpen();
        try (WriteOptions writeOptions = new WriteOptions();
             ReadOptions readOptions = new ReadOptions();
             Transaction txn = db.beginTransaction(writeOptions)) {
            try {
                T result = callback.execute(txn, readOptions);
                txn.commit();
                return result;
            } catch (Exception e) {
                rollback(txn, operation);
                throw e;
            }
        } catch (GraphStorageException e) {
            throw e;
        } catch (Exception e) {
            throw new GraphStorageException("Failed to " + operation, e);
        }
    }

    private void rollback(Transaction txn, String operation) {
        try {
            txn.rollback();
        } catch (RocksDBException e) {
            log.warn("Rollback of '{}' failed: {}", operation, e.getMessage());
        }
    }

    private <T> T withSnapshot(String operation, SnapshotCallback<T> callback) throws GraphStorageException {
        ensureOpen();
        Snapshot snapshot = db.getSnapshot();
        try (ReadOptions readOptions = new ReadOptions().setSnapshot(snapshot)) {
            return callback.read(readOptions);
        } catch (GraphStorageException e) {
            throw e;
        } catch (Exception e) {
            throw new GraphStorageException("Failed to " + operation, e);
        } finally {
            db.releaseSnapshot(snapshot);
        }
    }

    private void ensureOpen() throws GraphStorageException {
        if (!open) {
            throw new GraphStorageException("Graph storage is not open");
        }
    }

    // ---------------------------------------------------------------- вспомогательные

    private Optional<EntityRecord> readEntity(ReadOptions readOptions, EntityCollection collection, String id)
            throws RocksDBException, IOException {
        byte[] value = db.get(entityFamily(collection), readOptions, bytes(id));
        return value == null ? Optional.empty() : Optional.of(objectMapper.readValue(value, EntityRecord.class));
    }

    private Optional<EntityRecord> findInAnyCollection(ReadOptions readOptions, String id)
            throws RocksDBException, IOException {
        for (EntityCollection collection : EntityCollection.values()) {
            Optional<EntityRecord> entity = readEntity(readOptions, collection, id);
            if (entity.isPresent()) {
                return entity;
            }
        }
        return Optional.empty();
    }

    private EntityRecord resolveEndpoint(ReadOptions readOptions, Map<String, Optional<EntityRecord>> cache, String id)
            throws RocksDBException, IOException {
        Optional<EntityRecord> cached = cache.get(id);
        if (cached == null) {
            cached = findInAnyCollection(readOptions, id);
            cache.put(id, cached);
        }
        return cached.orElse(null);
    }

    private Optional<RelationshipRecord> readRelationship(ReadOptions readOptions, String id)
            throws RocksDBException, IOException {
        byte[] value = db.get(handle(RELATIONSHIPS_CF), readOptions, bytes(id));
        return value == null ? Optional.empty() : Optional.of(objectMapper.readValue(value, RelationshipRecord.class));
    }

    private List<RelationshipRecord> allRelationships(ReadOptions readOptions) throws IOException {
        List<RelationshipRecord> relationships = new ArrayList<>();
        try (RocksIterator iterator = db.newIterator(handle(RELATIONSHIPS_CF), readOptions)) {
            iterator.seekToFirst();
            while (iterator.isValid()) {
                relationships.add(objectMapper.readValue(iterator.value(), RelationshipRecord.class));
                iterator.next();
            }
        }
        return relationships;
    }

    /** Связи, где entityId - источник или цель (по индексу концов) */
    private List<RelationshipRecord> relationshipsOf(ReadOptions readOptions, String entityId)
            throws RocksDBException, IOException {
        Set<String> ids = new LinkedHashSet<>();
        String prefix = entityId + ":";
        try (RocksIterator iterator = db.newIterator(handle(ENDPOINT_INDEX_CF), readOptions)) {
            iterator.seek(bytes(prefix));
            while (iterator.isValid() && string(iterator.key()).startsWith(prefix)) {
                ids.add(string(iterator.value()));
                iterator.next();
            }
        }

        List<RelationshipRecord> relationships = new ArrayList<>();
        for (String id : ids) {
            // Ключ индекса может совпасть по префиксу с чужим ID, содержащим ':'
            readRelationship(readOptions, id)
                    .filter(relationship -> relationship.touches(entityId))
                    .ifPresent(relationships::add);
        }
        return relationships;
    }

    private List<String> endpointRelationshipIds(Transaction txn, ReadOptions readOptions, String entityId) {
        Set<String> ids = new LinkedHashSet<>();
        String prefix = entityId + ":";
        try (RocksIterator iterator = txn.getIterator(readOptions, handle(ENDPOINT_INDEX_CF))) {
            iterator.seek(bytes(prefix));
            while (iterator.isValid() && string(iterator.key()).startsWith(prefix)) {
                ids.add(string(iterator.value()));
                iterator.next();
            }
        }
        return new ArrayList<>(ids);
    }

    private Optional<RelationshipRecord> firstBetween(Transaction txn, ReadOptions readOptions,
                                                      String sourceId, String targetId)
            throws RocksDBException, IOException {
        List<RelationshipRecord> matches = new ArrayList<>();
        for (String id : endpointRelationshipIds(txn, readOptions, sourceId)) {
            byte[] value = txn.getForUpdate(readOptions, handle(RELATIONSHIPS_CF), bytes(id), false);
            if (value == null) {
                continue;
            }
            RelationshipRecord relationship = objectMapper.readValue(value, RelationshipRecord.class);
            if (relationship.sourceId().equals(sourceId) && relationship.targetId().equals(targetId)) {
                matches.add(relationship);
            }
        }
        return matches.stream().min(OLDEST_FIRST);
    }

    private Optional<RelationshipRecord> updateLocked(Transaction txn, ReadOptions readOptions, String id,
                                                      UnaryOperator<RelationshipRecord> update)
            throws RocksDBException, IOException {
        byte[] key = bytes(id);
        byte[] current = txn.getForUpdate(readOptions, handle(RELATIONSHIPS_CF), key, true);
        if (current == null) {
            return Optional.empty();
        }
        RelationshipRecord updated = update.apply(objectMapper.readValue(current, RelationshipRecord.class));
        txn.put(handle(RELATIONSHIPS_CF), key, objectMapper.writeValueAsBytes(updated));
        return Optional.of(updated);
    }

    private Optional<RelationshipRecord> deleteLocked(Transaction txn, ReadOptions readOptions, String id)
            throws RocksDBException, IOException {
        byte[] current = txn.getForUpdate(readOptions, handle(RELATIONSHIPS_CF), bytes(id), true);
        if (current == null) {
            return Optional.empty();
        }
        RelationshipRecord relationship = objectMapper.readValue(current, RelationshipRecord.class);
        deleteRelationshipRows(txn, relationship);
        return Optional.of(relationship);
    }

    private void deleteRelationshipRows(Transaction txn, RelationshipRecord relationship) throws RocksDBException {
        txn.delete(handle(RELATIONSHIPS_CF), bytes(relationship.id()));
        txn.delete(handle(ENDPOINT_INDEX_CF), endpointKey(relationship.sourceId(), relationship.id()));
        txn.delete(handle(ENDPOINT_INDEX_CF), endpointKey(relationship.targetId(), relationship.id()));
    }

    private void put(String family, String key, Object value) throws GraphStorageException {
        ensureOpen();
        try {
            db.put(handle(family), bytes(key), objectMapper.writeValueAsBytes(value));
        } catch (RocksDBException | IOException e) {
            throw new GraphStorageException("Failed to write " + key + " to " + family, e);
        }
    }

    private <T> List<T> scan(String family, String prefix, Class<T> type) throws GraphStorageException {
        return withSnapshot("scan " + family, readOptions -> {
            List<T> values = new ArrayList<>();
            try (RocksIterator iterator = db.newIterator(handle(family), readOptions)) {
                iterator.seek(bytes(prefix));
                while (iterator.isValid() && string(iterator.key()).startsWith(prefix)) {
                    values.add(objectMapper.readValue(iterator.value(), type));
                    iterator.next();
                }
            }
            return values;
        });
    }

    private static <T> List<T> limit(List<T> values, int limit) {
        if (limit <= 0 || values.size() <= limit) {
            return values;
        }
        return new ArrayList<>(values.subList(0, limit));
    }

    private ColumnFamilyHandle entityFamily(EntityCollection collection) {
        return handle(entityFamilyName(collection));
    }

    private ColumnFamilyHandle handle(String family) {
        return columnFamilyHandles.get(family);
    }

    private static byte[] embeddingKey(EntityCollection collection, String id) {
        return bytes(collection.name() + ":" + id);
    }

    private static byte[] endpointKey(String entityId, String relationshipId) {
        return bytes(entityId + ":" + relationshipId);
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static String string(byte[] value) {
        return new String(value, StandardCharsets.UTF_8);
    }

    @PreDestroy
    public void cleanup() {
        open = false;
        if (db != null) {
            columnFamilyHandles.values().forEach(ColumnFamilyHandle::close);
            columnFamilyHandles.clear();
            db.close();
            db = null;
            log.info("RocksDB graph storage closed successfully");
        }
        if (transactionDbOptions != null) {
            transactionDbOptions.close();
        }
        if (dbOptions != null) {
            dbOptions.close();
        }
    }
}
