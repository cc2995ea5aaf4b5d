package com.privacygraph.storage.kv;

import com.privacygraph.common.model.EntityCollection;
import com.privacygraph.common.model.EntityRecord;
import com.privacygraph.common.model.EntityType;
import com.privacygraph.common.model.EntityTypeProperty;
import com.privacygraph.common.model.RelationshipOntologyEntry;
import com.privacygraph.common.model.RelationshipRecord;
import com.privacygraph.common.model.RelationshipView;
import com.privacygraph.common.serialization.StoredEmbedding;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Интерфейс транзакционного хранилища графа.
 * Каждая мутация выполняется одной транзакцией, чтения идут по снимку.
 */
public interface GraphStorage {

    /** Хранилище открыто и готово к работе */
    boolean isOpen();

    /** Сохранить новую сущность вместе с эмбеддингом */
    void insertEntity(EntityRecord entity, StoredEmbedding embedding) throws GraphStorageException;

    /** Получить сущность по ID */
    Optional<EntityRecord> getEntity(EntityCollection collection, String id) throws GraphStorageException;

    /** Получить несколько сущностей коллекции из одного снимка */
    Map<String, EntityRecord> getEntities(EntityCollection collection, List<String> ids) throws GraphStorageException;

    /** Найти сущность в любой коллекции */
    Optional<EntityRecord> findEntity(String id) throws GraphStorageException;

    /** Обновить сущность: чтение под блокировкой, вычисление и запись в одной транзакции */
    Optional<EntityChange> updateEntity(EntityCollection collection, String id, EntityUpdateFunction update)
            throws GraphStorageException;

    /** Удалить сущность и все связи, где она источник или цель */
    Optional<CascadeDeletion> deleteEntity(EntityCollection collection, String id) throws GraphStorageException;

    /** Сущности коллекции, отсортированные по имени (limit <= 0 - без ограничения) */
    List<EntityRecord> listEntities(EntityCollection collection, int limit) throws GraphStorageException;

    /** Эмбеддинг сущности */
    Optional<StoredEmbedding> getEmbedding(EntityCollection collection, String id) throws GraphStorageException;

    /** Все эмбеддинги коллекции: entityId -> эмбеддинг */
    Map<String, StoredEmbedding> loadEmbeddings(EntityCollection collection) throws GraphStorageException;

    /** Сохранить новую связь */
    void insertRelationship(RelationshipRecord relationship) throws GraphStorageException;

    /** Получить связь по ID */
    Optional<RelationshipRecord> getRelationship(String id) throws GraphStorageException;

    /** Связи по концу (источник или цель) и/или типу, оба фильтра необязательны */
    List<RelationshipRecord> findRelationships(String entityId, String relationshipType, int limit)
            throws GraphStorageException;

    /** Все связи упорядоченной пары, старые первыми */
    List<RelationshipRecord> findRelationshipsBetween(String sourceId, String targetId) throws GraphStorageException;

    /** Обновить связь по ID */
    Optional<RelationshipRecord> updateRelationship(String id, UnaryOperator<RelationshipRecord> update)
            throws GraphStorageException;

    /** Обновить самую старую связь пары */
    Optional<RelationshipRecord> updateFirstRelationshipBetween(String sourceId, String targetId,
                                                                UnaryOperator<RelationshipRecord> update)
            throws GraphStorageException;

    /** Удалить связь по ID */
    Optional<RelationshipRecord> deleteRelationship(String id) throws GraphStorageException;

    /** Удалить самую старую связь пары */
    Optional<RelationshipRecord> deleteFirstRelationshipBetween(String sourceId, String targetId)
            throws GraphStorageException;

    /** Все связи, при withEntityDetails - с именами и типами концов из того же снимка */
    List<RelationshipView> listRelationships(int limit, boolean withEntityDetails) throws GraphStorageException;

    /** Сохранить тип сущности */
    void putEntityType(EntityType entityType) throws GraphStorageException;

    /** Все типы сущностей */
    List<EntityType> listEntityTypes() throws GraphStorageException;

    /** Сохранить объявление свойства типа */
    void putEntityTypeProperty(EntityTypeProperty property) throws GraphStorageException;

    /** Свойства типа по его ID */
    List<EntityTypeProperty> listEntityTypeProperties(String typeId) throws GraphStorageException;

    /** Сохранить допустимый тип связи между типами сущностей */
    void putRelationshipOntologyEntry(RelationshipOntologyEntry entry) throws GraphStorageException;

    /** Вся онтология связей */
    List<RelationshipOntologyEntry> listRelationshipOntology() throws GraphStorageException;
}
