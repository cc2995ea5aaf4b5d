package com.privacygraph.storage.service;

import com.privacygraph.common.model.EntityCollection;
import com.privacygraph.common.model.EntityRecord;
import com.privacygraph.common.model.SimilarEntity;
import com.privacygraph.common.serialization.StoredEmbedding;
import com.privacygraph.storage.kv.CascadeDeletion;
import com.privacygraph.storage.kv.EntityChange;
import com.privacygraph.storage.kv.EntityUpdateFunction;
import com.privacygraph.storage.kv.GraphStorageException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Хранение сущностей с синхронизацией векторного индекса после каждой зафиксированной транзакции
 */
public interface EntityStorageService {

    /** Сохранить новую сущность и добавить её вектор в индекс; вектор другой размерности не сохраняется */
    void create(EntityRecord entity, StoredEmbedding embedding) throws GraphStorageException;

    /** Получить сущность по ID */
    Optional<EntityRecord> get(EntityCollection collection, String id) throws GraphStorageException;

    /** Обновить сущность, при смене эмбеддинга обновить индекс */
    Optional<EntityChange> update(EntityCollection collection, String id, EntityUpdateFunction update)
            throws GraphStorageException;

    /** Удалить сущность вместе со связями и убрать её из индекса */
    Optional<CascadeDeletion> delete(EntityCollection collection, String id) throws GraphStorageException;

    /** Сущности коллекции по имени */
    List<EntityRecord> list(EntityCollection collection, int limit) throws GraphStorageException;

    /** Ближайшие сущности коллекции по косинусному расстоянию */
    List<SimilarEntity> findNearest(EntityCollection collection, float[] queryVector, int limit)
            throws GraphStorageException;

    /** Коллекции, индекс которых не восстановился при старте, с причиной */
    Map<EntityCollection, String> indexFailures();

    /** Перестроить индекс коллекции из хранилища */
    int rebuildIndex(EntityCollection collection) throws GraphStorageException;
}
