package com.privacygraph.storage.index;

import com.privacygraph.common.model.EntityCollection;

import java.util.List;
import java.util.Map;

/**
 * Интерфейс векторного индекса: по одному индексу на коллекцию сущностей.
 * Расстояние - косинусное, в диапазоне [0, 2].
 */
public interface VectorIndex {

    /**
     * Добавить или заменить вектор сущности
     * @param collection коллекция
     * @param entityId ID сущности
     * @param version версия сущности, более старая версия не перезаписывает новую
     * @param vector эмбеддинг
     */
    void upsert(EntityCollection collection, String entityId, long version, float[] vector);

    /**
     * Проверить, что вектор подходит по размерности индексу коллекции
     * @return true если индекс пуст или размерности совпадают
     */
    boolean accepts(EntityCollection collection, float[] vector);

    /**
     * Удалить вектор из индекса. Более поздний upsert той же сущности игнорируется.
     * @return true если вектор найден и удалён
     */
    boolean remove(EntityCollection collection, String entityId);

    /**
     * Поиск k ближайших соседей
     * @param collection коллекция
     * @param queryVector вектор запроса
     * @param k количество соседей
     * @return результаты, отсортированные по возрастанию расстояния
     */
    List<IndexHit> search(EntityCollection collection, float[] queryVector, int k);

    /**
     * Перестроить индекс коллекции с нуля
     * @param vectors entityId -> (версия, вектор)
     */
    void rebuild(EntityCollection collection, Map<String, VersionedVector> vectors);

    /** Количество векторов коллекции */
    int size(EntityCollection collection);
}
