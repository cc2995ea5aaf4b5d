package com.privacygraph.storage.kv;

import com.privacygraph.common.model.EntityRecord;

/**
 * Вычисляет новое состояние сущности по текущему, прочитанному под блокировкой.
 */
@FunctionalInterface
public interface EntityUpdateFunction {

    EntityChange apply(EntityRecord current);
}
