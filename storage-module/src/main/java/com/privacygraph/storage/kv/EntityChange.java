package com.privacygraph.storage.kv;

import com.privacygraph.common.model.EntityRecord;
import com.privacygraph.common.serialization.StoredEmbedding;

/**
 * Новое состояние сущности внутри транзакции обновления.
 * embedding == null означает, что эмбеддинг не меняется.
 */
public record EntityChange(EntityRecord record, StoredEmbedding embedding) {

    public static EntityChange of(EntityRecord record) {
        return new EntityChange(record, null);
    }

    public boolean embeddingChanged() {
        return embedding != null;
    }
}
