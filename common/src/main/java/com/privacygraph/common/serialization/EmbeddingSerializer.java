package com.privacygraph.common.serialization;

import java.nio.ByteBuffer;

/**
 * Бинарный сериализатор эмбеддинга сущности.
 * Формат:
 *   [версия сущности (varint)]
 *   [размерность (varint)] [floats (размерность * 4 байт)]
 */
public class EmbeddingSerializer {

    public byte[] serialize(StoredEmbedding embedding) {
        if (embedding == null) {
            throw new IllegalArgumentException("Embedding cannot be null");
        }

        float[] vector = embedding.vector();
        ByteBuffer buffer = ByteBuffer.allocate(calculateSize(embedding));

        writeVarint(buffer, embedding.entityVersion());
        writeVarint(buffer, vector.length);
        for (float value : vector) {
            buffer.putFloat(value);
        }

        return buffer.array();
    }

    void writeVarint(ByteBuffer buffer, long value) {
        while ((value & ~0x7FL) != 0) {
            buffer.put((byte) ((value & 0x7F) | 0x80));
            value >>>= 7;
        }
        buffer.put((byte) (value & 0x7F));
    }

    int calculateSize(StoredEmbedding embedding) {
        int dimension = embedding.dimension();
        return varintSize(embedding.entityVersion()) + varintSize(dimension) + dimension * 4;
    }

    private int varintSize(long value) {
        int size = 0;
        while ((value & ~0x7FL) != 0) {
            size++;
            value >>>= 7;
        }
        return size + 1;
    }
}
