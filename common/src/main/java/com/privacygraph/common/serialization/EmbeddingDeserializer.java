package com.privacygraph.common.serialization;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;

public class EmbeddingDeserializer {

    public StoredEmbedding deserialize(byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("Data cannot be null");
        }

        try {
            ByteBuffer buffer = ByteBuffer.wrap(data);
            long entityVersion = readVarint(buffer);
            int dimension = (int) readVarint(buffer);
            if (dimension <= 0 || dimension * 4L != buffer.remaining()) {
                throw new IllegalArgumentException("Corrupted embedding: dimension " + dimension
                        + " does not match " + buffer.remaining() + " remaining bytes");
            }

            float[] vector = new float[dimension];
            for (int i = 0; i < dimension; i++) {
                vector[i] = buffer.getFloat();
            }
            return new StoredEmbedding(entityVersion, vector);
        } catch (BufferUnderflowException e) {
            throw new IllegalArgumentException("Truncated embedding data", e);
        }
    }

    long readVarint(ByteBuffer buffer) {
        long result = 0;
        int shift = 0;
        while (true) {
            byte b = buffer.get();
            result |= (long) (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return result;
            }
            shift += 7;
            if (shift > 63) {
                throw new IllegalArgumentException("Varint is too long");
            }
        }
    }
}
