package com.privacygraph.common.serialization;

/**
 * Embedding vector together with the entity version it was computed for.
 */
public record StoredEmbedding(long entityVersion, float[] vector) {

    public StoredEmbedding {
        if (vector == null || vector.length == 0) {
            throw new IllegalArgumentException("Embedding cannot be null or empty");
        }
    }

    public int dimension() {
        return vector.length;
    }
}
