package com.privacygraph.storage.similarity;

import org.springframework.stereotype.Component;

@Component
public class VectorSimilarity {

    /** Вычислить косинусное сходство между векторами */
    public double cosineSimilarity(float[] vector1, float[] vector2) {
        if (vector1.length != vector2.length) {
            throw new IllegalArgumentException("Vectors must have the same dimension");
        }

        double dotProduct = 0.0;
        double normA = 0.0;
        double normB = 0.0;

        for (int i = 0; i < vector1.length; i++) {
            dotProduct += vector1[i] * vector2[i];
            normA += vector1[i] * vector1[i];
            normB += vector2[i] * vector2[i];
        }

        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }

        return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /** Косинусное расстояние: 0 - одно направление, 2 - противоположные */
    public double cosineDistance(float[] vector1, float[] vector2) {
        double distance = 1.0 - cosineSimilarity(vector1, vector2);
        return Math.max(0.0, Math.min(2.0, distance));
    }
}
