package com.example.voiceprint_backend.matcher;

import com.example.voiceprint_backend.exception.InvalidEmbeddingException;

/**
 * Vector helpers shared by the matcher and the intake validation.
 */
public final class Voiceprints {

    private Voiceprints() {
    }

    /**
     * Rejects vectors that cannot be compared: null, empty, non-finite or all-zero.
     *
     * @param vector voiceprint to check.
     * @throws InvalidEmbeddingException when the vector is unusable.
     */
    public static void validate(float[] vector) {
        if (vector == null || vector.length == 0) {
            throw new InvalidEmbeddingException("Voiceprint is empty");
        }
        double sumSquares = 0.0;
        for (int i = 0; i < vector.length; i++) {
            float v = vector[i];
            if (!Float.isFinite(v)) {
                throw new InvalidEmbeddingException("Voiceprint has a non-finite value at index " + i);
            }
            sumSquares += (double) v * v;
        }
        if (sumSquares == 0.0) {
            throw new InvalidEmbeddingException("Voiceprint has zero norm");
        }
    }

    static double cosine(float[] a, float[] b) {
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    static double clampUnit(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(1.0, value);
    }
}
