package com.example.voiceprint_backend.matcher;

/**
 * Maps the cosine of two voiceprints onto a similarity in [0, 1].
 */
public enum SimilarityMetric {
    /** (cos + 1) / 2: orthogonal vectors score 0.5, opposite vectors 0. */
    SHIFTED_COSINE {
        @Override
        double fromCosine(double cosine) {
            return (cosine + 1.0) / 2.0;
        }
    },
    /** max(0, cos): anything at or past orthogonal scores 0. */
    CLAMPED_COSINE {
        @Override
        double fromCosine(double cosine) {
            return Math.max(0.0, cosine);
        }
    };

    abstract double fromCosine(double cosine);

    public double similarity(float[] a, float[] b) {
        double cosine = Voiceprints.cosine(a, b);
        return Voiceprints.clampUnit(fromCosine(cosine));
    }
}
