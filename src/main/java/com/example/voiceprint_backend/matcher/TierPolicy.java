package com.example.voiceprint_backend.matcher;

/**
 * Thresholds mapping a similarity score onto a {@link ConfidenceTier}. Both bounds are inclusive.
 *
 * @param highThreshold   lowest score classified as {@link ConfidenceTier#HIGH}.
 * @param mediumThreshold lowest score classified as {@link ConfidenceTier#MEDIUM}.
 */
public record TierPolicy(double highThreshold, double mediumThreshold) {

    public TierPolicy {
        if (Double.isNaN(highThreshold) || Double.isNaN(mediumThreshold)
                || mediumThreshold < 0.0 || highThreshold > 1.0 || mediumThreshold > highThreshold) {
            throw new IllegalArgumentException(
                    "Invalid tier thresholds high=" + highThreshold + " medium=" + mediumThreshold);
        }
    }

    /**
     * Thresholds used when nothing is configured: 0.75 for high and 0.50 for medium confidence.
     *
     * @return default policy.
     */
    public static TierPolicy defaults() {
        return new TierPolicy(0.75, 0.50);
    }

    public ConfidenceTier classify(double score) {
        if (score >= highThreshold) {
            return ConfidenceTier.HIGH;
        }
        if (score >= mediumThreshold) {
            return ConfidenceTier.MEDIUM;
        }
        return ConfidenceTier.LOW;
    }
}
