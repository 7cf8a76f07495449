package com.example.voiceprint_backend.matcher;

/**
 * Confidence band a similarity score falls into.
 */
public enum ConfidenceTier {
    /** Attached automatically. */
    HIGH,
    /** Suggested, waits for a human. */
    MEDIUM,
    /** No suggestion. */
    LOW
}
