package com.example.voiceprint_backend.util;

/**
 * Verification state of a speaker profile.
 */
public enum VerificationState {
    /** Seeded automatically, nobody has looked at it. */
    UNVERIFIED,
    /** At least one high-confidence match was auto-accepted into it. */
    SUGGESTED,
    /** Named or confirmed by the owner. */
    VERIFIED
}
