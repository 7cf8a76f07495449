package com.example.voiceprint_backend.util;

/**
 * How a per-file speaker got (or did not get) its identity.
 */
public enum SpeakerAssignment {
    AUTO_ACCEPTED,
    PENDING,
    UNASSIGNED,
    VERIFIED;

    public boolean isOutstanding() {
        return this == PENDING || this == UNASSIGNED;
    }
}
