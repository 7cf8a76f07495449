package com.example.voiceprint_backend.util;

public enum MediaStatus {
    REGISTERED,
    DIARIZING,
    DIARIZED,
    FAILED
}
