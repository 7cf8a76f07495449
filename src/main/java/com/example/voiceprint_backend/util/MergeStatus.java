package com.example.voiceprint_backend.util;

public enum MergeStatus {
    ALL_SUCCEEDED,
    ALL_FAILED,
    PARTIAL
}
