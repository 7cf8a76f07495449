package com.example.voiceprint_backend.util;

/**
 * Why a single source profile could not be absorbed by a merge.
 */
public enum MergeFailureReason {
    /** Source does not exist anymore, e.g. it was already merged away. */
    NOT_FOUND,
    /** Target was absorbed or deleted while the merge was running. */
    PROFILE_GONE,
    /** Optimistic lock kept failing after the configured retries. */
    CONFLICT,
    /** Source belongs to another owner. */
    REJECTED,
    UNEXPECTED
}
