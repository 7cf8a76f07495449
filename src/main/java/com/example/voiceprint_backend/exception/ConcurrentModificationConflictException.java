package com.example.voiceprint_backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Optimistic concurrency check kept failing after the bounded number of internal retries.
 */
public class ConcurrentModificationConflictException extends VoiceprintException {

    public ConcurrentModificationConflictException(String operation, int attempts, Throwable cause) {
        super(HttpStatus.CONFLICT, "CONCURRENT_MODIFICATION",
                operation + " still conflicting after " + attempts + " attempt(s)", cause);
    }
}
