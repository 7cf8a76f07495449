package com.example.voiceprint_backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Malformed voiceprint: missing, empty, non-finite or zero-norm. Rejected before any matching.
 */
public class InvalidEmbeddingException extends VoiceprintException {

    public InvalidEmbeddingException(String errorText) {
        super(HttpStatus.BAD_REQUEST, "INVALID_EMBEDDING", errorText);
    }
}
