package com.example.voiceprint_backend.exception;

/**
 * Failure talking to the external diarization service.
 */
public class DiarizationException extends RuntimeException {

    public DiarizationException(String message) {
        super(message);
    }

    public DiarizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
