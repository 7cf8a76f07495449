package com.example.voiceprint_backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Base type of the speaker identity error taxonomy.
 *
 * <p>Each subtype maps to a fixed HTTP status and a stable reason code (for example
 * {@code PROFILE_NOT_FOUND}); the human readable text is exposed as the problem detail so
 * callers can render it directly.
 */
public abstract class VoiceprintException extends ResponseStatusException {

    private final String code;
    private final String errorText;

    protected VoiceprintException(HttpStatus status, String code, String errorText) {
        this(status, code, errorText, null);
    }

    protected VoiceprintException(HttpStatus status, String code, String errorText, Throwable cause) {
        super(status, code, cause);
        this.code = code;
        this.errorText = errorText;
        getBody().setDetail(errorText);
    }

    public String getCode() {
        return code;
    }

    public String getErrorText() {
        return errorText;
    }
}
