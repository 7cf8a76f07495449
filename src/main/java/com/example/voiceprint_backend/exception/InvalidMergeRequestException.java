package com.example.voiceprint_backend.exception;

import org.springframework.http.HttpStatus;

public class InvalidMergeRequestException extends VoiceprintException {

    public InvalidMergeRequestException(String errorText) {
        super(HttpStatus.BAD_REQUEST, "INVALID_MERGE_REQUEST", errorText);
    }
}
