package com.example.voiceprint_backend.exception;

import org.springframework.http.HttpStatus;

import java.util.UUID;

public class NotFoundException extends VoiceprintException {

    public NotFoundException(String code, String errorText) {
        super(HttpStatus.NOT_FOUND, code, errorText);
    }

    public static NotFoundException profile(UUID profileId) {
        return new NotFoundException("PROFILE_NOT_FOUND",
                "speaker profile " + profileId + " does not exist (deleted or already merged)");
    }

    public static NotFoundException speaker(UUID mediaSpeakerId) {
        return new NotFoundException("SPEAKER_NOT_FOUND", "speaker " + mediaSpeakerId + " does not exist");
    }

    public static NotFoundException media(UUID mediaId) {
        return new NotFoundException("MEDIA_NOT_FOUND", "media " + mediaId + " does not exist");
    }
}
