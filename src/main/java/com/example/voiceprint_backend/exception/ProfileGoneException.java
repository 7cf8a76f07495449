package com.example.voiceprint_backend.exception;

import org.springframework.http.HttpStatus;

import java.util.Optional;
import java.util.UUID;

/**
 * Retryable: the profile a write was aimed at was absorbed by a concurrent merge.
 * Callers re-resolve through {@link #getRedirectTarget()} and retry once.
 */
public class ProfileGoneException extends VoiceprintException {

    private final UUID profileId;
    private final UUID redirectTarget;

    public ProfileGoneException(UUID profileId, UUID redirectTarget) {
        super(HttpStatus.CONFLICT, "PROFILE_GONE", redirectTarget == null
                ? "speaker profile " + profileId + " is gone"
                : "speaker profile " + profileId + " was merged into " + redirectTarget);
        this.profileId = profileId;
        this.redirectTarget = redirectTarget;
    }

    public UUID getProfileId() {
        return profileId;
    }

    public Optional<UUID> getRedirectTarget() {
        return Optional.ofNullable(redirectTarget);
    }
}
