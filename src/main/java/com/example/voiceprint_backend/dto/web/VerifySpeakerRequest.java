package com.example.voiceprint_backend.dto.web;

import com.example.voiceprint_backend.util.VerifyAction;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

/** {@code profileId} is required for ACCEPT, {@code name} for CREATE_PROFILE. */
public record VerifySpeakerRequest(@NotNull VerifyAction action,
                                   UUID profileId,
                                   @Size(max = 200) String name) {
}
