package com.example.voiceprint_backend.dto.web;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record MediaCreateRequest(@NotBlank String ownerExternalSubject,
                                 @Size(max = 512) String title,
                                 @Size(max = 1024) String objectKey,
                                 @PositiveOrZero Long durationMs) {
}
