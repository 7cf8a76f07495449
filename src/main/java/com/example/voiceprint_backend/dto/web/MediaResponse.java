package com.example.voiceprint_backend.dto.web;

import java.time.Instant;
import java.util.UUID;

public record MediaResponse(UUID id, UUID ownerId, String title, String objectKey, Long durationMs,
                            String status, Integer speakerCountDetected, Instant createdAt) {
}
