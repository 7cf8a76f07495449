package com.example.voiceprint_backend.dto.web;

import com.example.voiceprint_backend.model.SpeakerProfile;
import com.example.voiceprint_backend.util.VerificationState;

import java.time.Instant;
import java.util.UUID;

public record ProfileResponse(UUID id,
                              String displayName,
                              VerificationState verificationState,
                              int embeddingCount,
                              int mediaCount,
                              long segmentCount,
                              long talkTimeMs,
                              Instant createdAt,
                              Instant updatedAt) {

    public static ProfileResponse from(SpeakerProfile p) {
        return new ProfileResponse(p.getId(), p.getDisplayName(), p.getVerificationState(),
                p.getEmbeddingCount(), p.getMediaCount(), p.getSegmentCount(), p.getTalkTimeMs(),
                p.getCreatedAt(), p.getUpdatedAt());
    }
}
