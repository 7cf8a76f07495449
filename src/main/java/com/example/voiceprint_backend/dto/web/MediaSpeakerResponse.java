package com.example.voiceprint_backend.dto.web;

import com.example.voiceprint_backend.util.SpeakerAssignment;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record MediaSpeakerResponse(UUID id,
                                   UUID mediaId,
                                   String perFileLabel,
                                   String displayName,
                                   UUID profileId,
                                   SpeakerAssignment assignment,
                                   String statusText,
                                   BigDecimal confidence,
                                   String rationale,
                                   UUID suggestedProfileId,
                                   Instant verifiedAt) {
}
