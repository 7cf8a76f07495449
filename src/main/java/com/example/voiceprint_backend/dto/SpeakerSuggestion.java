package com.example.voiceprint_backend.dto;

import com.example.voiceprint_backend.matcher.ConfidenceTier;

import java.util.UUID;

public record SpeakerSuggestion(UUID mediaSpeakerId,
                                String perFileLabel,
                                UUID profileId,
                                String profileName,
                                double score,
                                ConfidenceTier tier,
                                String rationale,
                                boolean autoAccepted) {
}
