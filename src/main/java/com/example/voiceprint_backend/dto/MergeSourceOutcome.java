package com.example.voiceprint_backend.dto;

import com.example.voiceprint_backend.util.MergeFailureReason;

import java.util.UUID;

public record MergeSourceOutcome(UUID profileId,
                                 boolean succeeded,
                                 String profileName,
                                 int movedEmbeddings,
                                 int movedSegments,
                                 MergeFailureReason reason,
                                 String error) {

    public static MergeSourceOutcome success(UUID profileId, String profileName, int movedEmbeddings, int movedSegments) {
        return new MergeSourceOutcome(profileId, true, profileName, movedEmbeddings, movedSegments, null, null);
    }

    public static MergeSourceOutcome failure(UUID profileId, MergeFailureReason reason, String error) {
        return new MergeSourceOutcome(profileId, false, null, 0, 0, reason, error);
    }
}
