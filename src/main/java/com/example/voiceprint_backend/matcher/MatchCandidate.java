package com.example.voiceprint_backend.matcher;

import java.util.UUID;

/**
 * Scored profile for one query voiceprint.
 *
 * @param profileId      candidate profile.
 * @param profileName    its display name, may be {@code null}.
 * @param score          best similarity over the profile's voiceprints, in [0, 1].
 * @param tier           tier the score falls into.
 * @param rationale      human readable explanation of the score.
 * @param embeddingCount voiceprints compared for this profile.
 */
public record MatchCandidate(UUID profileId,
                             String profileName,
                             double score,
                             ConfidenceTier tier,
                             String rationale,
                             int embeddingCount) {
}
