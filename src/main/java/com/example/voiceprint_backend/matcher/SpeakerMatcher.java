package com.example.voiceprint_backend.matcher;

import java.util.List;

/**
 * Ranks stored speaker profiles against a query voiceprint.
 */
public interface SpeakerMatcher {
    /**
     * Scores every profile by the best similarity among its voiceprints.
     *
     * @param query    voiceprint to match.
     * @param profiles candidate snapshot, usually every profile of one owner.
     * @param policy   tier thresholds used to label each candidate.
     * @return candidates ordered by descending score; partial when the deadline was hit.
     * @throws com.example.voiceprint_backend.exception.InvalidEmbeddingException when the query is unusable.
     */
    MatchResult rank(float[] query, List<ProfileVoiceprints> profiles, TierPolicy policy);
}
