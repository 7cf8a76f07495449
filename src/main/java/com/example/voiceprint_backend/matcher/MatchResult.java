package com.example.voiceprint_backend.matcher;

import java.util.List;
import java.util.Optional;

/**
 * Ranking produced by a {@link SpeakerMatcher}.
 *
 * @param candidates      candidates by descending score.
 * @param truncated       {@code true} when the scan stopped at its deadline.
 * @param profilesScanned profiles visited before returning.
 */
public record MatchResult(List<MatchCandidate> candidates, boolean truncated, int profilesScanned) {

    public MatchResult {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static MatchResult empty() {
        return new MatchResult(List.of(), false, 0);
    }

    public Optional<MatchCandidate> best() {
        return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(0));
    }

    /** Candidates scoring at least medium confidence, at most {@code limit} of them. */
    public List<MatchCandidate> suggestions(int limit) {
        return candidates.stream()
                .filter(c -> c.tier() != ConfidenceTier.LOW)
                .limit(Math.max(0, limit))
                .toList();
    }
}
