package com.example.voiceprint_backend.matcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Exhaustive best-case matcher: a profile scores the maximum similarity over its voiceprints.
 * The scan has a deadline of {@code baseTimeout + perProfileTimeout * profiles}.
 */
public class CosineSpeakerMatcher implements SpeakerMatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(CosineSpeakerMatcher.class);

    private static final Comparator<MatchCandidate> RANKING = Comparator
            .comparingDouble(MatchCandidate::score).reversed()
            .thenComparing(MatchCandidate::profileId);

    private final SimilarityMetric metric;
    private final Duration baseTimeout;
    private final Duration perProfileTimeout;
    private final Clock clock;

    public CosineSpeakerMatcher(SimilarityMetric metric, Duration baseTimeout, Duration perProfileTimeout, Clock clock) {
        this.metric = metric;
        this.baseTimeout = baseTimeout;
        this.perProfileTimeout = perProfileTimeout;
        this.clock = clock;
    }

    @Override
    public MatchResult rank(float[] query, List<ProfileVoiceprints> profiles, TierPolicy policy) {
        Voiceprints.validate(query);
        if (profiles == null || profiles.isEmpty()) {
            return MatchResult.empty();
        }
        TierPolicy effective = policy == null ? TierPolicy.defaults() : policy;
        long deadline = clock.millis() + budgetFor(profiles.size()).toMillis();

        List<MatchCandidate> ranked = new ArrayList<>();
        boolean truncated = false;
        int scanned = 0;
        for (ProfileVoiceprints profile : profiles) {
            if (clock.millis() > deadline) {
                truncated = true;
                LOGGER.warn("matcher deadline hit scanned={} total={} metric={}", scanned, profiles.size(), metric);
                break;
            }
            scanned++;
            MatchCandidate candidate = score(query, profile, effective);
            if (candidate != null) {
                ranked.add(candidate);
            }
        }
        ranked.sort(RANKING);
        LOGGER.debug("matcher ranked profiles={} candidates={} truncated={} top={}",
                profiles.size(), ranked.size(), truncated,
                ranked.isEmpty() ? "-" : String.format(Locale.ROOT, "%.3f", ranked.get(0).score()));
        return new MatchResult(ranked, truncated, scanned);
    }

    Duration budgetFor(int profileCount) {
        return baseTimeout.plus(perProfileTimeout.multipliedBy(profileCount));
    }

    private MatchCandidate score(float[] query, ProfileVoiceprints profile, TierPolicy policy) {
        double best = -1.0;
        int compared = 0;
        Set<Object> media = new HashSet<>();
        for (Voiceprint voiceprint : profile.voiceprints()) {
            float[] vector = voiceprint.vector();
            if (vector == null || vector.length != query.length) {
                LOGGER.debug("matcher skip embedding={} profile={} dimension={} expected={}",
                        voiceprint.embeddingId(), profile.profileId(),
                        vector == null ? 0 : vector.length, query.length);
                continue;
            }
            compared++;
            media.add(voiceprint.mediaId());
            best = Math.max(best, metric.similarity(query, vector));
        }
        if (compared == 0) {
            return null;
        }
        String rationale = String.format(Locale.ROOT, "best match %.3f across %d voiceprint(s) in %d media item(s)",
                best, compared, media.size());
        LOGGER.trace("matcher profile={} score={} compared={}", profile.profileId(), best, compared);
        return new MatchCandidate(profile.profileId(), profile.displayName(), best, policy.classify(best), rationale, compared);
    }
}
