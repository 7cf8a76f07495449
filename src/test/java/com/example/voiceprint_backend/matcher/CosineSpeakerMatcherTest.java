package com.example.voiceprint_backend.matcher;

import com.example.voiceprint_backend.exception.InvalidEmbeddingException;
import com.example.voiceprint_backend.util.VerificationState;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CosineSpeakerMatcherTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);

    private final CosineSpeakerMatcher matcher =
            new CosineSpeakerMatcher(SimilarityMetric.SHIFTED_COSINE, Duration.ofSeconds(5), Duration.ofMillis(1), FIXED);

    @Test
    void ranksProfilesByBestVoiceprintDescending() {
        ProfileVoiceprints same = profile("Alice", new float[]{1f, 0f});
        ProfileVoiceprints orthogonal = profile("Bob", new float[]{0f, 1f});
        ProfileVoiceprints opposite = profile(null, new float[]{-1f, 0f});

        MatchResult result = matcher.rank(new float[]{1f, 0f}, List.of(opposite, orthogonal, same), TierPolicy.defaults());

        assertThat(result.truncated()).isFalse();
        assertThat(result.candidates()).extracting(MatchCandidate::profileId)
                .containsExactly(same.profileId(), orthogonal.profileId(), opposite.profileId());
        assertThat(result.candidates().get(0).score()).isCloseTo(1.0, within(1e-9));
        assertThat(result.candidates().get(0).tier()).isEqualTo(ConfidenceTier.HIGH);
        assertThat(result.candidates().get(1).score()).isCloseTo(0.5, within(1e-9));
        assertThat(result.candidates().get(1).tier()).isEqualTo(ConfidenceTier.MEDIUM);
        assertThat(result.candidates().get(2).score()).isCloseTo(0.0, within(1e-9));
        assertThat(result.candidates().get(2).tier()).isEqualTo(ConfidenceTier.LOW);
    }

    @Test
    void profileScoreDoesNotDependOnVoiceprintOrder() {
        List<Voiceprint> voiceprints = new ArrayList<>(List.of(
                voiceprint(new float[]{0.2f, 0.9f, 0.1f}),
                voiceprint(new float[]{0.9f, 0.1f, 0.3f}),
                voiceprint(new float[]{-0.5f, 0.5f, 0.5f})));
        UUID profileId = UUID.randomUUID();
        float[] query = {1f, 0.2f, 0.2f};

        ProfileVoiceprints forward = new ProfileVoiceprints(profileId, "P", VerificationState.UNVERIFIED, voiceprints);
        List<Voiceprint> reversed = new ArrayList<>(voiceprints);
        Collections.reverse(reversed);
        ProfileVoiceprints backward = new ProfileVoiceprints(profileId, "P", VerificationState.UNVERIFIED, reversed);

        double a = matcher.rank(query, List.of(forward), TierPolicy.defaults()).best().orElseThrow().score();
        double b = matcher.rank(query, List.of(backward), TierPolicy.defaults()).best().orElseThrow().score();

        assertThat(a).isEqualTo(b);
    }

    @Test
    void emptyStoreYieldsEmptyResult() {
        MatchResult result = matcher.rank(new float[]{1f, 2f}, List.of(), TierPolicy.defaults());

        assertThat(result.candidates()).isEmpty();
        assertThat(result.best()).isEmpty();
    }

    @Test
    void rejectsUnusableQueries() {
        List<ProfileVoiceprints> store = List.of(profile("A", new float[]{1f, 0f}));

        assertThatThrownBy(() -> matcher.rank(null, store, TierPolicy.defaults()))
                .isInstanceOf(InvalidEmbeddingException.class);
        assertThatThrownBy(() -> matcher.rank(new float[0], store, TierPolicy.defaults()))
                .isInstanceOf(InvalidEmbeddingException.class);
        assertThatThrownBy(() -> matcher.rank(new float[]{0f, 0f}, store, TierPolicy.defaults()))
                .isInstanceOf(InvalidEmbeddingException.class);
        assertThatThrownBy(() -> matcher.rank(new float[]{Float.NaN, 1f}, store, TierPolicy.defaults()))
                .isInstanceOf(InvalidEmbeddingException.class);
    }

    @Test
    void skipsVoiceprintsOfAnotherDimension() {
        ProfileVoiceprints mixed = new ProfileVoiceprints(UUID.randomUUID(), "Mixed", VerificationState.VERIFIED,
                List.of(voiceprint(new float[]{1f, 0f, 0f}), voiceprint(new float[]{0f, 1f})));
        ProfileVoiceprints foreign = profile("Foreign", new float[]{1f, 0f, 0f});

        MatchResult result = matcher.rank(new float[]{0f, 1f}, List.of(mixed, foreign), TierPolicy.defaults());

        assertThat(result.candidates()).hasSize(1);
        MatchCandidate only = result.candidates().get(0);
        assertThat(only.profileId()).isEqualTo(mixed.profileId());
        assertThat(only.embeddingCount()).isEqualTo(1);
        assertThat(only.score()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void stopsAtDeadlineAndReturnsPartialRanking() {
        CosineSpeakerMatcher slow = new CosineSpeakerMatcher(SimilarityMetric.SHIFTED_COSINE,
                Duration.ofMillis(1500), Duration.ZERO, new TickingClock(Duration.ofSeconds(1)));
        List<ProfileVoiceprints> store = List.of(
                profile("A", new float[]{1f, 0f}),
                profile("B", new float[]{0f, 1f}),
                profile("C", new float[]{1f, 1f}));

        MatchResult result = slow.rank(new float[]{1f, 0f}, store, TierPolicy.defaults());

        assertThat(result.truncated()).isTrue();
        assertThat(result.profilesScanned()).isEqualTo(1);
        assertThat(result.candidates()).extracting(MatchCandidate::profileName).containsExactly("A");
    }

    @Test
    void budgetGrowsWithProfileCount() {
        assertThat(matcher.budgetFor(0)).isEqualTo(Duration.ofSeconds(5));
        assertThat(matcher.budgetFor(1000)).isEqualTo(Duration.ofSeconds(6));
    }

    @Test
    void rationaleNamesScoreVoiceprintsAndMedia() {
        UUID media = UUID.randomUUID();
        ProfileVoiceprints p = new ProfileVoiceprints(UUID.randomUUID(), "Alice", VerificationState.VERIFIED, List.of(
                new Voiceprint(UUID.randomUUID(), media, new float[]{1f, 0f}),
                new Voiceprint(UUID.randomUUID(), media, new float[]{0f, 1f}),
                new Voiceprint(UUID.randomUUID(), UUID.randomUUID(), new float[]{-1f, 0f})));

        MatchCandidate c = matcher.rank(new float[]{1f, 0f}, List.of(p), TierPolicy.defaults()).best().orElseThrow();

        assertThat(c.rationale()).isEqualTo("best match 1.000 across 3 voiceprint(s) in 2 media item(s)");
    }

    @Test
    void clampedMetricFloorsOrthogonalVoices() {
        CosineSpeakerMatcher clamped = new CosineSpeakerMatcher(SimilarityMetric.CLAMPED_COSINE,
                Duration.ofSeconds(5), Duration.ZERO, FIXED);

        MatchCandidate c = clamped.rank(new float[]{1f, 0f}, List.of(profile("B", new float[]{0f, 1f})),
                TierPolicy.defaults()).best().orElseThrow();

        assertThat(c.score()).isEqualTo(0.0);
        assertThat(c.tier()).isEqualTo(ConfidenceTier.LOW);
    }

    private static ProfileVoiceprints profile(String name, float[] vector) {
        return new ProfileVoiceprints(UUID.randomUUID(), name, VerificationState.UNVERIFIED, List.of(voiceprint(vector)));
    }

    private static Voiceprint voiceprint(float[] vector) {
        return new Voiceprint(UUID.randomUUID(), UUID.randomUUID(), vector);
    }

    /** Advances by a fixed step every time it is read. */
    private static final class TickingClock extends Clock {
        private final Duration step;
        private Instant now = Instant.parse("2025-01-01T00:00:00Z");

        TickingClock(Duration step) {
            this.step = step;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            Instant current = now;
            now = now.plus(step);
            return current;
        }
    }
}
