package com.example.voiceprint_backend.service;

import com.example.voiceprint_backend.config.SpeakerMatchingProperties;
import com.example.voiceprint_backend.exception.InvalidEmbeddingException;
import com.example.voiceprint_backend.exception.ProfileGoneException;
import com.example.voiceprint_backend.matcher.ConfidenceTier;
import com.example.voiceprint_backend.matcher.MatchCandidate;
import com.example.voiceprint_backend.matcher.MatchResult;
import com.example.voiceprint_backend.matcher.SpeakerMatcher;
import com.example.voiceprint_backend.matcher.TierPolicy;
import com.example.voiceprint_backend.model.Account;
import com.example.voiceprint_backend.model.Media;
import com.example.voiceprint_backend.model.MediaSpeaker;
import com.example.voiceprint_backend.model.SpeakerEmbedding;
import com.example.voiceprint_backend.model.SpeakerProfile;
import com.example.voiceprint_backend.repository.MediaRepository;
import com.example.voiceprint_backend.repository.MediaSpeakerRepository;
import com.example.voiceprint_backend.repository.SpeakerEmbeddingRepository;
import com.example.voiceprint_backend.util.SpeakerAssignment;
import com.example.voiceprint_backend.util.VerificationState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SpeakerSuggestionServiceTest {

    private static final float[] VOICE = {0.8f, 0.6f, 0f};

    @Mock
    private SpeakerMatcher matcher;
    @Mock
    private ProfileStore profileStore;
    @Mock
    private SpeakerEmbeddingRepository embeddingRepo;
    @Mock
    private MediaSpeakerRepository speakerRepo;
    @Mock
    private MediaRepository mediaRepo;

    private SpeakerSuggestionService service;
    private Account owner;
    private Media media;
    private SpeakerProfile alice;
    private SpeakerProfile placeholder;

    @BeforeEach
    void setUp() {
        service = new SpeakerSuggestionService(matcher, TierPolicy.defaults(), profileStore,
                embeddingRepo, speakerRepo, mediaRepo, new SpeakerMatchingProperties());
        owner = new Account("owner-1", "Owner");
        owner.setId(UUID.randomUUID());
        media = new Media(owner, "weekly sync");
        media.setId(UUID.randomUUID());
        alice = new SpeakerProfile(owner, "Alice");
        alice.setId(UUID.randomUUID());
        placeholder = new SpeakerProfile(owner, null);
        placeholder.setId(UUID.randomUUID());
    }

    @Test
    void highConfidenceAttachesToTheMatchedProfile() {
        echoSaves();
        rankAs(candidate(alice, 0.91, ConfidenceTier.HIGH));
        when(profileStore.lockResolving(alice.getId())).thenReturn(alice);

        MediaSpeaker speaker = service.classify(media, "SPEAKER_00", VOICE, List.of(), Set.of());

        assertThat(speaker.getAssignment()).isEqualTo(SpeakerAssignment.AUTO_ACCEPTED);
        assertThat(speaker.getDisplayName()).isEqualTo("Alice");
        assertThat(speaker.getConfidence()).isEqualByComparingTo(new BigDecimal("0.9100"));
        assertThat(speaker.getProfile()).isSameAs(alice);
        assertThat(alice.getVerificationState()).isEqualTo(VerificationState.SUGGESTED);
        verify(profileStore, never()).createPlaceholder(any());
    }

    @Test
    void mediumConfidenceSeedsAPlaceholderAndSuggests() {
        echoSaves();
        rankAs(candidate(alice, 0.62, ConfidenceTier.MEDIUM));
        when(profileStore.createPlaceholder(owner)).thenReturn(placeholder);
        when(profileStore.findLive(alice.getId())).thenReturn(Optional.of(alice));

        MediaSpeaker speaker = service.classify(media, "SPEAKER_01", VOICE, List.of(), Set.of());

        assertThat(speaker.getAssignment()).isEqualTo(SpeakerAssignment.PENDING);
        assertThat(speaker.getProfile()).isSameAs(placeholder);
        assertThat(speaker.getSuggestedProfile()).isSameAs(alice);
        assertThat(speaker.getDisplayName()).isNull();
        assertThat(speaker.effectiveName()).isEqualTo("SPEAKER_01");
    }

    @Test
    void lowConfidenceLeavesTheSpeakerUnassigned() {
        echoSaves();
        rankAs(candidate(alice, 0.31, ConfidenceTier.LOW));
        when(profileStore.createPlaceholder(owner)).thenReturn(placeholder);

        MediaSpeaker speaker = service.classify(media, "SPEAKER_02", VOICE, List.of(), Set.of());

        assertThat(speaker.getAssignment()).isEqualTo(SpeakerAssignment.UNASSIGNED);
        assertThat(speaker.getProfile()).isSameAs(placeholder);
        assertThat(speaker.getSuggestedProfile()).isNull();
    }

    @Test
    void profileAlreadyPresentInTheSameMediaIsOnlySuggested() {
        echoSaves();
        rankAs(candidate(alice, 0.97, ConfidenceTier.HIGH));
        when(profileStore.createPlaceholder(owner)).thenReturn(placeholder);
        when(profileStore.findLive(alice.getId())).thenReturn(Optional.of(alice));

        MediaSpeaker speaker = service.classify(media, "SPEAKER_03", VOICE, List.of(), Set.of(alice.getId()));

        assertThat(speaker.getAssignment()).isEqualTo(SpeakerAssignment.PENDING);
        assertThat(speaker.getSuggestedProfile()).isSameAs(alice);
        verify(profileStore, never()).lockResolving(any());
    }

    @Test
    void targetMergedAwayWithoutRedirectFallsBackToUnassigned() {
        echoSaves();
        rankAs(candidate(alice, 0.88, ConfidenceTier.HIGH));
        when(profileStore.lockResolving(alice.getId())).thenThrow(new ProfileGoneException(alice.getId(), null));
        when(profileStore.createPlaceholder(owner)).thenReturn(placeholder);
        when(profileStore.findLive(alice.getId())).thenReturn(Optional.empty());

        MediaSpeaker speaker = service.classify(media, "SPEAKER_04", VOICE, List.of(), Set.of());

        assertThat(speaker.getAssignment()).isEqualTo(SpeakerAssignment.UNASSIGNED);
        assertThat(speaker.getProfile()).isSameAs(placeholder);
    }

    @Test
    void matcherFailureDegradesToNoSuggestion() {
        echoSaves();
        when(matcher.rank(any(), anyList(), any())).thenThrow(new IllegalStateException("index offline"));
        when(profileStore.createPlaceholder(owner)).thenReturn(placeholder);

        MediaSpeaker speaker = service.classify(media, "SPEAKER_05", VOICE, List.of(), Set.of());

        assertThat(speaker.getAssignment()).isEqualTo(SpeakerAssignment.UNASSIGNED);
    }

    @Test
    void invalidVoiceprintIsNotSwallowed() {
        when(matcher.rank(any(), anyList(), any())).thenThrow(new InvalidEmbeddingException("embedding has zero norm"));

        assertThatThrownBy(() -> service.rankSafely(new float[]{0f, 0f}, List.of()))
                .isInstanceOf(InvalidEmbeddingException.class);
    }

    @Test
    void redeliveredLabelReturnsTheStoredSpeaker() {
        SpeakerEmbedding stored = new SpeakerEmbedding(media, "SPEAKER_00", VOICE, alice);
        MediaSpeaker existing = new MediaSpeaker(stored);
        existing.markVerified("Alice", null);
        when(embeddingRepo.findByMediaAndSpeakerLabel(media, "SPEAKER_00")).thenReturn(Optional.of(stored));
        when(speakerRepo.findByEmbedding(stored)).thenReturn(Optional.of(existing));

        MediaSpeaker speaker = service.classify(media, "SPEAKER_00", new float[]{0f, 1f, 0f}, List.of(), Set.of());

        assertThat(speaker).isSameAs(existing);
        assertThat(speaker.getAssignment()).isEqualTo(SpeakerAssignment.VERIFIED);
        verify(matcher, never()).rank(any(), anyList(), any());
        verify(embeddingRepo, never()).save(any());
    }

    @Test
    void confidenceIsRoundedToFourDecimals() {
        assertThat(SpeakerSuggestionService.confidence(0.123456)).isEqualByComparingTo("0.1235");
        assertThat(SpeakerSuggestionService.confidence(1.0).scale()).isEqualTo(4);
    }

    private void echoSaves() {
        when(embeddingRepo.findByMediaAndSpeakerLabel(any(), any())).thenReturn(Optional.empty());
        when(embeddingRepo.save(any(SpeakerEmbedding.class))).thenAnswer(inv -> inv.getArgument(0));
        when(speakerRepo.save(any(MediaSpeaker.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private void rankAs(MatchCandidate best) {
        when(matcher.rank(any(), anyList(), any())).thenReturn(new MatchResult(List.of(best), false, 1));
    }

    private static MatchCandidate candidate(SpeakerProfile profile, double score, ConfidenceTier tier) {
        return new MatchCandidate(profile.getId(), profile.getDisplayName(), score, tier,
                String.format("best match %.3f across 1 voiceprint(s) in 1 media item(s)", score), 1);
    }
}
