package com.example.voiceprint_backend.service;

import com.example.voiceprint_backend.dto.RetroactiveLabelingReport;
import com.example.voiceprint_backend.exception.NotFoundException;
import com.example.voiceprint_backend.matcher.ConfidenceTier;
import com.example.voiceprint_backend.matcher.MatchCandidate;
import com.example.voiceprint_backend.matcher.ProfileVoiceprints;
import com.example.voiceprint_backend.model.MediaSpeaker;
import com.example.voiceprint_backend.model.SpeakerProfile;
import com.example.voiceprint_backend.repository.MediaSpeakerRepository;
import com.example.voiceprint_backend.repository.SpeakerEmbeddingRepository;
import com.example.voiceprint_backend.repository.SpeakerProfileRepository;
import com.example.voiceprint_backend.util.SpeakerAssignment;
import com.example.voiceprint_backend.util.VerificationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Propagates a newly entered name: every outstanding speaker of the owner is scored against
 * the named profile alone and attached or suggested according to the tier policy.
 */
@Service
public class RetroactiveLabelingService {
    private static final Logger LOGGER = LoggerFactory.getLogger(RetroactiveLabelingService.class);

    private final SpeakerProfileRepository profileRepo;
    private final SpeakerEmbeddingRepository embeddingRepo;
    private final MediaSpeakerRepository speakerRepo;
    private final ProfileStore profileStore;
    private final SpeakerSuggestionService suggestionService;
    private final ConflictRetrier retrier;

    public RetroactiveLabelingService(SpeakerProfileRepository profileRepo,
                                      SpeakerEmbeddingRepository embeddingRepo,
                                      MediaSpeakerRepository speakerRepo,
                                      ProfileStore profileStore,
                                      SpeakerSuggestionService suggestionService,
                                      ConflictRetrier retrier) {
        this.profileRepo = profileRepo;
        this.embeddingRepo = embeddingRepo;
        this.speakerRepo = speakerRepo;
        this.profileStore = profileStore;
        this.suggestionService = suggestionService;
        this.retrier = retrier;
    }

    private enum Outcome { APPLIED, SUGGESTED, UNCHANGED }

    private record Named(UUID ownerId, ProfileVoiceprints voiceprints) {}

    public RetroactiveLabelingReport relabel(UUID profileId) {
        Optional<Named> named = retrier.inTransaction("relabel-load " + profileId, () -> {
            SpeakerProfile profile = profileRepo.findByIdWithOwner(profileId)
                    .orElseThrow(() -> NotFoundException.profile(profileId));
            if (!profile.isNamed()) {
                return Optional.<Named>empty();
            }
            return profileStore.snapshotOf(profileId)
                    .map(v -> new Named(profile.getOwner().getId(), v));
        });
        if (named.isEmpty()) {
            return RetroactiveLabelingReport.empty(profileId);
        }
        UUID ownerId = named.get().ownerId();
        ProfileVoiceprints candidate = named.get().voiceprints();

        List<UUID> outstanding = retrier.inTransaction("relabel-scan " + profileId, () ->
                speakerRepo.findIdsByOwnerAndAssignmentIn(ownerId,
                        EnumSet.of(SpeakerAssignment.PENDING, SpeakerAssignment.UNASSIGNED)));

        int applied = 0;
        int suggested = 0;
        int unchanged = 0;
        List<String> failures = new ArrayList<>();
        for (UUID speakerId : outstanding) {
            try {
                Outcome outcome = retrier.inTransaction("relabel " + speakerId,
                        () -> relabelOne(speakerId, profileId, candidate));
                switch (outcome) {
                    case APPLIED -> applied++;
                    case SUGGESTED -> suggested++;
                    case UNCHANGED -> unchanged++;
                }
            } catch (RuntimeException e) {
                LOGGER.warn("RELABEL speaker failed speaker={} profile={}: {}", speakerId, profileId, e.toString());
                failures.add(speakerId + ": " + e.getMessage());
            }
        }
        LOGGER.info("RELABEL done profile={} scanned={} applied={} suggested={} unchanged={} failed={}",
                profileId, outstanding.size(), applied, suggested, unchanged, failures.size());
        return new RetroactiveLabelingReport(profileId, outstanding.size(), applied, suggested, unchanged, List.copyOf(failures));
    }

    private Outcome relabelOne(UUID speakerId, UUID profileId, ProfileVoiceprints candidate) {
        Optional<MediaSpeaker> found = speakerRepo.findByIdWithEmbedding(speakerId);
        if (found.isEmpty()) {
            return Outcome.UNCHANGED;
        }
        MediaSpeaker speaker = found.get();
        // a human decision made while the batch was running wins
        if (!speaker.getAssignment().isOutstanding() || speaker.getProfile().getId().equals(profileId)) {
            return Outcome.UNCHANGED;
        }
        // voiceprints in a named or confirmed profile stay where they are
        SpeakerProfile home = speaker.getProfile();
        if (home.isNamed() || home.getVerificationState() == VerificationState.VERIFIED) {
            return Outcome.UNCHANGED;
        }
        Optional<MatchCandidate> ranked = suggestionService
                .rankSafely(speaker.getEmbedding().getVector(), List.of(candidate))
                .best();
        if (ranked.isEmpty() || ranked.get().tier() == ConfidenceTier.LOW) {
            return Outcome.UNCHANGED;
        }
        MatchCandidate best = ranked.get();
        boolean sameMedia = embeddingRepo.existsByProfileIdAndMediaId(profileId, speaker.getMedia().getId());

        if (best.tier() == ConfidenceTier.HIGH && !sameMedia) {
            SpeakerProfile target = profileStore.lockResolving(profileId);
            SpeakerProfile former = speaker.getProfile();
            profileStore.moveEmbedding(speaker, target);
            speaker.markAutoAccepted(target.getDisplayName(), SpeakerSuggestionService.confidence(best.score()), best.rationale());
            profileStore.retireIfEmpty(former, target);
            profileStore.recomputeStats(target);
            LOGGER.info("RELABEL applied speaker={} profile={} score={}", speakerId, target.getId(), best.score());
            return Outcome.APPLIED;
        }

        SpeakerProfile current = speaker.getSuggestedProfile();
        boolean replace = current == null
                || current.getId().equals(profileId)
                || speaker.getConfidence() == null
                || best.score() > speaker.getConfidence().doubleValue();
        if (!replace) {
            return Outcome.UNCHANGED;
        }
        SpeakerProfile target = profileStore.findLive(profileId).orElseThrow(() -> NotFoundException.profile(profileId));
        speaker.markPending(target, SpeakerSuggestionService.confidence(best.score()), best.rationale());
        LOGGER.debug("RELABEL suggested speaker={} profile={} score={}", speakerId, target.getId(), best.score());
        return Outcome.SUGGESTED;
    }
}
