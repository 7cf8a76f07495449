package com.example.voiceprint_backend.service;

import com.example.voiceprint_backend.config.SpeakerMatchingProperties;
import com.example.voiceprint_backend.dto.SpeakerSuggestion;
import com.example.voiceprint_backend.exception.InvalidEmbeddingException;
import com.example.voiceprint_backend.exception.NotFoundException;
import com.example.voiceprint_backend.exception.ProfileGoneException;
import com.example.voiceprint_backend.matcher.ConfidenceTier;
import com.example.voiceprint_backend.matcher.MatchCandidate;
import com.example.voiceprint_backend.matcher.MatchResult;
import com.example.voiceprint_backend.matcher.ProfileVoiceprints;
import com.example.voiceprint_backend.matcher.SpeakerMatcher;
import com.example.voiceprint_backend.matcher.TierPolicy;
import com.example.voiceprint_backend.model.Media;
import com.example.voiceprint_backend.model.MediaSpeaker;
import com.example.voiceprint_backend.model.SpeakerEmbedding;
import com.example.voiceprint_backend.model.SpeakerProfile;
import com.example.voiceprint_backend.repository.MediaRepository;
import com.example.voiceprint_backend.repository.MediaSpeakerRepository;
import com.example.voiceprint_backend.repository.SpeakerEmbeddingRepository;
import com.example.voiceprint_backend.util.SpeakerAssignment;
import com.example.voiceprint_backend.util.VerificationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Classifies new voiceprints against the owner's profiles and applies the tier policy:
 * high confidence attaches, medium confidence suggests, low confidence seeds a new profile.
 */
@Service
public class SpeakerSuggestionService {
    private static final Logger LOGGER = LoggerFactory.getLogger(SpeakerSuggestionService.class);

    private final SpeakerMatcher matcher;
    private final TierPolicy tierPolicy;
    private final ProfileStore profileStore;
    private final SpeakerEmbeddingRepository embeddingRepo;
    private final MediaSpeakerRepository speakerRepo;
    private final MediaRepository mediaRepo;
    private final int alternativesLimit;

    public SpeakerSuggestionService(SpeakerMatcher matcher,
                                    TierPolicy tierPolicy,
                                    ProfileStore profileStore,
                                    SpeakerEmbeddingRepository embeddingRepo,
                                    MediaSpeakerRepository speakerRepo,
                                    MediaRepository mediaRepo,
                                    SpeakerMatchingProperties props) {
        this.matcher = matcher;
        this.tierPolicy = tierPolicy;
        this.profileStore = profileStore;
        this.embeddingRepo = embeddingRepo;
        this.speakerRepo = speakerRepo;
        this.mediaRepo = mediaRepo;
        this.alternativesLimit = props.getAlternativesLimit();
    }

    public TierPolicy tierPolicy() {
        return tierPolicy;
    }

    /**
     * Ranks a voiceprint without letting matcher trouble escape: anything but an invalid
     * query degrades to an empty ranking.
     */
    public MatchResult rankSafely(float[] vector, List<ProfileVoiceprints> snapshot) {
        try {
            MatchResult result = matcher.rank(vector, snapshot, tierPolicy);
            if (result.truncated()) {
                LOGGER.warn("SUGGEST partial ranking scanned={} of={}", result.profilesScanned(), snapshot.size());
            }
            return result;
        } catch (InvalidEmbeddingException e) {
            throw e;
        } catch (RuntimeException e) {
            LOGGER.warn("SUGGEST matcher failed, no suggestion: {}", e.toString());
            return MatchResult.empty();
        }
    }

    /**
     * Stores the voiceprint of one diarized label and classifies it. Re-delivering an already
     * stored {@code (media, label)} returns the existing speaker untouched.
     *
     * @param claimedInMedia profiles that already own a voiceprint of this media item; never auto-attached again.
     */
    public MediaSpeaker classify(Media media, String label, float[] vector,
                                 List<ProfileVoiceprints> snapshot, Set<UUID> claimedInMedia) {
        Optional<SpeakerEmbedding> existing = embeddingRepo.findByMediaAndSpeakerLabel(media, label);
        if (existing.isPresent()) {
            LOGGER.debug("SUGGEST skip media={} label={} already stored", media.getId(), label);
            return speakerRepo.findByEmbedding(existing.get())
                    .orElseGet(() -> speakerRepo.save(unassignedSpeaker(existing.get())));
        }

        MatchResult ranking = rankSafely(vector, snapshot);
        MatchCandidate best = ranking.best().orElse(null);

        if (best != null && best.tier() == ConfidenceTier.HIGH && !claimedInMedia.contains(best.profileId())) {
            MediaSpeaker attached = tryAttach(media, label, vector, best, claimedInMedia);
            if (attached != null) {
                return attached;
            }
        }

        SpeakerProfile placeholder = profileStore.createPlaceholder(media.getOwner());
        SpeakerEmbedding embedding = embeddingRepo.save(new SpeakerEmbedding(media, label, vector, placeholder));
        MediaSpeaker speaker = new MediaSpeaker(embedding);

        SpeakerProfile suggested = best == null || best.tier() == ConfidenceTier.LOW
                ? null
                : profileStore.findLive(best.profileId()).orElse(null);
        if (suggested != null) {
            speaker.markPending(suggested, confidence(best.score()), best.rationale());
            LOGGER.info("SUGGEST pending media={} label={} profile={} score={}",
                    media.getId(), label, suggested.getId(), best.score());
        } else {
            speaker.markUnassigned();
            LOGGER.info("SUGGEST unassigned media={} label={} placeholder={}", media.getId(), label, placeholder.getId());
        }
        return speakerRepo.save(speaker);
    }

    private MediaSpeaker tryAttach(Media media, String label, float[] vector,
                                   MatchCandidate best, Set<UUID> claimedInMedia) {
        SpeakerProfile target;
        try {
            target = profileStore.lockResolving(best.profileId());
        } catch (ProfileGoneException gone) {
            LOGGER.warn("SUGGEST attach target gone profile={} media={} label={}", best.profileId(), media.getId(), label);
            return null;
        }
        if (!target.isOwnedBy(media.getOwner()) || claimedInMedia.contains(target.getId())) {
            return null;
        }
        SpeakerEmbedding embedding = embeddingRepo.save(new SpeakerEmbedding(media, label, vector, target));
        MediaSpeaker speaker = new MediaSpeaker(embedding);
        speaker.markAutoAccepted(target.getDisplayName(), confidence(best.score()), best.rationale());
        if (target.getVerificationState() == VerificationState.UNVERIFIED) {
            target.setVerificationState(VerificationState.SUGGESTED);
        }
        LOGGER.info("SUGGEST auto-accepted media={} label={} profile={} score={}",
                media.getId(), label, target.getId(), best.score());
        return speakerRepo.save(speaker);
    }

    private static MediaSpeaker unassignedSpeaker(SpeakerEmbedding embedding) {
        MediaSpeaker speaker = new MediaSpeaker(embedding);
        speaker.markUnassigned();
        return speaker;
    }

    /**
     * Live suggestions for every speaker of a media item. Auto-accepted speakers report their
     * current profile first; verified speakers report nothing.
     */
    @Transactional(readOnly = true)
    public List<SpeakerSuggestion> listSuggestions(String ownerExternalSubject, UUID mediaId) {
        Media media = mediaRepo.findByIdWithOwner(mediaId).orElseThrow(() -> NotFoundException.media(mediaId));
        if (!media.getOwner().getExternalSubject().equals(ownerExternalSubject)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "MEDIA_NOT_OWNED");
        }
        List<ProfileVoiceprints> snapshot = profileStore.snapshot(media.getOwner().getId());
        List<SpeakerSuggestion> out = new ArrayList<>();
        for (MediaSpeaker speaker : speakerRepo.findByMediaOrderBySpeakerLabelAsc(media)) {
            if (speaker.getAssignment() == SpeakerAssignment.VERIFIED) {
                continue;
            }
            SpeakerProfile own = speaker.getProfile();
            if (speaker.getAssignment() == SpeakerAssignment.AUTO_ACCEPTED) {
                double score = speaker.getConfidence() == null ? 1.0 : speaker.getConfidence().doubleValue();
                out.add(new SpeakerSuggestion(speaker.getId(), speaker.getSpeakerLabel(), own.getId(),
                        own.getDisplayName(), score, tierPolicy.classify(score), speaker.getRationale(), true));
            }
            List<ProfileVoiceprints> others = snapshot.stream()
                    .filter(p -> !p.profileId().equals(own.getId()))
                    .toList();
            MatchResult ranking = rankSafely(speaker.getEmbedding().getVector(), others);
            for (MatchCandidate c : ranking.suggestions(alternativesLimit)) {
                out.add(new SpeakerSuggestion(speaker.getId(), speaker.getSpeakerLabel(), c.profileId(),
                        c.profileName(), c.score(), c.tier(), c.rationale(), false));
            }
        }
        return out;
    }

    static BigDecimal confidence(double score) {
        return BigDecimal.valueOf(score).setScale(4, RoundingMode.HALF_UP);
    }
}
