package com.example.voiceprint_backend.service;

import com.example.voiceprint_backend.exception.ProfileGoneException;
import com.example.voiceprint_backend.matcher.ProfileVoiceprints;
import com.example.voiceprint_backend.matcher.Voiceprint;
import com.example.voiceprint_backend.model.Account;
import com.example.voiceprint_backend.model.MediaSpeaker;
import com.example.voiceprint_backend.model.ProfileRedirect;
import com.example.voiceprint_backend.model.SpeakerEmbedding;
import com.example.voiceprint_backend.model.SpeakerProfile;
import com.example.voiceprint_backend.repository.MediaSpeakerRepository;
import com.example.voiceprint_backend.repository.ProfileRedirectRepository;
import com.example.voiceprint_backend.repository.SpeakerEmbeddingRepository;
import com.example.voiceprint_backend.repository.SpeakerProfileRepository;
import com.example.voiceprint_backend.repository.TranscriptSegmentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Profile-level writes shared by intake, verification, retroactive labeling and merge.
 * Callers own the transaction.
 */
@Service
public class ProfileStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProfileStore.class);
    private static final int MAX_REDIRECT_HOPS = 8;

    private final SpeakerProfileRepository profileRepo;
    private final SpeakerEmbeddingRepository embeddingRepo;
    private final MediaSpeakerRepository speakerRepo;
    private final TranscriptSegmentRepository segmentRepo;
    private final ProfileRedirectRepository redirectRepo;
    private final Clock clock;

    public ProfileStore(SpeakerProfileRepository profileRepo,
                        SpeakerEmbeddingRepository embeddingRepo,
                        MediaSpeakerRepository speakerRepo,
                        TranscriptSegmentRepository segmentRepo,
                        ProfileRedirectRepository redirectRepo,
                        Clock clock) {
        this.profileRepo = profileRepo;
        this.embeddingRepo = embeddingRepo;
        this.speakerRepo = speakerRepo;
        this.segmentRepo = segmentRepo;
        this.redirectRepo = redirectRepo;
        this.clock = clock;
    }

    /** Every profile of the owner with its voiceprints, as input for the matcher. */
    public List<ProfileVoiceprints> snapshot(UUID ownerId) {
        return group(embeddingRepo.findAllByOwnerId(ownerId));
    }

    public Optional<ProfileVoiceprints> snapshotOf(UUID profileId) {
        List<ProfileVoiceprints> grouped = group(embeddingRepo.findAllByProfileId(profileId));
        return grouped.isEmpty() ? Optional.empty() : Optional.of(grouped.get(0));
    }

    private static List<ProfileVoiceprints> group(List<SpeakerEmbedding> embeddings) {
        Map<UUID, SpeakerProfile> profiles = new LinkedHashMap<>();
        Map<UUID, List<Voiceprint>> voiceprints = new LinkedHashMap<>();
        for (SpeakerEmbedding e : embeddings) {
            SpeakerProfile p = e.getProfile();
            profiles.putIfAbsent(p.getId(), p);
            voiceprints.computeIfAbsent(p.getId(), k -> new ArrayList<>())
                    .add(new Voiceprint(e.getId(), e.getMedia().getId(), e.getVector()));
        }
        List<ProfileVoiceprints> out = new ArrayList<>(profiles.size());
        profiles.forEach((id, p) ->
                out.add(new ProfileVoiceprints(id, p.getDisplayName(), p.getVerificationState(), voiceprints.get(id))));
        return out;
    }

    public SpeakerProfile createPlaceholder(Account owner) {
        return profileRepo.save(new SpeakerProfile(owner, null));
    }

    /**
     * Loads a profile for writing and bumps its version on commit.
     *
     * @throws ProfileGoneException when the profile no longer exists; carries the merge target if any.
     */
    public SpeakerProfile lockForWrite(UUID profileId) {
        return profileRepo.findForUpdateById(profileId)
                .orElseThrow(() -> new ProfileGoneException(profileId, resolveRedirect(profileId).orElse(null)));
    }

    /** Like {@link #lockForWrite(UUID)} but follows a merge redirect once. */
    public SpeakerProfile lockResolving(UUID profileId) {
        try {
            return lockForWrite(profileId);
        } catch (ProfileGoneException gone) {
            UUID target = gone.getRedirectTarget().orElseThrow(() -> gone);
            LOGGER.warn("PROFILE_GONE profile={} redirect={} retrying once", profileId, target);
            return lockForWrite(target);
        }
    }

    /** Final target of a redirect chain starting at {@code profileId}, if any. */
    public Optional<UUID> resolveRedirect(UUID profileId) {
        UUID current = profileId;
        boolean moved = false;
        for (int hop = 0; hop < MAX_REDIRECT_HOPS; hop++) {
            Optional<ProfileRedirect> next = redirectRepo.findById(current);
            if (next.isEmpty()) {
                break;
            }
            current = next.get().getTargetProfileId();
            moved = true;
        }
        return moved ? Optional.of(current) : Optional.empty();
    }

    /** Existing profile, or the live profile it was merged into. */
    public Optional<SpeakerProfile> findLive(UUID profileId) {
        Optional<SpeakerProfile> direct = profileRepo.findById(profileId);
        if (direct.isPresent()) {
            return direct;
        }
        return resolveRedirect(profileId).flatMap(profileRepo::findById);
    }

    /** Moves a speaker's voiceprint to {@code target} together with its transcript segments. */
    public void moveEmbedding(MediaSpeaker speaker, SpeakerProfile target) {
        SpeakerEmbedding embedding = speaker.getEmbedding();
        embedding.setProfile(target);
        segmentRepo.repointSpeaker(speaker, target);
    }

    public void recomputeStats(SpeakerProfile profile) {
        profile.setEmbeddingCount((int) embeddingRepo.countByProfile(profile));
        profile.setMediaCount((int) embeddingRepo.countDistinctMediaByProfile(profile));
        profile.setSegmentCount(segmentRepo.countByProfile(profile));
        Long talk = segmentRepo.sumTalkTimeMs(profile);
        profile.setTalkTimeMs(talk == null ? 0L : talk);
    }

    public void writeRedirect(UUID sourceId, UUID targetId) {
        for (ProfileRedirect older : redirectRepo.findByTargetProfileId(sourceId)) {
            older.setTargetProfileId(targetId);
        }
        redirectRepo.save(new ProfileRedirect(sourceId, targetId, clock.instant()));
    }

    /**
     * Deletes {@code profile} when it owns no voiceprint anymore. Pending suggestions and
     * segments still pointing at it move to {@code successor}; a redirect is left when a
     * successor exists. Otherwise only the stats are refreshed.
     *
     * @return {@code true} when the profile was deleted.
     */
    public boolean retireIfEmpty(SpeakerProfile profile, SpeakerProfile successor) {
        if (profile == null || (successor != null && profile.getId().equals(successor.getId()))) {
            return false;
        }
        if (embeddingRepo.countByProfile(profile) > 0) {
            recomputeStats(profile);
            return false;
        }
        for (MediaSpeaker pending : speakerRepo.findBySuggestedProfile(profile)) {
            pending.redirectSuggestion(successor);
        }
        if (successor != null) {
            segmentRepo.reassignProfile(profile, successor);
            writeRedirect(profile.getId(), successor.getId());
        } else {
            segmentRepo.detachProfile(profile);
        }
        profileRepo.delete(profile);
        LOGGER.info("PROFILE retired profile={} successor={}", profile.getId(), successor == null ? null : successor.getId());
        return true;
    }
}
