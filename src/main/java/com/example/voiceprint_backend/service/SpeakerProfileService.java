package com.example.voiceprint_backend.service;

import com.example.voiceprint_backend.exception.NotFoundException;
import com.example.voiceprint_backend.model.MediaSpeaker;
import com.example.voiceprint_backend.model.SpeakerProfile;
import com.example.voiceprint_backend.repository.MediaSpeakerRepository;
import com.example.voiceprint_backend.repository.SpeakerProfileRepository;
import com.example.voiceprint_backend.repository.TranscriptSegmentRepository;
import com.example.voiceprint_backend.util.VerificationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@Service
public class SpeakerProfileService {
    private static final Logger LOGGER = LoggerFactory.getLogger(SpeakerProfileService.class);

    private final SpeakerProfileRepository profileRepo;
    private final MediaSpeakerRepository speakerRepo;
    private final TranscriptSegmentRepository segmentRepo;
    private final AccountService accountService;
    private final ProfileStore profileStore;
    private final RetroactiveLabelingService retroactiveLabeling;
    private final ConflictRetrier retrier;
    private final Clock clock;

    public SpeakerProfileService(SpeakerProfileRepository profileRepo,
                                 MediaSpeakerRepository speakerRepo,
                                 TranscriptSegmentRepository segmentRepo,
                                 AccountService accountService,
                                 ProfileStore profileStore,
                                 RetroactiveLabelingService retroactiveLabeling,
                                 ConflictRetrier retrier,
                                 Clock clock) {
        this.profileRepo = profileRepo;
        this.speakerRepo = speakerRepo;
        this.segmentRepo = segmentRepo;
        this.accountService = accountService;
        this.profileStore = profileStore;
        this.retroactiveLabeling = retroactiveLabeling;
        this.retrier = retrier;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<SpeakerProfile> list(String ownerExternalSubject) {
        var owner = accountService.getByExternalSubjectOrThrow(ownerExternalSubject);
        return profileRepo.findByOwnerOrderByCreatedAtAsc(owner);
    }

    @Transactional(readOnly = true)
    public SpeakerProfile getOwned(UUID profileId, String ownerExternalSubject) {
        SpeakerProfile profile = profileRepo.findByIdWithOwner(profileId)
                .orElseThrow(() -> NotFoundException.profile(profileId));
        if (!profile.getOwner().getExternalSubject().equals(ownerExternalSubject)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "PROFILE_NOT_OWNED");
        }
        return profile;
    }

    @Transactional
    public SpeakerProfile create(String ownerExternalSubject, String name) {
        var owner = accountService.ensureByExternalSubject(ownerExternalSubject, null);
        SpeakerProfile profile = new SpeakerProfile(owner, name.trim());
        profile.setVerificationState(VerificationState.VERIFIED);
        profile = profileRepo.save(profile);
        LOGGER.info("PROFILE created profile={} owner={}", profile.getId(), owner.getId());
        return profile;
    }

    /**
     * Names a profile, confirms it and propagates the name to matching speakers in the
     * owner's other media. Speakers already in the profile that were still open count as
     * identified by the user; auto-accepted ones inherit the new name, verified ones keep theirs.
     */
    public SpeakerProfile rename(String ownerExternalSubject, UUID profileId, String name) {
        String trimmed = name.trim();
        retrier.inTransaction("rename " + profileId, () -> {
            getOwned(profileId, ownerExternalSubject);
            SpeakerProfile profile = profileStore.lockForWrite(profileId);
            String previous = profile.getDisplayName();
            profile.setDisplayName(trimmed);
            profile.setVerificationState(VerificationState.VERIFIED);
            for (MediaSpeaker owned : speakerRepo.findOwnedBy(profile)) {
                switch (owned.getAssignment()) {
                    case AUTO_ACCEPTED -> owned.setDisplayName(trimmed);
                    case PENDING, UNASSIGNED -> owned.markVerified(trimmed, clock.instant());
                    case VERIFIED -> { }
                }
            }
            LOGGER.info("PROFILE renamed profile={} from={} to={}", profileId, previous, trimmed);
        });
        retroactiveLabeling.relabel(profileId);
        return retrier.inTransaction("rename-load " + profileId, () ->
                profileRepo.findById(profileId).orElseThrow(() -> NotFoundException.profile(profileId)));
    }

    /**
     * Deletes a profile. Each of its speakers is re-seeded into a fresh unnamed profile so no
     * voiceprint is left without an owner.
     */
    public void delete(String ownerExternalSubject, UUID profileId) {
        retrier.inTransaction("delete " + profileId, () -> {
            SpeakerProfile owned = getOwned(profileId, ownerExternalSubject);
            SpeakerProfile profile = profileStore.lockForWrite(profileId);
            List<MediaSpeaker> speakers = speakerRepo.findOwnedBy(profile);
            for (MediaSpeaker speaker : speakers) {
                SpeakerProfile placeholder = profileStore.createPlaceholder(owned.getOwner());
                profileStore.moveEmbedding(speaker, placeholder);
                speaker.markUnassigned();
                speaker.setDisplayName(null);
                profileStore.recomputeStats(placeholder);
            }
            for (MediaSpeaker pending : speakerRepo.findBySuggestedProfile(profile)) {
                pending.redirectSuggestion(null);
            }
            segmentRepo.detachProfile(profile);
            profileRepo.delete(profile);
            LOGGER.info("PROFILE deleted profile={} reseeded={}", profileId, speakers.size());
        });
    }

    public SpeakerProfile refreshStats(String ownerExternalSubject, UUID profileId) {
        return retrier.inTransaction("refresh-stats " + profileId, () -> {
            getOwned(profileId, ownerExternalSubject);
            SpeakerProfile profile = profileStore.lockForWrite(profileId);
            profileStore.recomputeStats(profile);
            return profile;
        });
    }
}
