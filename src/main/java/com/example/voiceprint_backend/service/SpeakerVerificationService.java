package com.example.voiceprint_backend.service;

import com.example.voiceprint_backend.exception.NotFoundException;
import com.example.voiceprint_backend.model.Account;
import com.example.voiceprint_backend.model.MediaSpeaker;
import com.example.voiceprint_backend.model.SpeakerProfile;
import com.example.voiceprint_backend.repository.MediaSpeakerRepository;
import com.example.voiceprint_backend.repository.SpeakerEmbeddingRepository;
import com.example.voiceprint_backend.repository.SpeakerProfileRepository;
import com.example.voiceprint_backend.util.VerificationState;
import com.example.voiceprint_backend.util.VerifyAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.util.UUID;

/**
 * Human confirmation of a per-file speaker: accept a profile, reject the current match,
 * or name the speaker as a new profile.
 */
@Service
public class SpeakerVerificationService {
    private static final Logger LOGGER = LoggerFactory.getLogger(SpeakerVerificationService.class);

    private final MediaSpeakerRepository speakerRepo;
    private final SpeakerEmbeddingRepository embeddingRepo;
    private final SpeakerProfileRepository profileRepo;
    private final ProfileStore profileStore;
    private final RetroactiveLabelingService retroactiveLabeling;
    private final ConflictRetrier retrier;
    private final Clock clock;

    public SpeakerVerificationService(MediaSpeakerRepository speakerRepo,
                                      SpeakerEmbeddingRepository embeddingRepo,
                                      SpeakerProfileRepository profileRepo,
                                      ProfileStore profileStore,
                                      RetroactiveLabelingService retroactiveLabeling,
                                      ConflictRetrier retrier,
                                      Clock clock) {
        this.speakerRepo = speakerRepo;
        this.embeddingRepo = embeddingRepo;
        this.profileRepo = profileRepo;
        this.profileStore = profileStore;
        this.retroactiveLabeling = retroactiveLabeling;
        this.retrier = retrier;
        this.clock = clock;
    }

    private record Verified(UUID profileId, boolean named) {}

    /**
     * @param profileId required for {@link VerifyAction#ACCEPT}.
     * @param name      required for {@link VerifyAction#CREATE_PROFILE}.
     * @return the profile now owning the speaker's voiceprint.
     */
    public SpeakerProfile verify(String ownerExternalSubject, UUID mediaSpeakerId,
                                 VerifyAction action, UUID profileId, String name) {
        Verified verified = retrier.inTransaction("verify " + mediaSpeakerId, () -> {
            MediaSpeaker speaker = speakerRepo.findByIdWithEmbedding(mediaSpeakerId)
                    .orElseThrow(() -> NotFoundException.speaker(mediaSpeakerId));
            Account owner = speaker.getMedia().getOwner();
            if (!owner.getExternalSubject().equals(ownerExternalSubject)) {
                throw new ResponseStatusException(HttpStatus.FORBIDDEN, "SPEAKER_NOT_OWNED");
            }
            SpeakerProfile result = switch (action) {
                case ACCEPT -> accept(speaker, owner, profileId);
                case REJECT -> reject(speaker, owner);
                case CREATE_PROFILE -> createProfile(speaker, owner, name);
            };
            LOGGER.info("VERIFY speaker={} action={} profile={}", mediaSpeakerId, action, result.getId());
            return new Verified(result.getId(), result.isNamed() && action != VerifyAction.REJECT);
        });

        if (verified.named()) {
            retroactiveLabeling.relabel(verified.profileId());
        }
        return retrier.inTransaction("verify-load " + verified.profileId(), () ->
                profileRepo.findById(verified.profileId()).orElseThrow(() -> NotFoundException.profile(verified.profileId())));
    }

    private SpeakerProfile accept(MediaSpeaker speaker, Account owner, UUID profileId) {
        if (profileId == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "PROFILE_ID_REQUIRED");
        }
        SpeakerProfile target = profileStore.lockResolving(profileId);
        if (!target.isOwnedBy(owner)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "PROFILE_NOT_OWNED");
        }
        SpeakerProfile former = speaker.getProfile();
        if (!former.getId().equals(target.getId())) {
            profileStore.moveEmbedding(speaker, target);
        }
        speaker.markVerified(target.getDisplayName(), clock.instant());
        target.setVerificationState(VerificationState.VERIFIED);
        profileStore.retireIfEmpty(former, target);
        profileStore.recomputeStats(target);
        return target;
    }

    private SpeakerProfile reject(MediaSpeaker speaker, Account owner) {
        SpeakerProfile current = profileStore.lockForWrite(speaker.getProfile().getId());
        SpeakerProfile result = current;
        if (embeddingRepo.countByProfile(current) > 1) {
            result = profileStore.createPlaceholder(owner);
            profileStore.moveEmbedding(speaker, result);
            profileStore.recomputeStats(current);
        }
        speaker.markUnassigned();
        speaker.setDisplayName(null);
        profileStore.recomputeStats(result);
        return result;
    }

    private SpeakerProfile createProfile(MediaSpeaker speaker, Account owner, String name) {
        if (name == null || name.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "NAME_REQUIRED");
        }
        String trimmed = name.trim();
        SpeakerProfile current = profileStore.lockForWrite(speaker.getProfile().getId());
        SpeakerProfile target;
        if (!current.isNamed() && embeddingRepo.countByProfile(current) == 1) {
            target = current;
            target.setDisplayName(trimmed);
        } else {
            target = profileRepo.save(new SpeakerProfile(owner, trimmed));
            profileStore.moveEmbedding(speaker, target);
            profileStore.retireIfEmpty(current, target);
        }
        target.setVerificationState(VerificationState.VERIFIED);
        speaker.markVerified(trimmed, clock.instant());
        profileStore.recomputeStats(target);
        return target;
    }
}
