package com.example.voiceprint_backend.service;

import com.example.voiceprint_backend.dto.MergeResult;
import com.example.voiceprint_backend.dto.MergeSourceOutcome;
import com.example.voiceprint_backend.exception.ConcurrentModificationConflictException;
import com.example.voiceprint_backend.exception.InvalidMergeRequestException;
import com.example.voiceprint_backend.exception.NotFoundException;
import com.example.voiceprint_backend.exception.ProfileGoneException;
import com.example.voiceprint_backend.model.MediaSpeaker;
import com.example.voiceprint_backend.model.SpeakerEmbedding;
import com.example.voiceprint_backend.model.SpeakerProfile;
import com.example.voiceprint_backend.repository.MediaSpeakerRepository;
import com.example.voiceprint_backend.repository.SpeakerEmbeddingRepository;
import com.example.voiceprint_backend.repository.SpeakerProfileRepository;
import com.example.voiceprint_backend.repository.TranscriptSegmentRepository;
import com.example.voiceprint_backend.util.MergeFailureReason;
import com.example.voiceprint_backend.util.SpeakerAssignment;
import com.example.voiceprint_backend.util.VerificationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Absorbs source profiles into a target. Each source is handled in its own transaction,
 * so one failing source never rolls back another; the outcome of every source is reported.
 */
@Service
public class SpeakerMergeService {
    private static final Logger LOGGER = LoggerFactory.getLogger(SpeakerMergeService.class);

    private final SpeakerProfileRepository profileRepo;
    private final SpeakerEmbeddingRepository embeddingRepo;
    private final MediaSpeakerRepository speakerRepo;
    private final TranscriptSegmentRepository segmentRepo;
    private final ProfileStore profileStore;
    private final ConflictRetrier retrier;

    public SpeakerMergeService(SpeakerProfileRepository profileRepo,
                               SpeakerEmbeddingRepository embeddingRepo,
                               MediaSpeakerRepository speakerRepo,
                               TranscriptSegmentRepository segmentRepo,
                               ProfileStore profileStore,
                               ConflictRetrier retrier) {
        this.profileRepo = profileRepo;
        this.embeddingRepo = embeddingRepo;
        this.speakerRepo = speakerRepo;
        this.segmentRepo = segmentRepo;
        this.profileStore = profileStore;
        this.retrier = retrier;
    }

    /**
     * @throws InvalidMergeRequestException for an empty source list, duplicates, or a target among the sources.
     * @throws NotFoundException            when the target does not exist.
     */
    public MergeResult merge(String ownerExternalSubject, List<UUID> sourceIds, UUID targetId) {
        validate(sourceIds, targetId);
        retrier.inTransaction("merge-check " + targetId, () -> {
            SpeakerProfile target = profileRepo.findByIdWithOwner(targetId)
                    .orElseThrow(() -> NotFoundException.profile(targetId));
            ensureOwned(target, ownerExternalSubject);
        });

        List<MergeSourceOutcome> outcomes = new ArrayList<>(sourceIds.size());
        for (UUID sourceId : sourceIds) {
            outcomes.add(mergeOne(ownerExternalSubject, sourceId, targetId));
        }
        MergeResult result = MergeResult.of(targetId, outcomes);
        LOGGER.info("MERGE done target={} status={} succeeded={} failed={}",
                targetId, result.status(), result.succeeded().size(), result.failed().size());
        return result;
    }

    static void validate(List<UUID> sourceIds, UUID targetId) {
        if (targetId == null) {
            throw new InvalidMergeRequestException("target profile is required");
        }
        if (sourceIds == null || sourceIds.isEmpty()) {
            throw new InvalidMergeRequestException("at least one source profile is required");
        }
        Set<UUID> seen = new HashSet<>();
        for (UUID id : sourceIds) {
            if (id == null) {
                throw new InvalidMergeRequestException("source profile ids must not be null");
            }
            if (id.equals(targetId)) {
                throw new InvalidMergeRequestException("target " + targetId + " is also listed as a source");
            }
            if (!seen.add(id)) {
                throw new InvalidMergeRequestException("source " + id + " is listed more than once");
            }
        }
    }

    private MergeSourceOutcome mergeOne(String ownerExternalSubject, UUID sourceId, UUID targetId) {
        try {
            MergeSourceOutcome outcome = retrier.inTransaction("merge " + sourceId + "->" + targetId,
                    () -> absorb(ownerExternalSubject, sourceId, targetId));
            LOGGER.info("MERGE source={} target={} outcome=ok embeddings={} segments={}",
                    sourceId, targetId, outcome.movedEmbeddings(), outcome.movedSegments());
            return outcome;
        } catch (NotFoundException e) {
            return failed(sourceId, targetId, MergeFailureReason.NOT_FOUND, e.getErrorText());
        } catch (ProfileGoneException e) {
            return failed(sourceId, targetId, MergeFailureReason.PROFILE_GONE, e.getErrorText());
        } catch (ConcurrentModificationConflictException e) {
            return failed(sourceId, targetId, MergeFailureReason.CONFLICT, e.getErrorText());
        } catch (ResponseStatusException e) {
            return failed(sourceId, targetId, MergeFailureReason.REJECTED, e.getReason());
        } catch (RuntimeException e) {
            LOGGER.error("MERGE source={} target={} unexpected failure", sourceId, targetId, e);
            return failed(sourceId, targetId, MergeFailureReason.UNEXPECTED, e.toString());
        }
    }

    private static MergeSourceOutcome failed(UUID sourceId, UUID targetId, MergeFailureReason reason, String error) {
        LOGGER.warn("MERGE source={} target={} outcome={} error={}", sourceId, targetId, reason, error);
        return MergeSourceOutcome.failure(sourceId, reason, error);
    }

    private MergeSourceOutcome absorb(String ownerExternalSubject, UUID sourceId, UUID targetId) {
        SpeakerProfile source = profileRepo.findForUpdateById(sourceId)
                .orElseThrow(() -> NotFoundException.profile(sourceId));
        ensureOwned(source, ownerExternalSubject);
        SpeakerProfile target = profileStore.lockForWrite(targetId);

        List<SpeakerEmbedding> embeddings = embeddingRepo.findByProfile(source);
        for (SpeakerEmbedding e : embeddings) {
            e.setProfile(target);
        }
        int segments = segmentRepo.reassignProfile(source, target);
        for (MediaSpeaker pending : speakerRepo.findBySuggestedProfile(source)) {
            boolean alreadyInTarget = pending.getProfile().getId().equals(targetId);
            pending.redirectSuggestion(alreadyInTarget ? null : target);
        }

        if (!target.isNamed() && source.isNamed()) {
            target.setDisplayName(source.getDisplayName());
        }
        if (source.getVerificationState() == VerificationState.VERIFIED) {
            target.setVerificationState(VerificationState.VERIFIED);
        } else if (target.getVerificationState() == VerificationState.UNVERIFIED
                && source.getVerificationState() == VerificationState.SUGGESTED) {
            target.setVerificationState(VerificationState.SUGGESTED);
        }

        for (MediaSpeaker owned : speakerRepo.findOwnedBy(target)) {
            if (owned.getAssignment() == SpeakerAssignment.VERIFIED) {
                continue;
            }
            SpeakerProfile suggested = owned.getSuggestedProfile();
            if (suggested != null && suggested.getId().equals(targetId)) {
                owned.redirectSuggestion(null);
            }
            owned.setDisplayName(target.getDisplayName());
        }

        String sourceName = source.getDisplayName();
        profileStore.writeRedirect(sourceId, targetId);
        profileRepo.delete(source);
        profileStore.recomputeStats(target);
        return MergeSourceOutcome.success(sourceId, sourceName, embeddings.size(), segments);
    }

    private static void ensureOwned(SpeakerProfile profile, String ownerExternalSubject) {
        if (!profile.getOwner().getExternalSubject().equals(ownerExternalSubject)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "PROFILE_NOT_OWNED");
        }
    }
}
