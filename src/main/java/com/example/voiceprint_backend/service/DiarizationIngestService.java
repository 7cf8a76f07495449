package com.example.voiceprint_backend.service;

import com.example.voiceprint_backend.dto.IngestResult;
import com.example.voiceprint_backend.engine.Interfaces.DiarizationEngine.DiarizedSpeaker;
import com.example.voiceprint_backend.engine.Interfaces.DiarizationEngine.Segment;
import com.example.voiceprint_backend.exception.InvalidEmbeddingException;
import com.example.voiceprint_backend.exception.NotFoundException;
import com.example.voiceprint_backend.matcher.ProfileVoiceprints;
import com.example.voiceprint_backend.matcher.Voiceprints;
import com.example.voiceprint_backend.model.Media;
import com.example.voiceprint_backend.model.MediaSpeaker;
import com.example.voiceprint_backend.model.SpeakerProfile;
import com.example.voiceprint_backend.model.TranscriptSegment;
import com.example.voiceprint_backend.repository.MediaRepository;
import com.example.voiceprint_backend.repository.SpeakerEmbeddingRepository;
import com.example.voiceprint_backend.repository.TranscriptSegmentRepository;
import com.example.voiceprint_backend.util.MediaStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Turns a finished diarization result into stored voiceprints, per-file speakers and
 * transcript segments. Each speaker is committed on its own so one failure does not
 * undo the others.
 */
@Service
public class DiarizationIngestService {
    private static final Logger LOGGER = LoggerFactory.getLogger(DiarizationIngestService.class);

    private final MediaRepository mediaRepo;
    private final SpeakerEmbeddingRepository embeddingRepo;
    private final TranscriptSegmentRepository segmentRepo;
    private final SpeakerSuggestionService suggestionService;
    private final ProfileStore profileStore;
    private final ConflictRetrier retrier;

    public DiarizationIngestService(MediaRepository mediaRepo,
                                    SpeakerEmbeddingRepository embeddingRepo,
                                    TranscriptSegmentRepository segmentRepo,
                                    SpeakerSuggestionService suggestionService,
                                    ProfileStore profileStore,
                                    ConflictRetrier retrier) {
        this.mediaRepo = mediaRepo;
        this.embeddingRepo = embeddingRepo;
        this.segmentRepo = segmentRepo;
        this.suggestionService = suggestionService;
        this.profileStore = profileStore;
        this.retrier = retrier;
    }

    private enum Placement { AUTO_ACCEPTED, PENDING, UNASSIGNED, SKIPPED }

    private record Placed(Placement placement, UUID profileId) {}

    /**
     * @throws InvalidEmbeddingException when any voiceprint is unusable; nothing is stored then.
     */
    public IngestResult ingest(UUID mediaId, List<DiarizedSpeaker> speakers) {
        List<DiarizedSpeaker> input = speakers == null ? List.of() : speakers;
        for (DiarizedSpeaker s : input) {
            if (s.label() == null || s.label().isBlank()) {
                throw new InvalidEmbeddingException("Diarized speaker without label in media " + mediaId);
            }
            try {
                Voiceprints.validate(s.embedding());
            } catch (InvalidEmbeddingException e) {
                throw new InvalidEmbeddingException("Speaker " + s.label() + " of media " + mediaId + ": " + e.getErrorText());
            }
        }

        record Context(UUID ownerId, Set<UUID> claimed) {}
        Context ctx = retrier.inTransaction("ingest-context", () -> {
            Media media = mediaRepo.findByIdWithOwner(mediaId).orElseThrow(() -> NotFoundException.media(mediaId));
            return new Context(media.getOwner().getId(), new HashSet<>(embeddingRepo.findProfileIdsByMedia(media)));
        });
        List<ProfileVoiceprints> snapshot = retrier.inTransaction("ingest-snapshot",
                () -> profileStore.snapshot(ctx.ownerId()));

        int auto = 0;
        int pending = 0;
        int unassigned = 0;
        int skipped = 0;
        List<String> failures = new ArrayList<>();
        for (DiarizedSpeaker s : input) {
            try {
                Placed placed = retrier.inTransaction("ingest " + mediaId + "/" + s.label(),
                        () -> place(mediaId, s, snapshot, Set.copyOf(ctx.claimed())));
                ctx.claimed().add(placed.profileId());
                switch (placed.placement()) {
                    case AUTO_ACCEPTED -> auto++;
                    case PENDING -> pending++;
                    case UNASSIGNED -> unassigned++;
                    case SKIPPED -> skipped++;
                }
            } catch (RuntimeException e) {
                LOGGER.error("INGEST speaker failed media={} label={}: {}", mediaId, s.label(), e.toString(), e);
                failures.add(s.label() + ": " + e.getMessage());
            }
        }

        int total = input.size();
        retrier.inTransaction("ingest-finish " + mediaId, () -> {
            Media media = mediaRepo.findById(mediaId).orElseThrow(() -> NotFoundException.media(mediaId));
            media.setSpeakerCountDetected(total);
            media.setStatus(failures.size() == total && total > 0 ? MediaStatus.FAILED : MediaStatus.DIARIZED);
        });
        IngestResult result = new IngestResult(mediaId, auto, pending, unassigned, skipped, List.copyOf(failures));
        LOGGER.info("INGEST done media={} auto={} pending={} unassigned={} skipped={} failed={}",
                mediaId, auto, pending, unassigned, skipped, failures.size());
        return result;
    }

    private Placed place(UUID mediaId, DiarizedSpeaker s, List<ProfileVoiceprints> snapshot, Set<UUID> claimed) {
        Media media = mediaRepo.findByIdWithOwner(mediaId).orElseThrow(() -> NotFoundException.media(mediaId));
        var existing = embeddingRepo.findByMediaAndSpeakerLabel(media, s.label());
        if (existing.isPresent()) {
            return new Placed(Placement.SKIPPED, existing.get().getProfile().getId());
        }
        MediaSpeaker speaker = suggestionService.classify(media, s.label(), s.embedding(), snapshot, claimed);
        for (Segment seg : s.segments()) {
            if (seg.endMs() <= seg.startMs()) {
                LOGGER.debug("INGEST drop segment media={} label={} start={} end={}", mediaId, s.label(), seg.startMs(), seg.endMs());
                continue;
            }
            segmentRepo.save(new TranscriptSegment(speaker, seg.startMs(), seg.endMs(), seg.text()));
        }
        SpeakerProfile owner = speaker.getProfile();
        profileStore.recomputeStats(owner);
        Placement placement = switch (speaker.getAssignment()) {
            case AUTO_ACCEPTED -> Placement.AUTO_ACCEPTED;
            case PENDING -> Placement.PENDING;
            default -> Placement.UNASSIGNED;
        };
        return new Placed(placement, owner.getId());
    }
}
