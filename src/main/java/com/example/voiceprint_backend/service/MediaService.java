package com.example.voiceprint_backend.service;

import com.example.voiceprint_backend.exception.NotFoundException;
import com.example.voiceprint_backend.model.Media;
import com.example.voiceprint_backend.model.SpeakerEmbedding;
import com.example.voiceprint_backend.model.SpeakerProfile;
import com.example.voiceprint_backend.repository.MediaRepository;
import com.example.voiceprint_backend.repository.MediaSpeakerRepository;
import com.example.voiceprint_backend.repository.SpeakerEmbeddingRepository;
import com.example.voiceprint_backend.repository.TranscriptSegmentRepository;
import com.example.voiceprint_backend.util.MediaStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Service
public class MediaService {
    private static final Logger LOGGER = LoggerFactory.getLogger(MediaService.class);

    private final MediaRepository mediaRepo;
    private final AccountService accountService;
    private final MediaSpeakerRepository speakerRepo;
    private final SpeakerEmbeddingRepository embeddingRepo;
    private final TranscriptSegmentRepository segmentRepo;
    private final ProfileStore profileStore;

    public MediaService(MediaRepository mediaRepo,
                        AccountService accountService,
                        MediaSpeakerRepository speakerRepo,
                        SpeakerEmbeddingRepository embeddingRepo,
                        TranscriptSegmentRepository segmentRepo,
                        ProfileStore profileStore) {
        this.mediaRepo = mediaRepo;
        this.accountService = accountService;
        this.speakerRepo = speakerRepo;
        this.embeddingRepo = embeddingRepo;
        this.segmentRepo = segmentRepo;
        this.profileStore = profileStore;
    }

    @Transactional
    public Media register(String ownerExternalSubject, String title, String objectKey, Long durationMs) {
        var owner = accountService.ensureByExternalSubject(ownerExternalSubject, null);
        var m = new Media(owner, title);
        if (objectKey != null && !objectKey.isBlank()) {
            m.setObjectKey(normalizeObjectKey(objectKey));
        }
        if (durationMs != null && durationMs > 0) m.setDurationMs(durationMs);
        m.setStatus(MediaStatus.REGISTERED);
        return mediaRepo.save(m);
    }

    @Transactional(readOnly = true)
    public Page<Media> listByOwner(String ownerExternalSubject, @Nullable MediaStatus status, Pageable p) {
        var owner = accountService.getByExternalSubjectOrThrow(ownerExternalSubject);
        return status == null
                ? mediaRepo.findByOwnerOrderByCreatedAtDesc(owner, p)
                : mediaRepo.findByOwnerAndStatusOrderByCreatedAtDesc(owner, status, p);
    }

    @Transactional(readOnly = true)
    public Media get(UUID mediaId) {
        return mediaRepo.findById(mediaId).orElseThrow(() -> NotFoundException.media(mediaId));
    }

    /** Media with its owner loaded; 404 when missing, 403 when owned by someone else. */
    @Transactional(readOnly = true)
    public Media getOwned(UUID mediaId, String ownerExternalSubject) {
        var media = mediaRepo.findByIdWithOwner(mediaId).orElseThrow(() -> NotFoundException.media(mediaId));
        if (!media.getOwner().getExternalSubject().equals(ownerExternalSubject)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "MEDIA_NOT_OWNED");
        }
        return media;
    }

    @Transactional
    public void setStatus(UUID mediaId, MediaStatus status) {
        if (mediaRepo.updateStatus(mediaId, status) == 0) {
            throw NotFoundException.media(mediaId);
        }
        LOGGER.debug("MEDIA status mediaId={} status={}", mediaId, status);
    }

    /**
     * Deletes a media item with its segments, speakers and voiceprints. Profiles left without
     * any voiceprint are deleted too; the others get fresh statistics.
     */
    @Transactional
    public void delete(UUID mediaId, String ownerExternalSubject) {
        var media = getOwned(mediaId, ownerExternalSubject);
        Map<UUID, SpeakerProfile> touched = new LinkedHashMap<>();
        for (SpeakerEmbedding e : embeddingRepo.findByMedia(media)) {
            touched.putIfAbsent(e.getProfile().getId(), e.getProfile());
        }
        int segments = segmentRepo.deleteByMedia(media);
        var speakers = speakerRepo.findByMediaOrderBySpeakerLabelAsc(media);
        speakerRepo.deleteAll(speakers);
        embeddingRepo.deleteAll(embeddingRepo.findByMedia(media));
        embeddingRepo.flush();
        for (SpeakerProfile p : touched.values()) {
            profileStore.retireIfEmpty(p, null);
        }
        mediaRepo.delete(media);
        LOGGER.info("MEDIA deleted mediaId={} speakers={} segments={} profilesTouched={}",
                mediaId, speakers.size(), segments, touched.size());
    }

    // backslashes to forward slashes, no leading slashes
    private String normalizeObjectKey(String key) {
        return key.replace('\\', '/').replaceAll("^/+", "");
    }
}
