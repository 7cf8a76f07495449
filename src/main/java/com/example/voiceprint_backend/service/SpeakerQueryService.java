package com.example.voiceprint_backend.service;

import com.example.voiceprint_backend.dto.CrossMediaOccurrence;
import com.example.voiceprint_backend.dto.web.MediaSpeakerResponse;
import com.example.voiceprint_backend.model.MediaSpeaker;
import com.example.voiceprint_backend.model.SpeakerProfile;
import com.example.voiceprint_backend.repository.MediaSpeakerRepository;
import com.example.voiceprint_backend.util.SpeakerAssignment;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Read views over profiles and per-file speakers.
 */
@Service
public class SpeakerQueryService {

    private final MediaSpeakerRepository speakerRepo;
    private final SpeakerProfileService profileService;
    private final MediaService mediaService;

    public SpeakerQueryService(MediaSpeakerRepository speakerRepo,
                               SpeakerProfileService profileService,
                               MediaService mediaService) {
        this.speakerRepo = speakerRepo;
        this.profileService = profileService;
        this.mediaService = mediaService;
    }

    /**
     * Every media item the profile appears in: one row per owned voiceprint plus one row per
     * open suggestion pointing at the profile.
     */
    @Transactional(readOnly = true)
    public List<CrossMediaOccurrence> occurrences(String ownerExternalSubject, UUID profileId) {
        SpeakerProfile profile = profileService.getOwned(profileId, ownerExternalSubject);
        List<CrossMediaOccurrence> out = new ArrayList<>();
        for (MediaSpeaker s : speakerRepo.findOwnedBy(profile)) {
            double score = s.getConfidence() == null ? 1.0 : s.getConfidence().doubleValue();
            out.add(new CrossMediaOccurrence(profileId, s.getMedia().getId(), s.getMedia().displayTitle(),
                    s.getId(), s.getSpeakerLabel(), score, s.getAssignment() == SpeakerAssignment.VERIFIED, false));
        }
        for (MediaSpeaker s : speakerRepo.findSuggestingProfile(profile)) {
            double score = s.getConfidence() == null ? 0.0 : s.getConfidence().doubleValue();
            out.add(new CrossMediaOccurrence(profileId, s.getMedia().getId(), s.getMedia().displayTitle(),
                    s.getId(), s.getSpeakerLabel(), score, false, true));
        }
        return out;
    }

    @Transactional(readOnly = true)
    public List<MediaSpeakerResponse> speakersOf(String ownerExternalSubject, UUID mediaId) {
        var media = mediaService.getOwned(mediaId, ownerExternalSubject);
        return speakerRepo.findByMediaOrderBySpeakerLabelAsc(media).stream()
                .map(SpeakerQueryService::toResponse)
                .toList();
    }

    static MediaSpeakerResponse toResponse(MediaSpeaker s) {
        return new MediaSpeakerResponse(
                s.getId(),
                s.getMedia().getId(),
                s.getSpeakerLabel(),
                s.effectiveName(),
                s.getProfile().getId(),
                s.getAssignment(),
                statusText(s),
                s.getConfidence(),
                s.getRationale(),
                s.getSuggestedProfile() != null ? s.getSuggestedProfile().getId() : null,
                s.getVerifiedAt());
    }

    static String statusText(MediaSpeaker s) {
        return switch (s.getAssignment()) {
            case VERIFIED -> "Verified as " + s.effectiveName();
            case AUTO_ACCEPTED -> "High confidence match - click to verify";
            case PENDING -> "Medium confidence match - review needed";
            case UNASSIGNED -> "Needs identification";
        };
    }
}
