package com.example.voiceprint_backend.controller;

import com.example.voiceprint_backend.dto.SpeakerSuggestion;
import com.example.voiceprint_backend.dto.web.MediaSpeakerResponse;
import com.example.voiceprint_backend.dto.web.ProfileResponse;
import com.example.voiceprint_backend.dto.web.VerifySpeakerRequest;
import com.example.voiceprint_backend.service.SpeakerQueryService;
import com.example.voiceprint_backend.service.SpeakerSuggestionService;
import com.example.voiceprint_backend.service.SpeakerVerificationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/v1")
@Validated
public class MediaSpeakerController {

    private final SpeakerSuggestionService suggestionService;
    private final SpeakerVerificationService verificationService;
    private final SpeakerQueryService queryService;

    public MediaSpeakerController(SpeakerSuggestionService suggestionService,
                                  SpeakerVerificationService verificationService,
                                  SpeakerQueryService queryService) {
        this.suggestionService = suggestionService;
        this.verificationService = verificationService;
        this.queryService = queryService;
    }

    @GetMapping("/media/{mediaId}/speakers")
    public List<MediaSpeakerResponse> speakers(@PathVariable UUID mediaId, @RequestParam String ownerExternalSubject) {
        return queryService.speakersOf(ownerExternalSubject, mediaId);
    }

    @GetMapping("/media/{mediaId}/speakers/suggestions")
    public List<SpeakerSuggestion> suggestions(@PathVariable UUID mediaId, @RequestParam String ownerExternalSubject) {
        return suggestionService.listSuggestions(ownerExternalSubject, mediaId);
    }

    @Operation(summary = "Confirm, reject or name a per-file speaker")
    @ApiResponse(responseCode = "200", description = "Profile now owning the speaker")
    @ApiResponse(responseCode = "400", description = "Missing profileId for ACCEPT or name for CREATE_PROFILE")
    @ApiResponse(responseCode = "404", description = "Speaker does not exist")
    @ApiResponse(responseCode = "409", description = "Profile was merged away or kept conflicting")
    @PostMapping("/speakers/{mediaSpeakerId}/verify")
    public ProfileResponse verify(@PathVariable UUID mediaSpeakerId,
                                  @RequestParam String ownerExternalSubject,
                                  @Valid @RequestBody VerifySpeakerRequest request) {
        return ProfileResponse.from(verificationService.verify(
                ownerExternalSubject, mediaSpeakerId, request.action(), request.profileId(), request.name()));
    }
}
