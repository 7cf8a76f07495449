package com.example.voiceprint_backend.controller;

import com.example.voiceprint_backend.dto.CrossMediaOccurrence;
import com.example.voiceprint_backend.dto.MergeResult;
import com.example.voiceprint_backend.dto.web.MergeRequest;
import com.example.voiceprint_backend.dto.web.ProfileCreateRequest;
import com.example.voiceprint_backend.dto.web.ProfileResponse;
import com.example.voiceprint_backend.dto.web.RenameProfileRequest;
import com.example.voiceprint_backend.service.SpeakerMergeService;
import com.example.voiceprint_backend.service.SpeakerProfileService;
import com.example.voiceprint_backend.service.SpeakerQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/v1/speaker-profiles")
@Validated
public class SpeakerProfileController {

    private final SpeakerProfileService profileService;
    private final SpeakerMergeService mergeService;
    private final SpeakerQueryService queryService;

    public SpeakerProfileController(SpeakerProfileService profileService,
                                    SpeakerMergeService mergeService,
                                    SpeakerQueryService queryService) {
        this.profileService = profileService;
        this.mergeService = mergeService;
        this.queryService = queryService;
    }

    @GetMapping
    public List<ProfileResponse> list(@RequestParam String ownerExternalSubject) {
        return profileService.list(ownerExternalSubject).stream().map(ProfileResponse::from).toList();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ProfileResponse create(@RequestParam String ownerExternalSubject,
                                  @Valid @RequestBody ProfileCreateRequest request) {
        return ProfileResponse.from(profileService.create(ownerExternalSubject, request.name()));
    }

    @GetMapping("/{profileId}")
    public ProfileResponse get(@PathVariable UUID profileId, @RequestParam String ownerExternalSubject) {
        return ProfileResponse.from(profileService.getOwned(profileId, ownerExternalSubject));
    }

    @DeleteMapping("/{profileId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable UUID profileId, @RequestParam String ownerExternalSubject) {
        profileService.delete(ownerExternalSubject, profileId);
    }

    @Operation(summary = "Name a profile and propagate the name to matching speakers in other media")
    @ApiResponse(responseCode = "200", description = "Profile renamed and verified")
    @ApiResponse(responseCode = "404", description = "Profile does not exist or was merged away")
    @ApiResponse(responseCode = "409", description = "Concurrent modification kept conflicting")
    @PutMapping("/{profileId}/name")
    public ProfileResponse rename(@PathVariable UUID profileId,
                                  @RequestParam String ownerExternalSubject,
                                  @Valid @RequestBody RenameProfileRequest request) {
        return ProfileResponse.from(profileService.rename(ownerExternalSubject, profileId, request.name()));
    }

    @GetMapping("/{profileId}/occurrences")
    public List<CrossMediaOccurrence> occurrences(@PathVariable UUID profileId,
                                                  @RequestParam String ownerExternalSubject) {
        return queryService.occurrences(ownerExternalSubject, profileId);
    }

    @PostMapping("/{profileId}/refresh-stats")
    public ProfileResponse refreshStats(@PathVariable UUID profileId, @RequestParam String ownerExternalSubject) {
        return ProfileResponse.from(profileService.refreshStats(ownerExternalSubject, profileId));
    }

    @Operation(summary = "Merge source profiles into a target profile")
    @ApiResponse(responseCode = "200", description = "Per-source outcome, including partial and total failure")
    @ApiResponse(responseCode = "400", description = "Empty, duplicate or self-referencing source list")
    @ApiResponse(responseCode = "404", description = "Target profile does not exist")
    @PostMapping("/merge")
    public MergeResult merge(@RequestParam String ownerExternalSubject,
                             @Valid @RequestBody MergeRequest request) {
        return mergeService.merge(ownerExternalSubject, request.sourceProfileIds(), request.targetProfileId());
    }
}
