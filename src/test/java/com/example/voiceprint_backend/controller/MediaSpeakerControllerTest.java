package com.example.voiceprint_backend.controller;

import com.example.voiceprint_backend.dto.SpeakerSuggestion;
import com.example.voiceprint_backend.dto.web.MediaSpeakerResponse;
import com.example.voiceprint_backend.exception.ProfileGoneException;
import com.example.voiceprint_backend.matcher.ConfidenceTier;
import com.example.voiceprint_backend.model.Account;
import com.example.voiceprint_backend.model.SpeakerProfile;
import com.example.voiceprint_backend.service.SpeakerQueryService;
import com.example.voiceprint_backend.service.SpeakerSuggestionService;
import com.example.voiceprint_backend.service.SpeakerVerificationService;
import com.example.voiceprint_backend.util.SpeakerAssignment;
import com.example.voiceprint_backend.util.VerificationState;
import com.example.voiceprint_backend.util.VerifyAction;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = MediaSpeakerController.class)
@AutoConfigureMockMvc(addFilters = false)
class MediaSpeakerControllerTest {

    private static final String OWNER = "demo-user-1";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private SpeakerSuggestionService suggestionService;

    @MockitoBean
    private SpeakerVerificationService verificationService;

    @MockitoBean
    private SpeakerQueryService queryService;

    @Test
    void suggestionsCarryTierAndRationale() throws Exception {
        UUID mediaId = UUID.randomUUID();
        UUID profileId = UUID.randomUUID();
        when(suggestionService.listSuggestions(OWNER, mediaId)).thenReturn(List.of(
                new SpeakerSuggestion(UUID.randomUUID(), "SPEAKER_00", profileId, "Alice", 0.62,
                        ConfidenceTier.MEDIUM, "best match 0.620 across 2 voiceprint(s) in 2 media item(s)", false)));

        mockMvc.perform(get("/v1/media/{id}/speakers/suggestions", mediaId)
                        .param("ownerExternalSubject", OWNER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].profileId").value(profileId.toString()))
                .andExpect(jsonPath("$[0].tier").value("MEDIUM"))
                .andExpect(jsonPath("$[0].autoAccepted").value(false));
    }

    @Test
    void speakersShowStatusText() throws Exception {
        UUID mediaId = UUID.randomUUID();
        when(queryService.speakersOf(OWNER, mediaId)).thenReturn(List.of(
                new MediaSpeakerResponse(UUID.randomUUID(), mediaId, "SPEAKER_01", "SPEAKER_01", UUID.randomUUID(),
                        SpeakerAssignment.UNASSIGNED, "Needs identification", null, null, null, null)));

        mockMvc.perform(get("/v1/media/{id}/speakers", mediaId)
                        .param("ownerExternalSubject", OWNER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].perFileLabel").value("SPEAKER_01"))
                .andExpect(jsonPath("$[0].statusText").value("Needs identification"));
    }

    @Test
    void acceptReturnsTheOwningProfile() throws Exception {
        UUID speakerId = UUID.randomUUID();
        UUID profileId = UUID.randomUUID();
        SpeakerProfile profile = new SpeakerProfile(new Account(OWNER, "Demo"), "Alice");
        profile.setId(profileId);
        profile.setVerificationState(VerificationState.VERIFIED);
        when(verificationService.verify(OWNER, speakerId, VerifyAction.ACCEPT, profileId, null)).thenReturn(profile);

        mockMvc.perform(post("/v1/speakers/{id}/verify", speakerId)
                        .param("ownerExternalSubject", OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("action", "ACCEPT", "profileId", profileId))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(profileId.toString()))
                .andExpect(jsonPath("$.verificationState").value("VERIFIED"));
    }

    @Test
    void verifyWithoutActionFailsValidation() throws Exception {
        mockMvc.perform(post("/v1/speakers/{id}/verify", UUID.randomUUID())
                        .param("ownerExternalSubject", OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Bob\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(verificationService);
    }

    @Test
    void acceptingAMergedAwayProfileIsAConflict() throws Exception {
        UUID speakerId = UUID.randomUUID();
        UUID gone = UUID.randomUUID();
        when(verificationService.verify(OWNER, speakerId, VerifyAction.ACCEPT, gone, null))
                .thenThrow(new ProfileGoneException(gone, null));

        mockMvc.perform(post("/v1/speakers/{id}/verify", speakerId)
                        .param("ownerExternalSubject", OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("action", "ACCEPT", "profileId", gone))))
                .andExpect(status().isConflict());
    }
}
