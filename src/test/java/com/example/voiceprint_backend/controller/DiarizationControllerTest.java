package com.example.voiceprint_backend.controller;

import com.example.voiceprint_backend.engine.Interfaces.DiarizationEngine.DiarizedSpeaker;
import com.example.voiceprint_backend.exception.InvalidEmbeddingException;
import com.example.voiceprint_backend.service.DiarizationWorker;
import com.example.voiceprint_backend.service.MediaService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = DiarizationController.class)
@AutoConfigureMockMvc(addFilters = false)
class DiarizationControllerTest {

    private static final String OWNER = "demo-user-1";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private DiarizationWorker worker;

    @MockitoBean
    private MediaService mediaService;

    @Test
    @SuppressWarnings("unchecked")
    void pushedSpeakersAreQueued() throws Exception {
        UUID mediaId = UUID.randomUUID();
        String body = """
                {"speakers":[{"perFileLabel":"SPEAKER_00","embedding":[0.1,0.2,0.3],
                  "segments":[{"startMs":0,"endMs":1500,"text":"hello"}]}]}
                """;

        mockMvc.perform(post("/v1/media/{id}/diarization", mediaId)
                        .param("ownerExternalSubject", OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("DIARIZING"))
                .andExpect(jsonPath("$.pushed").value(1));

        ArgumentCaptor<List<DiarizedSpeaker>> captor = ArgumentCaptor.forClass(List.class);
        verify(worker).submit(eq(mediaId), captor.capture());
        DiarizedSpeaker speaker = captor.getValue().get(0);
        assertThat(speaker.label()).isEqualTo("SPEAKER_00");
        assertThat(speaker.embedding()).containsExactly(0.1f, 0.2f, 0.3f);
        assertThat(speaker.segments()).singleElement().satisfies(s -> assertThat(s.endMs()).isEqualTo(1500));
    }

    @Test
    void emptyEventPullsFromTheDiarizationService() throws Exception {
        UUID mediaId = UUID.randomUUID();

        mockMvc.perform(post("/v1/media/{id}/diarization", mediaId)
                        .param("ownerExternalSubject", OWNER))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.pushed").value(0));

        verify(worker).submit(eq(mediaId), isNull());
    }

    @Test
    void invalidVoiceprintIsBadRequest() throws Exception {
        UUID mediaId = UUID.randomUUID();
        doThrow(new InvalidEmbeddingException("Speaker SPEAKER_00: Voiceprint has zero norm"))
                .when(worker).submit(eq(mediaId), any());

        mockMvc.perform(post("/v1/media/{id}/diarization", mediaId)
                        .param("ownerExternalSubject", OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"speakers\":[{\"perFileLabel\":\"SPEAKER_00\",\"embedding\":[0,0]}]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void mediaOfAnotherOwnerIsForbidden() throws Exception {
        UUID mediaId = UUID.randomUUID();
        when(mediaService.getOwned(mediaId, OWNER))
                .thenThrow(new ResponseStatusException(HttpStatus.FORBIDDEN, "MEDIA_NOT_OWNED"));

        mockMvc.perform(post("/v1/media/{id}/diarization", mediaId)
                        .param("ownerExternalSubject", OWNER))
                .andExpect(status().isForbidden());

        verifyNoInteractions(worker);
    }
}
