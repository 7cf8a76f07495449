package com.example.voiceprint_backend.service;

import com.example.voiceprint_backend.config.WorkerExecutorProperties;
import com.example.voiceprint_backend.dto.IngestResult;
import com.example.voiceprint_backend.engine.Interfaces.DiarizationEngine;
import com.example.voiceprint_backend.engine.Interfaces.DiarizationEngine.DiarizedSpeaker;
import com.example.voiceprint_backend.exception.DiarizationException;
import com.example.voiceprint_backend.exception.InvalidEmbeddingException;
import com.example.voiceprint_backend.model.Account;
import com.example.voiceprint_backend.model.Media;
import com.example.voiceprint_backend.util.MediaStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DiarizationWorkerTest {

    @Mock
    private DiarizationIngestService ingestService;
    @Mock
    private DiarizationEngine engine;
    @Mock
    private MediaService mediaService;

    private final UUID mediaId = UUID.randomUUID();
    private final List<DiarizedSpeaker> pushed =
            List.of(new DiarizedSpeaker("SPEAKER_00", new float[]{0.1f, 0.2f}, List.of()));

    private DiarizationWorker worker;

    @BeforeEach
    void setUp() {
        worker = workerOn(Runnable::run);
    }

    @Test
    void pushedSpeakersAreIngestedWithoutCallingTheEngine() {
        when(ingestService.ingest(mediaId, pushed)).thenReturn(new IngestResult(mediaId, 0, 0, 1, 0, List.of()));

        worker.submit(mediaId, pushed);

        InOrder order = inOrder(mediaService, ingestService);
        order.verify(mediaService).setStatus(mediaId, MediaStatus.DIARIZING);
        order.verify(ingestService).ingest(mediaId, pushed);
        verifyNoInteractions(engine);
    }

    @Test
    void speakersArePulledWhenNonePushed() {
        Media media = new Media(new Account("owner", "Owner"), "call");
        media.setObjectKey("raw/call.wav");
        when(mediaService.get(mediaId)).thenReturn(media);
        when(engine.diarize(new DiarizationEngine.Request(mediaId, "raw/call.wav")))
                .thenReturn(new DiarizationEngine.Result(pushed, "pyannote"));
        when(ingestService.ingest(mediaId, pushed)).thenReturn(new IngestResult(mediaId, 1, 0, 0, 0, List.of()));

        IngestResult result = worker.process(mediaId, List.of());

        assertThat(result.autoAccepted()).isEqualTo(1);
    }

    @Test
    void engineFailureMarksMediaFailed() {
        when(mediaService.get(mediaId)).thenReturn(new Media(new Account("owner", "Owner"), "call"));
        when(engine.diarize(any())).thenThrow(new DiarizationException("diarization service returned 502"));

        worker.submit(mediaId, null);

        verify(mediaService).setStatus(mediaId, MediaStatus.FAILED);
        verify(ingestService, never()).ingest(any(), any());
    }

    @Test
    void invalidPushedVoiceprintIsRejectedUpFront() {
        List<DiarizedSpeaker> broken = List.of(new DiarizedSpeaker("SPEAKER_07", new float[]{Float.NaN}, List.of()));

        assertThatThrownBy(() -> worker.submit(mediaId, broken))
                .isInstanceOf(InvalidEmbeddingException.class)
                .satisfies(e -> assertThat(((InvalidEmbeddingException) e).getErrorText()).startsWith("Speaker SPEAKER_07"));
        verifyNoInteractions(mediaService, ingestService);
    }

    @Test
    void fullQueueIsReportedAsUnavailable() {
        worker = workerOn(task -> {
            throw new TaskRejectedException("queue full");
        });

        assertThatThrownBy(() -> worker.submit(mediaId, pushed))
                .isInstanceOfSatisfying(ResponseStatusException.class,
                        e -> assertThat(e.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE));
        verify(mediaService).setStatus(mediaId, MediaStatus.FAILED);
    }

    private DiarizationWorker workerOn(Executor executor) {
        WorkerExecutorProperties props = new WorkerExecutorProperties();
        props.setDiarize(new WorkerExecutorProperties.Concurrency(1));
        return new DiarizationWorker(ingestService, engine, mediaService, executor, props);
    }
}
