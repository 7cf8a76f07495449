package com.example.voiceprint_backend.service;

import com.example.voiceprint_backend.config.WorkerExecutorProperties;
import com.example.voiceprint_backend.dto.IngestResult;
import com.example.voiceprint_backend.engine.Interfaces.DiarizationEngine;
import com.example.voiceprint_backend.engine.Interfaces.DiarizationEngine.DiarizedSpeaker;
import com.example.voiceprint_backend.exception.InvalidEmbeddingException;
import com.example.voiceprint_backend.matcher.Voiceprints;
import com.example.voiceprint_backend.model.Media;
import com.example.voiceprint_backend.util.MediaStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;

/**
 * Runs diarization intake jobs on the speaker executor, at most
 * {@code worker.diarize.max-concurrency} at a time.
 */
@Service
public class DiarizationWorker {
    private static final Logger LOGGER = LoggerFactory.getLogger(DiarizationWorker.class);

    private final DiarizationIngestService ingestService;
    private final DiarizationEngine diarizationEngine;
    private final MediaService mediaService;
    private final Executor speakerExecutor;
    private final Semaphore diarizeSemaphore;

    public DiarizationWorker(DiarizationIngestService ingestService,
                             DiarizationEngine diarizationEngine,
                             MediaService mediaService,
                             @Qualifier("speakerTaskExecutor") Executor speakerExecutor,
                             WorkerExecutorProperties workerProperties) {
        this.ingestService = ingestService;
        this.diarizationEngine = diarizationEngine;
        this.mediaService = mediaService;
        this.speakerExecutor = speakerExecutor;
        this.diarizeSemaphore = new Semaphore(Math.max(1, workerProperties.getDiarize().getMaxConcurrency()));
    }

    /**
     * Accepts a completion event. Pushed voiceprints are validated before the job is queued,
     * so a malformed vector is reported to the caller instead of failing in the background.
     */
    public void submit(UUID mediaId, List<DiarizedSpeaker> pushed) {
        if (pushed != null) {
            for (DiarizedSpeaker s : pushed) {
                try {
                    Voiceprints.validate(s.embedding());
                } catch (InvalidEmbeddingException e) {
                    throw new InvalidEmbeddingException("Speaker " + s.label() + ": " + e.getErrorText());
                }
            }
        }
        mediaService.setStatus(mediaId, MediaStatus.DIARIZING);
        try {
            speakerExecutor.execute(() -> runWithSemaphore(mediaId, pushed));
        } catch (TaskRejectedException e) {
            LOGGER.error("DIARIZE rejected mediaId={}: {}", mediaId, e.toString());
            mediaService.setStatus(mediaId, MediaStatus.FAILED);
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "DIARIZATION_QUEUE_FULL", e);
        }
    }

    private void runWithSemaphore(UUID mediaId, List<DiarizedSpeaker> pushed) {
        boolean acquired = false;
        long t0 = System.nanoTime();
        try {
            diarizeSemaphore.acquire();
            acquired = true;
            LOGGER.info("JOB START diarize mediaId={} pushed={}", mediaId, pushed != null);
            IngestResult result = process(mediaId, pushed);
            LOGGER.info("JOB DONE diarize mediaId={} created={} skipped={} failed={} in={}ms",
                    mediaId, result.created(), result.skipped(), result.failures().size(), (System.nanoTime() - t0) / 1_000_000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("JOB interrupted diarize mediaId={}", mediaId);
            mediaService.setStatus(mediaId, MediaStatus.FAILED);
        } catch (Exception e) {
            LOGGER.error("JOB FAILED diarize mediaId={}: {}", mediaId, e.toString(), e);
            mediaService.setStatus(mediaId, MediaStatus.FAILED);
        } finally {
            if (acquired) {
                diarizeSemaphore.release();
            }
        }
    }

    /** Ingests pushed speakers, or pulls them from the diarization service when none were pushed. */
    public IngestResult process(UUID mediaId, List<DiarizedSpeaker> pushed) {
        List<DiarizedSpeaker> speakers = pushed;
        if (speakers == null || speakers.isEmpty()) {
            Media media = mediaService.get(mediaId);
            speakers = diarizationEngine.diarize(new DiarizationEngine.Request(mediaId, media.getObjectKey())).speakers();
            LOGGER.debug("DIARIZE pulled mediaId={} speakers={}", mediaId, speakers.size());
        }
        return ingestService.ingest(mediaId, speakers);
    }
}
