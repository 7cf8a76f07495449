package com.example.voiceprint_backend.engine;

import com.example.voiceprint_backend.config.DiarizationProperties;
import com.example.voiceprint_backend.engine.Interfaces.DiarizationEngine;
import com.example.voiceprint_backend.exception.DiarizationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

/**
 * Pulls a finished diarization result from the external diarization service.
 */
@Component
public class HttpDiarizationEngine implements DiarizationEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpDiarizationEngine.class);

    record SpeakersResponse(List<DiarizedSpeaker> speakers) {}

    private final WebClient client;
    private final Duration timeout;

    public HttpDiarizationEngine(@Qualifier("diarizationWebClient") WebClient client, DiarizationProperties props) {
        this.client = client;
        this.timeout = Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds()));
    }

    @Override
    public Result diarize(Request req) {
        long start = System.currentTimeMillis();
        SpeakersResponse response;
        try {
            response = client.get()
                    .uri("/v1/diarization/{mediaId}", req.mediaId())
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp ->
                            resp.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .map(body -> new DiarizationException(
                                            "Diarization error " + resp.statusCode() + ": " + body)))
                    .bodyToMono(SpeakersResponse.class)
                    .timeout(timeout)
                    .block();
        } catch (DiarizationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DiarizationException("Diarization request failed for media " + req.mediaId(), e);
        }
        List<DiarizedSpeaker> speakers = response == null || response.speakers() == null ? List.of() : response.speakers();
        LOGGER.debug("DIARIZATION pulled mediaId={} speakers={} in {} ms",
                req.mediaId(), speakers.size(), System.currentTimeMillis() - start);
        return new Result(speakers, "http");
    }
}
