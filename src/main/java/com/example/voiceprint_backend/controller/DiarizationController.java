package com.example.voiceprint_backend.controller;

import com.example.voiceprint_backend.dto.web.DiarizationCompleteRequest;
import com.example.voiceprint_backend.engine.Interfaces.DiarizationEngine;
import com.example.voiceprint_backend.service.DiarizationWorker;
import com.example.voiceprint_backend.service.MediaService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/v1/media/{mediaId}/diarization")
@Validated
public class DiarizationController {

    private final DiarizationWorker worker;
    private final MediaService mediaService;

    public DiarizationController(DiarizationWorker worker, MediaService mediaService) {
        this.worker = worker;
        this.mediaService = mediaService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Object> onDiarizationComplete(@PathVariable UUID mediaId,
                                                     @RequestParam String ownerExternalSubject,
                                                     @Valid @RequestBody(required = false) DiarizationCompleteRequest request) {
        mediaService.getOwned(mediaId, ownerExternalSubject);
        List<DiarizationEngine.DiarizedSpeaker> pushed = request == null || request.speakers() == null
                ? null
                : request.speakers().stream().map(DiarizationController::toSpeaker).toList();
        worker.submit(mediaId, pushed);
        return Map.of("mediaId", mediaId, "status", "DIARIZING", "pushed", pushed == null ? 0 : pushed.size());
    }

    private static DiarizationEngine.DiarizedSpeaker toSpeaker(DiarizationCompleteRequest.Speaker s) {
        List<DiarizationEngine.Segment> segments = s.segments() == null ? List.of() : s.segments().stream()
                .map(seg -> new DiarizationEngine.Segment(seg.startMs(), seg.endMs(), seg.text()))
                .toList();
        return new DiarizationEngine.DiarizedSpeaker(s.perFileLabel(), s.embedding(), segments);
    }
}
