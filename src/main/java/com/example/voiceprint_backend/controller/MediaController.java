package com.example.voiceprint_backend.controller;

import com.example.voiceprint_backend.dto.web.MediaCreateRequest;
import com.example.voiceprint_backend.dto.web.MediaResponse;
import com.example.voiceprint_backend.model.Media;
import com.example.voiceprint_backend.service.MediaService;
import com.example.voiceprint_backend.util.MediaStatus;
import jakarta.validation.Valid;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

@RestController
@RequestMapping("/v1/media")
public class MediaController {
    private final MediaService mediaService;

    public MediaController(MediaService mediaService) {
        this.mediaService = mediaService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public MediaResponse register(@Valid @RequestBody MediaCreateRequest request) {
        Media media = mediaService.register(request.ownerExternalSubject(), request.title(),
                request.objectKey(), request.durationMs());
        return toResponse(media);
    }

    @GetMapping("/{id}")
    public MediaResponse get(@PathVariable UUID id, @RequestParam String ownerExternalSubject) {
        return toResponse(mediaService.getOwned(id, ownerExternalSubject));
    }

    @GetMapping
    public Page<MediaResponse> listByOwner(@RequestParam String ownerExternalSubject,
                                           @RequestParam(required = false) MediaStatus status,
                                           @RequestParam(defaultValue = "0") int page,
                                           @RequestParam(defaultValue = "10") int size) {
        if (page < 0 || size <= 0 || size > 200)
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "BAD_PAGINATION");
        return mediaService.listByOwner(ownerExternalSubject, status, PageRequest.of(page, size))
                .map(MediaController::toResponse);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable UUID id, @RequestParam String ownerExternalSubject) {
        mediaService.delete(id, ownerExternalSubject);
    }

    private static MediaResponse toResponse(Media m) {
        return new MediaResponse(m.getId(), m.getOwner().getId(), m.getTitle(), m.getObjectKey(), m.getDurationMs(),
                m.getStatus().name(), m.getSpeakerCountDetected(), m.getCreatedAt());
    }
}
