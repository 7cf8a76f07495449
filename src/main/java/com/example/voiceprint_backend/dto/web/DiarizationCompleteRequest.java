package com.example.voiceprint_backend.dto.web;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

/** Completion event; when {@code speakers} is absent the result is pulled from the diarization service. */
public record DiarizationCompleteRequest(List<@Valid Speaker> speakers) {

    public record Speaker(@NotBlank String perFileLabel,
                          @NotNull float[] embedding,
                          List<@Valid Segment> segments) {
    }

    public record Segment(@PositiveOrZero long startMs, @PositiveOrZero long endMs, String text) {
    }
}
