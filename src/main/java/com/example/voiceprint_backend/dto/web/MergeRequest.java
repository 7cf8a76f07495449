package com.example.voiceprint_backend.dto.web;

import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.UUID;

public record MergeRequest(@NotNull List<UUID> sourceProfileIds, @NotNull UUID targetProfileId) {
}
