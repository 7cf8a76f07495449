package com.example.voiceprint_backend.dto;

import java.util.List;
import java.util.UUID;

public record IngestResult(UUID mediaId,
                           int autoAccepted,
                           int pending,
                           int unassigned,
                           int skipped,
                           List<String> failures) {

    public int created() {
        return autoAccepted + pending + unassigned;
    }
}
