package com.example.voiceprint_backend.dto;

import java.util.List;
import java.util.UUID;

public record RetroactiveLabelingReport(UUID profileId,
                                        int scanned,
                                        int autoApplied,
                                        int suggested,
                                        int skipped,
                                        List<String> failures) {

    public static RetroactiveLabelingReport empty(UUID profileId) {
        return new RetroactiveLabelingReport(profileId, 0, 0, 0, 0, List.of());
    }

    public int failed() {
        return failures.size();
    }
}
