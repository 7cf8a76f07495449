package com.example.voiceprint_backend.engine.Interfaces;

import java.util.List;
import java.util.UUID;

public interface DiarizationEngine {
    record Request(UUID mediaId, String objectKey) {}
    record Segment(long startMs, long endMs, String text) {}
    record DiarizedSpeaker(String label, float[] embedding, List<Segment> segments) {
        public DiarizedSpeaker {
            segments = segments == null ? List.of() : List.copyOf(segments);
        }
    }
    record Result(List<DiarizedSpeaker> speakers, String provider) {}

    Result diarize(Request req);
}
