package com.example.voiceprint_backend.matcher;

import java.util.UUID;

/**
 * One stored voiceprint as seen by the matcher.
 *
 * @param embeddingId id of the stored embedding.
 * @param mediaId     media item the voiceprint was extracted from.
 * @param vector      the vector itself.
 */
public record Voiceprint(UUID embeddingId, UUID mediaId, float[] vector) {
}
