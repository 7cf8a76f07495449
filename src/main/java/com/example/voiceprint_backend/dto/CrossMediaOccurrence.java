package com.example.voiceprint_backend.dto;

import java.util.UUID;

/**
 * One media item a profile appears in.
 *
 * @param pending {@code true} when the row is an open medium-confidence suggestion rather
 *                than an owned voiceprint.
 */
public record CrossMediaOccurrence(UUID profileId,
                                   UUID mediaItemId,
                                   String mediaTitle,
                                   UUID mediaSpeakerId,
                                   String perFileLabel,
                                   double score,
                                   boolean verified,
                                   boolean pending) {
}
