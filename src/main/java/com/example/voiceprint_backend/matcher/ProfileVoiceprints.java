package com.example.voiceprint_backend.matcher;

import com.example.voiceprint_backend.util.VerificationState;

import java.util.List;
import java.util.UUID;

/**
 * Snapshot of one profile and every voiceprint it owns, taken before matching.
 *
 * @param profileId   profile id.
 * @param displayName profile name, {@code null} for unnamed placeholders.
 * @param state       verification state at snapshot time.
 * @param voiceprints owned voiceprints, in no particular order.
 */
public record ProfileVoiceprints(UUID profileId,
                                 String displayName,
                                 VerificationState state,
                                 List<Voiceprint> voiceprints) {

    public ProfileVoiceprints {
        voiceprints = voiceprints == null ? List.of() : List.copyOf(voiceprints);
    }
}
