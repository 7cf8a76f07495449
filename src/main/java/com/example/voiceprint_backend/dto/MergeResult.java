package com.example.voiceprint_backend.dto;

import com.example.voiceprint_backend.util.MergeStatus;

import java.util.List;
import java.util.UUID;

public record MergeResult(UUID targetProfileId,
                          MergeStatus status,
                          List<MergeSourceOutcome> succeeded,
                          List<MergeSourceOutcome> failed) {

    public static MergeResult of(UUID targetProfileId, List<MergeSourceOutcome> outcomes) {
        List<MergeSourceOutcome> ok = outcomes.stream().filter(MergeSourceOutcome::succeeded).toList();
        List<MergeSourceOutcome> ko = outcomes.stream().filter(o -> !o.succeeded()).toList();
        MergeStatus status = ko.isEmpty() ? MergeStatus.ALL_SUCCEEDED
                : ok.isEmpty() ? MergeStatus.ALL_FAILED
                : MergeStatus.PARTIAL;
        return new MergeResult(targetProfileId, status, ok, ko);
    }

    public String summary() {
        return switch (status) {
            case ALL_SUCCEEDED -> "merged " + succeeded.size() + " profile(s)";
            case ALL_FAILED -> "no profile merged, " + failed.size() + " failed";
            case PARTIAL -> "merged " + succeeded.size() + " profile(s), " + failed.size() + " failed";
        };
    }
}
