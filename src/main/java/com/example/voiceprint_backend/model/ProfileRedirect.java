package com.example.voiceprint_backend.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/** Forwarding record left behind by a merge: writes aimed at the source go to the target. */
@Entity
@Table(name = "profile_redirect", indexes = {
        @Index(name = "idx_profile_redirect_created", columnList = "created_at")
})
public class ProfileRedirect {
    @Id
    @Column(name = "source_profile_id", nullable = false, updatable = false)
    private UUID sourceProfileId;

    @Column(name = "target_profile_id", nullable = false)
    private UUID targetProfileId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected ProfileRedirect() {
    }

    public ProfileRedirect(UUID sourceProfileId, UUID targetProfileId, Instant createdAt) {
        this.sourceProfileId = sourceProfileId;
        this.targetProfileId = targetProfileId;
        this.createdAt = createdAt;
    }

    public UUID getSourceProfileId() { return sourceProfileId; }
    public UUID getTargetProfileId() { return targetProfileId; }
    public void setTargetProfileId(UUID targetProfileId) { this.targetProfileId = targetProfileId; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
