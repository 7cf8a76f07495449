package com.example.voiceprint_backend.model;

import com.example.voiceprint_backend.util.VerificationState;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

/**
 * A persistent speaker identity spanning the media items of one owner.
 * Aggregate counters are derived data and are recomputed from embeddings and segments.
 */
@Entity
@Table(name = "speaker_profile", indexes = {
        @Index(name = "idx_speaker_profile_owner", columnList = "owner_id")
})
public class SpeakerProfile {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "owner_id", nullable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_speaker_profile_owner"))
    private Account owner;

    @Column(name = "display_name", length = 200)
    private String displayName;

    @Enumerated(EnumType.STRING)
    @Column(name = "verification_state", nullable = false, length = 16)
    private VerificationState verificationState = VerificationState.UNVERIFIED;

    @Column(name = "embedding_count", nullable = false)
    private int embeddingCount;

    @Column(name = "media_count", nullable = false)
    private int mediaCount;

    @Column(name = "segment_count", nullable = false)
    private long segmentCount;

    @Column(name = "talk_time_ms", nullable = false)
    private long talkTimeMs;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public SpeakerProfile() {
    }

    public SpeakerProfile(Account owner, String displayName) {
        this.owner = owner;
        this.displayName = displayName;
    }

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }
    public Account getOwner() { return owner; }
    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) { this.displayName = displayName; }
    public VerificationState getVerificationState() { return verificationState; }
    public void setVerificationState(VerificationState verificationState) { this.verificationState = verificationState; }
    public int getEmbeddingCount() { return embeddingCount; }
    public void setEmbeddingCount(int embeddingCount) { this.embeddingCount = embeddingCount; }
    public int getMediaCount() { return mediaCount; }
    public void setMediaCount(int mediaCount) { this.mediaCount = mediaCount; }
    public long getSegmentCount() { return segmentCount; }
    public void setSegmentCount(long segmentCount) { this.segmentCount = segmentCount; }
    public long getTalkTimeMs() { return talkTimeMs; }
    public void setTalkTimeMs(long talkTimeMs) { this.talkTimeMs = talkTimeMs; }
    public long getVersion() { return version; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public boolean isNamed() {
        return displayName != null && !displayName.isBlank();
    }

    public boolean isOwnedBy(Account account) {
        return account != null && owner != null && owner.getId().equals(account.getId());
    }
}
