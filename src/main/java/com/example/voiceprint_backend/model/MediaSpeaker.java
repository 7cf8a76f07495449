package com.example.voiceprint_backend.model;

import com.example.voiceprint_backend.util.SpeakerAssignment;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Per-file view of a diarized label: the name shown in the transcript and the current
 * reconciliation state against the profile store.
 */
@Entity
@Table(name = "media_speaker",
        uniqueConstraints = @UniqueConstraint(name = "uq_media_speaker_label", columnNames = {"media_id", "speaker_label"}),
        indexes = {
                @Index(name = "idx_media_speaker_suggested", columnList = "suggested_profile_id"),
                @Index(name = "idx_media_speaker_assignment", columnList = "assignment")
        })
public class MediaSpeaker {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "media_id", nullable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_media_speaker_media"))
    private Media media;

    @Column(name = "speaker_label", nullable = false, updatable = false, length = 64)
    private String speakerLabel;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "embedding_id", nullable = false, unique = true, updatable = false,
            foreignKey = @ForeignKey(name = "fk_media_speaker_embedding"))
    private SpeakerEmbedding embedding;

    @Column(name = "display_name", length = 200)
    private String displayName;

    @Enumerated(EnumType.STRING)
    @Column(name = "assignment", nullable = false, length = 16)
    private SpeakerAssignment assignment = SpeakerAssignment.UNASSIGNED;

    @Column(name = "confidence", precision = 5, scale = 4)
    private BigDecimal confidence;

    @Column(name = "rationale", length = 512)
    private String rationale;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "suggested_profile_id",
            foreignKey = @ForeignKey(name = "fk_media_speaker_suggested"))
    private SpeakerProfile suggestedProfile;

    @Column(name = "verified_at")
    private Instant verifiedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public MediaSpeaker() {
    }

    public MediaSpeaker(SpeakerEmbedding embedding) {
        this.embedding = embedding;
        this.media = embedding.getMedia();
        this.speakerLabel = embedding.getSpeakerLabel();
    }

    public UUID getId() { return id; }
    public Media getMedia() { return media; }
    public String getSpeakerLabel() { return speakerLabel; }
    public SpeakerEmbedding getEmbedding() { return embedding; }
    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) { this.displayName = displayName; }
    public SpeakerAssignment getAssignment() { return assignment; }
    public BigDecimal getConfidence() { return confidence; }
    public String getRationale() { return rationale; }
    public SpeakerProfile getSuggestedProfile() { return suggestedProfile; }
    public Instant getVerifiedAt() { return verifiedAt; }
    public long getVersion() { return version; }
    public Instant getCreatedAt() { return createdAt; }

    /** Profile currently owning this speaker's voiceprint. */
    public SpeakerProfile getProfile() {
        return embedding.getProfile();
    }

    /** Name to show: the owning profile's name when it has one, the raw label otherwise. */
    public String effectiveName() {
        if (displayName != null && !displayName.isBlank()) return displayName;
        return speakerLabel;
    }

    public void markAutoAccepted(String name, BigDecimal confidence, String rationale) {
        this.assignment = SpeakerAssignment.AUTO_ACCEPTED;
        this.displayName = name;
        this.confidence = confidence;
        this.rationale = rationale;
        this.suggestedProfile = null;
        this.verifiedAt = null;
    }

    public void markPending(SpeakerProfile suggested, BigDecimal confidence, String rationale) {
        this.assignment = SpeakerAssignment.PENDING;
        this.suggestedProfile = suggested;
        this.confidence = confidence;
        this.rationale = rationale;
        this.verifiedAt = null;
    }

    public void markUnassigned() {
        this.assignment = SpeakerAssignment.UNASSIGNED;
        this.suggestedProfile = null;
        this.confidence = null;
        this.rationale = null;
        this.verifiedAt = null;
    }

    public void markVerified(String name, Instant at) {
        this.assignment = SpeakerAssignment.VERIFIED;
        this.displayName = name;
        this.suggestedProfile = null;
        this.verifiedAt = at;
    }

    /** Re-points a pending suggestion; a null target drops it and leaves the speaker unassigned. */
    public void redirectSuggestion(SpeakerProfile target) {
        if (target == null) {
            markUnassigned();
        } else {
            this.suggestedProfile = target;
        }
    }
}
