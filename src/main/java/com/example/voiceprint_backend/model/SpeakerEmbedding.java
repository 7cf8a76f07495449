package com.example.voiceprint_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

/**
 * Voiceprint extracted for one diarized label of one media item. Vector, media and label
 * are immutable; only the owning profile changes.
 */
@Entity
@Table(name = "speaker_embedding",
        uniqueConstraints = @UniqueConstraint(name = "uq_embedding_media_label", columnNames = {"media_id", "speaker_label"}),
        indexes = {
                @Index(name = "idx_embedding_profile", columnList = "profile_id")
        })
public class SpeakerEmbedding {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "media_id", nullable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_embedding_media"))
    private Media media;

    @Column(name = "speaker_label", nullable = false, updatable = false, length = 64)
    private String speakerLabel;

    @Convert(converter = VoiceprintConverter.class)
    @Column(name = "voiceprint", nullable = false, updatable = false, length = 16384)
    private float[] vector;

    @Column(name = "dimension", nullable = false, updatable = false)
    private int dimension;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "profile_id", nullable = false,
            foreignKey = @ForeignKey(name = "fk_embedding_profile"))
    private SpeakerProfile profile;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public SpeakerEmbedding() {
    }

    public SpeakerEmbedding(Media media, String speakerLabel, float[] vector, SpeakerProfile profile) {
        this.media = media;
        this.speakerLabel = speakerLabel;
        this.vector = vector.clone();
        this.dimension = vector.length;
        this.profile = profile;
    }

    public UUID getId() { return id; }
    public Media getMedia() { return media; }
    public String getSpeakerLabel() { return speakerLabel; }
    public float[] getVector() { return vector.clone(); }
    public int getDimension() { return dimension; }
    public SpeakerProfile getProfile() { return profile; }
    public void setProfile(SpeakerProfile profile) { this.profile = profile; }
    public long getVersion() { return version; }
    public Instant getCreatedAt() { return createdAt; }
}
