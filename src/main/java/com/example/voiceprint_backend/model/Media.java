package com.example.voiceprint_backend.model;

import com.example.voiceprint_backend.util.MediaStatus;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "media", indexes = {
        @Index(name = "idx_media_owner", columnList = "owner_id")
})
public class Media {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "owner_id", nullable = false,
            foreignKey = @ForeignKey(name = "fk_media_owner"))
    private Account owner;

    @Column(name = "title", length = 512)
    private String title;

    @Column(name = "object_key", length = 1024)
    private String objectKey;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private MediaStatus status = MediaStatus.REGISTERED;

    @Column(name = "speaker_count_detected")
    private Integer speakerCountDetected;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public Media() {
    }

    public Media(Account owner, String title) {
        this.owner = owner;
        this.title = title;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public Account getOwner() {
        return owner;
    }

    public void setOwner(Account owner) {
        this.owner = owner;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getObjectKey() {
        return objectKey;
    }

    public void setObjectKey(String objectKey) {
        this.objectKey = objectKey;
    }

    public Long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(Long durationMs) {
        this.durationMs = durationMs;
    }

    public MediaStatus getStatus() {
        return status;
    }

    public void setStatus(MediaStatus status) {
        this.status = status;
    }

    public Integer getSpeakerCountDetected() {
        return speakerCountDetected;
    }

    public void setSpeakerCountDetected(Integer speakerCountDetected) {
        this.speakerCountDetected = speakerCountDetected;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /** Title for display; falls back to the object key the way uploads are named. */
    public String displayTitle() {
        if (title != null && !title.isBlank()) return title;
        return objectKey != null ? objectKey : String.valueOf(id);
    }
}
