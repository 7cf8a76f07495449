package com.example.voiceprint_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.Check;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
        name = "transcript_segment",
        indexes = {
                @Index(name = "idx_transcript_segment_media", columnList = "media_id, start_ms"),
                @Index(name = "idx_transcript_segment_profile", columnList = "profile_id")
        }
)
@Check(constraints = "end_ms > start_ms")
public class TranscriptSegment {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "media_id", nullable = false,
            foreignKey = @ForeignKey(name = "fk_transcript_segment_media"))
    private Media media;
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "speaker_id", nullable = false,
            foreignKey = @ForeignKey(name = "fk_transcript_segment_speaker"))
    private MediaSpeaker speaker;
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "profile_id",
            foreignKey = @ForeignKey(name = "fk_transcript_segment_profile"))
    private SpeakerProfile profile;
    @Column(name = "start_ms", nullable = false)
    private Long startMs;
    @Column(name = "end_ms", nullable = false)
    private Long endMs;
    @Column(name = "segment_text", columnDefinition = "text")
    private String text;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public TranscriptSegment() {
    }

    public TranscriptSegment(MediaSpeaker speaker, long startMs, long endMs, String text) {
        this.media = speaker.getMedia();
        this.speaker = speaker;
        this.profile = speaker.getProfile();
        this.startMs = startMs;
        this.endMs = endMs;
        this.text = text;
    }

    public UUID getId() { return id; }
    public Media getMedia() { return media; }
    public MediaSpeaker getSpeaker() { return speaker; }
    public SpeakerProfile getProfile() { return profile; }
    public void setProfile(SpeakerProfile profile) { this.profile = profile; }
    public long getStartMs() { return startMs; }
    public long getEndMs() { return endMs; }
    public String getText() { return text; }
    public Instant getCreatedAt() { return createdAt; }
}
