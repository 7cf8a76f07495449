package com.example.voiceprint_backend.repository;

import com.example.voiceprint_backend.model.Media;
import com.example.voiceprint_backend.model.MediaSpeaker;
import com.example.voiceprint_backend.model.SpeakerProfile;
import com.example.voiceprint_backend.model.TranscriptSegment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface TranscriptSegmentRepository extends JpaRepository<TranscriptSegment, UUID> {

    List<TranscriptSegment> findByMediaOrderByStartMsAsc(Media media);

    long countByProfile(SpeakerProfile profile);

    @Query("select coalesce(sum(t.endMs - t.startMs), 0L) from TranscriptSegment t where t.profile = :profile")
    Long sumTalkTimeMs(@Param("profile") SpeakerProfile profile);

    @Modifying(flushAutomatically = true)
    @Query("update TranscriptSegment t set t.profile = :target where t.profile = :source")
    int reassignProfile(@Param("source") SpeakerProfile source, @Param("target") SpeakerProfile target);

    @Modifying(flushAutomatically = true)
    @Query("update TranscriptSegment t set t.profile = null where t.profile = :profile")
    int detachProfile(@Param("profile") SpeakerProfile profile);

    @Modifying(flushAutomatically = true)
    @Query("update TranscriptSegment t set t.profile = :profile where t.speaker = :speaker")
    int repointSpeaker(@Param("speaker") MediaSpeaker speaker, @Param("profile") SpeakerProfile profile);

    @Modifying(flushAutomatically = true)
    @Query("delete from TranscriptSegment t where t.media = :media")
    int deleteByMedia(@Param("media") Media media);
}
