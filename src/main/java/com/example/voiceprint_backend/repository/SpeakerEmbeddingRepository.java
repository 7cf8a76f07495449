package com.example.voiceprint_backend.repository;

import com.example.voiceprint_backend.model.Media;
import com.example.voiceprint_backend.model.SpeakerEmbedding;
import com.example.voiceprint_backend.model.SpeakerProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SpeakerEmbeddingRepository extends JpaRepository<SpeakerEmbedding, UUID> {

    Optional<SpeakerEmbedding> findByMediaAndSpeakerLabel(Media media, String speakerLabel);

    List<SpeakerEmbedding> findByProfile(SpeakerProfile profile);

    List<SpeakerEmbedding> findByMedia(Media media);

    long countByProfile(SpeakerProfile profile);

    @Query("select count(distinct e.media.id) from SpeakerEmbedding e where e.profile = :profile")
    long countDistinctMediaByProfile(@Param("profile") SpeakerProfile profile);

    /** Matcher snapshot: every voiceprint of one owner with its profile. */
    @Query("""
           select e from SpeakerEmbedding e
           join fetch e.profile p
           where p.owner.id = :ownerId
           order by p.id, e.createdAt
           """)
    List<SpeakerEmbedding> findAllByOwnerId(@Param("ownerId") UUID ownerId);

    @Query("""
           select e from SpeakerEmbedding e
           join fetch e.profile p
           where p.id = :profileId
           order by e.createdAt
           """)
    List<SpeakerEmbedding> findAllByProfileId(@Param("profileId") UUID profileId);

    @Query("select distinct e.profile.id from SpeakerEmbedding e where e.media = :media")
    List<UUID> findProfileIdsByMedia(@Param("media") Media media);

    @Query("select count(e) > 0 from SpeakerEmbedding e where e.profile.id = :profileId and e.media.id = :mediaId")
    boolean existsByProfileIdAndMediaId(@Param("profileId") UUID profileId, @Param("mediaId") UUID mediaId);
}
