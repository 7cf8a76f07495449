package com.example.voiceprint_backend.repository;

import com.example.voiceprint_backend.model.Media;
import com.example.voiceprint_backend.model.MediaSpeaker;
import com.example.voiceprint_backend.model.SpeakerEmbedding;
import com.example.voiceprint_backend.model.SpeakerProfile;
import com.example.voiceprint_backend.util.SpeakerAssignment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface MediaSpeakerRepository extends JpaRepository<MediaSpeaker, UUID> {

    Optional<MediaSpeaker> findByEmbedding(SpeakerEmbedding embedding);

    List<MediaSpeaker> findByMediaOrderBySpeakerLabelAsc(Media media);

    List<MediaSpeaker> findBySuggestedProfile(SpeakerProfile profile);

    @Query("""
           select s from MediaSpeaker s
           join fetch s.embedding e
           join fetch e.profile p
           join fetch s.media m
           where s.id = :id
           """)
    Optional<MediaSpeaker> findByIdWithEmbedding(@Param("id") UUID id);

    /** Speakers whose voiceprint is owned by the profile. */
    @Query("""
           select s from MediaSpeaker s
           join fetch s.embedding e
           join fetch s.media m
           where e.profile = :profile
           order by m.createdAt, s.speakerLabel
           """)
    List<MediaSpeaker> findOwnedBy(@Param("profile") SpeakerProfile profile);

    /** Speakers holding a pending suggestion for the profile. */
    @Query("""
           select s from MediaSpeaker s
           join fetch s.media m
           where s.suggestedProfile = :profile
           order by m.createdAt, s.speakerLabel
           """)
    List<MediaSpeaker> findSuggestingProfile(@Param("profile") SpeakerProfile profile);

    @Query("""
           select s.id from MediaSpeaker s
           where s.media.owner.id = :ownerId
             and s.assignment in :assignments
           order by s.createdAt
           """)
    List<UUID> findIdsByOwnerAndAssignmentIn(@Param("ownerId") UUID ownerId,
                                             @Param("assignments") Collection<SpeakerAssignment> assignments);
}
