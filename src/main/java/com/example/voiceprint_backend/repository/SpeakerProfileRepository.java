package com.example.voiceprint_backend.repository;

import com.example.voiceprint_backend.model.Account;
import com.example.voiceprint_backend.model.SpeakerProfile;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SpeakerProfileRepository extends JpaRepository<SpeakerProfile, UUID> {

    List<SpeakerProfile> findByOwnerOrderByCreatedAtAsc(Account owner);

    @Query("""
           select p from SpeakerProfile p
           join fetch p.owner
           where p.id = :id
           """)
    Optional<SpeakerProfile> findByIdWithOwner(@Param("id") UUID id);

    /** Loads the profile and bumps its version on commit, so concurrent writers conflict. */
    @Lock(LockModeType.OPTIMISTIC_FORCE_INCREMENT)
    @Query("select p from SpeakerProfile p where p.id = :id")
    Optional<SpeakerProfile> findForUpdateById(@Param("id") UUID id);
}
