package com.example.voiceprint_backend.repository;

import com.example.voiceprint_backend.model.ProfileRedirect;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface ProfileRedirectRepository extends JpaRepository<ProfileRedirect, UUID> {

    List<ProfileRedirect> findByTargetProfileId(UUID targetProfileId);

    @Modifying
    @Query("delete from ProfileRedirect r where r.createdAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
