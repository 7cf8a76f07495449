package com.example.voiceprint_backend.repository;

import com.example.voiceprint_backend.model.Account;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

/** Owners are addressed by the subject issued by the identity provider, never by row id. */
public interface AccountRepository extends JpaRepository<Account, UUID> {
    Optional<Account> findByExternalSubject(String externalSubject);
}
