package com.example.voiceprint_backend.service;

import com.example.voiceprint_backend.config.SpeakerMatchingProperties;
import com.example.voiceprint_backend.repository.ProfileRedirectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Purges merge redirects once in-flight writes can no longer reference the absorbed profile.
 */
@Service
public class ProfileRedirectCleanupService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProfileRedirectCleanupService.class);

    private final ProfileRedirectRepository redirectRepo;
    private final SpeakerMatchingProperties props;
    private final Clock clock;

    public ProfileRedirectCleanupService(ProfileRedirectRepository redirectRepo,
                                         SpeakerMatchingProperties props,
                                         Clock clock) {
        this.redirectRepo = redirectRepo;
        this.props = props;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${speakers.matching.redirect-cleanup-interval-ms:60000}")
    @Transactional
    public void purgeExpired() {
        Instant cutoff = clock.instant().minus(props.getRedirectTtl());
        int removed = redirectRepo.deleteOlderThan(cutoff);
        if (removed > 0) {
            LOGGER.info("REDIRECT cleanup removed={} cutoff={}", removed, cutoff);
        } else {
            LOGGER.debug("REDIRECT cleanup tick, nothing expired");
        }
    }
}
