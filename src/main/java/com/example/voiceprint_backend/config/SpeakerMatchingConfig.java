package com.example.voiceprint_backend.config;

import com.example.voiceprint_backend.matcher.CosineSpeakerMatcher;
import com.example.voiceprint_backend.matcher.SpeakerMatcher;
import com.example.voiceprint_backend.matcher.TierPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(SpeakerMatchingProperties.class)
public class SpeakerMatchingConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(SpeakerMatchingConfig.class);

    /** UTC clock for matcher deadlines, verification timestamps and redirect expiry. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TierPolicy tierPolicy(SpeakerMatchingProperties props) {
        TierPolicy policy = props.tierPolicy();
        LOGGER.info("Speaker tiers high>={} medium>={} metric={}",
                policy.highThreshold(), policy.mediumThreshold(), props.getMetric());
        return policy;
    }

    @Bean
    public SpeakerMatcher speakerMatcher(SpeakerMatchingProperties props, Clock clock) {
        return new CosineSpeakerMatcher(props.getMetric(), props.getBaseTimeout(), props.getPerProfileTimeout(), clock);
    }
}
