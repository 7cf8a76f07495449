package com.example.voiceprint_backend.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator diarizationHealth(@Qualifier("diarizationWebClient") WebClient diarization) {
        return () -> {
            try {
                diarization.head().uri("/")
                        .retrieve()
                        .toBodilessEntity()
                        .block(Duration.ofSeconds(2));
                return Health.up().withDetail("diarization", "ok").build();
            } catch (Exception e) {
                return Health.down(e).withDetail("diarization", "unreachable").build();
            }
        };
    }
}
