package com.example.voiceprint_backend.config;

import com.example.voiceprint_backend.matcher.SimilarityMetric;
import com.example.voiceprint_backend.matcher.TierPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Thresholds, metric and time budgets for speaker matching.
 */
@ConfigurationProperties(prefix = "speakers.matching")
public class SpeakerMatchingProperties {

    private double highThreshold = 0.75;
    private double mediumThreshold = 0.50;
    private SimilarityMetric metric = SimilarityMetric.SHIFTED_COSINE;
    private Duration baseTimeout = Duration.ofMillis(250);
    private Duration perProfileTimeout = Duration.ofMillis(2);
    private int alternativesLimit = 5;
    private int conflictRetries = 3;
    private Duration redirectTtl = Duration.ofMinutes(10);

    public double getHighThreshold() {
        return highThreshold;
    }

    public void setHighThreshold(double highThreshold) {
        this.highThreshold = highThreshold;
    }

    public double getMediumThreshold() {
        return mediumThreshold;
    }

    public void setMediumThreshold(double mediumThreshold) {
        this.mediumThreshold = mediumThreshold;
    }

    public SimilarityMetric getMetric() {
        return metric;
    }

    public void setMetric(SimilarityMetric metric) {
        this.metric = metric;
    }

    public Duration getBaseTimeout() {
        return baseTimeout;
    }

    public void setBaseTimeout(Duration baseTimeout) {
        this.baseTimeout = baseTimeout;
    }

    public Duration getPerProfileTimeout() {
        return perProfileTimeout;
    }

    public void setPerProfileTimeout(Duration perProfileTimeout) {
        this.perProfileTimeout = perProfileTimeout;
    }

    public int getAlternativesLimit() {
        return alternativesLimit;
    }

    public void setAlternativesLimit(int alternativesLimit) {
        this.alternativesLimit = alternativesLimit;
    }

    public int getConflictRetries() {
        return conflictRetries;
    }

    public void setConflictRetries(int conflictRetries) {
        this.conflictRetries = conflictRetries;
    }

    public Duration getRedirectTtl() {
        return redirectTtl;
    }

    public void setRedirectTtl(Duration redirectTtl) {
        this.redirectTtl = redirectTtl;
    }

    public TierPolicy tierPolicy() {
        return new TierPolicy(highThreshold, mediumThreshold);
    }
}
