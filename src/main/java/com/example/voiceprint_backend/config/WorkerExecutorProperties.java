package com.example.voiceprint_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configures the executor and the concurrency limit for diarization intake jobs.
 */
@ConfigurationProperties(prefix = "worker")
public class WorkerExecutorProperties {

    private int executorThreads = 4;
    private int executorQueueCapacity = 100;
    private int shutdownGraceSeconds = 30;

    private Concurrency diarize = new Concurrency(2);

    public int getExecutorThreads() {
        return executorThreads;
    }

    public void setExecutorThreads(int executorThreads) {
        this.executorThreads = executorThreads;
    }

    public int getExecutorQueueCapacity() {
        return executorQueueCapacity;
    }

    public void setExecutorQueueCapacity(int executorQueueCapacity) {
        this.executorQueueCapacity = executorQueueCapacity;
    }

    public int getShutdownGraceSeconds() {
        return shutdownGraceSeconds;
    }

    public void setShutdownGraceSeconds(int shutdownGraceSeconds) {
        this.shutdownGraceSeconds = shutdownGraceSeconds;
    }

    public Concurrency getDiarize() {
        return diarize;
    }

    public void setDiarize(Concurrency diarize) {
        this.diarize = diarize;
    }

    public static class Concurrency {
        private int maxConcurrency = 1;

        public Concurrency() {
        }

        public Concurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
        }

        public int getMaxConcurrency() {
            return maxConcurrency;
        }

        public void setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
        }
    }
}
