package com.example.voiceprint_backend.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool for {@link com.example.voiceprint_backend.service.DiarizationWorker}. Intake jobs
 * never run on the request thread; a full queue is rejected so the caller sees a 503.
 */
@Configuration
@EnableConfigurationProperties(WorkerExecutorProperties.class)
public class WorkerExecutorConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerExecutorConfig.class);

    @Bean(name = "speakerTaskExecutor")
    public ThreadPoolTaskExecutor speakerTaskExecutor(WorkerExecutorProperties properties) {
        int threads = Math.max(properties.getExecutorThreads(), properties.getDiarize().getMaxConcurrency());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(properties.getExecutorQueueCapacity());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setThreadNamePrefix("speaker-intake-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(properties.getShutdownGraceSeconds());
        executor.initialize();
        LOGGER.info("Speaker intake pool threads={} queue={} diarizeConcurrency={}",
                threads, properties.getExecutorQueueCapacity(), properties.getDiarize().getMaxConcurrency());
        return executor;
    }
}
