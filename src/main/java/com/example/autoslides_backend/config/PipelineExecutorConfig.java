package com.example.autoslides_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Provides the bounded pool used by {@link com.example.autoslides_backend.service.PipelineOrchestrator}
 * for image searches and downloads.
 */
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineExecutorConfig {

    @Bean(name = "imageFetchExecutor")
    public ThreadPoolTaskExecutor imageFetchExecutor(PipelineProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, properties.getImageFetchThreads());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(Math.max(1, properties.getImageFetchQueueCapacity()));
        executor.setThreadNamePrefix("image-fetch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
