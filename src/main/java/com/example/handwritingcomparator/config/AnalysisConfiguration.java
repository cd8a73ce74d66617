package com.example.handwritingcomparator.config;

import com.example.handwritingcomparator.service.analysis.AnalysisProvider;
import com.example.handwritingcomparator.service.analysis.NoOpAnalysisProvider;
import com.example.handwritingcomparator.service.analysis.VisionChatAnalysisProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.util.StringUtils;

/**
 * Provides the {@link AnalysisProvider} and the executor its long running calls are parked on.
 * Without {@code comparator.analysis.enabled} and an API key the no-op provider is used; projects
 * that want a different model can replace the bean with their own configuration.
 */
@Configuration
public class AnalysisConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AnalysisConfiguration.class);

    @Bean
    public AnalysisProvider analysisProvider(ComparatorProperties properties,
                                             RestTemplateBuilder restTemplateBuilder,
                                             ObjectMapper objectMapper) {
        ComparatorProperties.Analysis analysis = properties.getAnalysis();
        if (!analysis.isEnabled()) {
            log.info("Using no-op analysis provider. Set comparator.analysis.enabled to request AI opinions.");
            return new NoOpAnalysisProvider();
        }
        if (!StringUtils.hasText(analysis.getApiKey())) {
            log.warn("AI analysis is enabled but comparator.analysis.api-key is empty; falling back to the no-op provider");
            return new NoOpAnalysisProvider();
        }
        log.info("Using vision chat analysis provider with model {} at {}", analysis.getModel(), analysis.getBaseUrl());
        return new VisionChatAnalysisProvider(
                restTemplateBuilder
                        .setConnectTimeout(Duration.ofSeconds(10))
                        .setReadTimeout(analysis.getTimeout())
                        .build(),
                objectMapper,
                analysis);
    }

    @Bean
    public ThreadPoolTaskExecutor analysisExecutor(ComparatorProperties properties) {
        int poolSize = Math.max(1, properties.getAnalysis().getPoolSize());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(poolSize * 4);
        executor.setThreadNamePrefix("ai-analysis-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
