package com.communityintel.insights.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Worker pool running whole pipeline jobs. */
    @Bean
    public ThreadPoolTaskExecutor pipelineExecutor(InsightPipelineProperties properties) {
        InsightPipelineProperties.Scheduler cfg = properties.getScheduler();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(cfg.getWorkerPoolSize());
        executor.setMaxPoolSize(cfg.getWorkerPoolSize());
        executor.setQueueCapacity(cfg.getQueueCapacity());
        executor.setThreadNamePrefix("pipeline-job-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /** Shared pool for classification batches; bounds model concurrency across all running jobs. */
    @Bean
    public ThreadPoolTaskExecutor classificationExecutor(InsightPipelineProperties properties) {
        int size = Math.max(1, properties.getCategorization().getMaxConcurrentBatches());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setThreadNamePrefix("classify-batch-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean
    public RestTemplate contentSourceRestTemplate(RestTemplateBuilder builder, InsightPipelineProperties properties) {
        return builder
                .defaultHeader("User-Agent", properties.getSource().getUserAgent())
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(Duration.ofSeconds(30))
                .build();
    }

    @Bean
    public RestTemplate languageModelRestTemplate(RestTemplateBuilder builder, InsightPipelineProperties properties) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(Duration.ofSeconds(properties.getLlm().getTimeoutSeconds()))
                .build();
    }
}
