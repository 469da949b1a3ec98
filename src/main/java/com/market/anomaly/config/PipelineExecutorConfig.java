package com.market.anomaly.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors of the tick pipeline: a single ingestion lane that serializes ticks, and a
 * worker pool evaluating the instruments of one tick in parallel.
 */
@Configuration
public class PipelineExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineExecutorConfig.class);

    @Bean("ingestExecutor")
    public ThreadPoolTaskExecutor ingestExecutor(AnomalyProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        // one thread: ticks are applied in arrival order
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("tick-ingest-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) properties.getPipeline().getShutdownTimeout().toSeconds());
        executor.initialize();
        return executor;
    }

    @Bean("ruleExecutor")
    public ThreadPoolTaskExecutor ruleExecutor(AnomalyProperties properties) {
        int threads = properties.getPipeline().getRuleThreads();
        log.info("Initializing rule executor with {} threads", threads);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(1_000);
        executor.setThreadNamePrefix("rule-eval-");
        // never drop an instrument evaluation
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) properties.getPipeline().getShutdownTimeout().toSeconds());
        executor.initialize();
        return executor;
    }
}
