package com.heronix.progress.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors for batch evaluation.
 *
 * Runs and per-student evaluations use separate pools so a controlling thread waiting on
 * its sub-batch never occupies a slot its own evaluations need.
 */
@Configuration
public class AsyncConfig {

    public static final String BATCH_RUN_EXECUTOR = "batchRunExecutor";
    public static final String EVALUATION_EXECUTOR = "evaluationExecutor";

    @Bean(name = BATCH_RUN_EXECUTOR)
    public ThreadPoolTaskExecutor batchRunExecutor(ProgressProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getBatch().getConcurrentRuns());
        executor.setMaxPoolSize(properties.getBatch().getConcurrentRuns());
        executor.setThreadNamePrefix("batch-run-");
        executor.initialize();
        return executor;
    }

    @Bean(name = EVALUATION_EXECUTOR)
    public ThreadPoolTaskExecutor evaluationExecutor(ProgressProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getBatch().getParallelThreads());
        executor.setMaxPoolSize(properties.getBatch().getParallelThreads());
        executor.setThreadNamePrefix("evaluation-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
