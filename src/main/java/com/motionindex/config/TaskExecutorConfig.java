package com.motionindex.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for batch jobs, for deadline-guarded calls to collaborators (storage,
 * extraction, classification, search index) and for classification provider attempts.
 */
@Configuration
public class TaskExecutorConfig {

    /**
     * One thread per running batch job. A full pool and queue rejects new jobs
     * with a TaskRejectedException.
     */
    @Bean(name = "batchJobExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor batchJobExecutor(
            @Value("${batch.executor.pool-size:4}") int poolSize,
            @Value("${batch.executor.queue-capacity:50}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("batch-job-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Runs blocking external calls so the caller can stop waiting when a deadline passes.
     * A task on this pool never waits on another task of the same pool.
     */
    @Bean(name = "externalCallExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor externalCallExecutor(
            @Value("${external-calls.executor.core-pool-size:16}") int corePoolSize,
            @Value("${external-calls.executor.max-pool-size:64}") int maxPoolSize,
            @Value("${external-calls.executor.queue-capacity:500}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("external-call-");
        executor.initialize();
        return executor;
    }

    /**
     * Runs single classification provider attempts. Kept apart from
     * {@code externalCallExecutor} because a pipeline classify step, itself running there,
     * waits on these attempts.
     */
    @Bean(name = "classificationExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor classificationExecutor(
            @Value("${classification.executor.pool-size:16}") int poolSize,
            @Value("${classification.executor.queue-capacity:200}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("classification-");
        executor.initialize();
        return executor;
    }
}
