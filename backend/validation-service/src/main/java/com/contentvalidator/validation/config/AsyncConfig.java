package com.contentvalidator.validation.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@Slf4j
public class AsyncConfig {

    @Value("${scan.executor.core-pool-size:2}")
    private int corePoolSize;

    @Value("${scan.executor.max-pool-size:4}")
    private int maxPoolSize;

    @Value("${scan.executor.queue-capacity:50}")
    private int queueCapacity;

    @Value("${scan.validator-executor.core-pool-size:8}")
    private int validatorCorePoolSize;

    @Value("${scan.validator-executor.max-pool-size:16}")
    private int validatorMaxPoolSize;

    @Value("${scan.validator-executor.queue-capacity:200}")
    private int validatorQueueCapacity;

    /**
     * Runs whole scan jobs. Bounded: a full queue rejects the submission.
     */
    @Bean(name = "scanJobExecutor")
    public Executor scanJobExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("scan-job-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * Per-page scraper and validator calls
     */
    @Bean(name = "validatorExecutor")
    public Executor validatorExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(validatorCorePoolSize);
        executor.setMaxPoolSize(validatorMaxPoolSize);
        executor.setQueueCapacity(validatorQueueCapacity);
        executor.setThreadNamePrefix("scan-validator-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("validatorExecutor saturated, running task on caller thread");
            if (!e.isShutdown()) {
                r.run();
            }
        });
        executor.initialize();
        return executor;
    }
}
