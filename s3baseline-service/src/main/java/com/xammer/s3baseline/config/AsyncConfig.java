package com.xammer.s3baseline.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
public class AsyncConfig {

    static final int MAX_CONCURRENCY = 10;

    @Value("${baseline.concurrency:1}")
    private int concurrency;

    /**
     * Bucket workers. Kept small because the S3 control plane throttles aggressively.
     */
    @Bean(name = "baselineTaskExecutor")
    public Executor baselineTaskExecutor() {
        int workers = workerCount(concurrency);
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setThreadNamePrefix("Baseline-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    static int workerCount(int requested) {
        return Math.max(1, Math.min(requested, MAX_CONCURRENCY));
    }
}
