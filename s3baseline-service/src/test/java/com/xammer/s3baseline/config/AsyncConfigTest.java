package com.xammer.s3baseline.config;

import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;

class AsyncConfigTest {

    private static ThreadPoolTaskExecutor executorFor(int concurrency) {
        AsyncConfig config = new AsyncConfig();
        ReflectionTestUtils.setField(config, "concurrency", concurrency);
        return (ThreadPoolTaskExecutor) config.baselineTaskExecutor();
    }

    @Test
    void zeroOrNegativeConcurrencyRunsOneWorker() {
        assertThat(AsyncConfig.workerCount(0)).isEqualTo(1);
        assertThat(AsyncConfig.workerCount(-3)).isEqualTo(1);
    }

    @Test
    void concurrencyAboveLimitIsCapped() {
        ThreadPoolTaskExecutor executor = executorFor(25);
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(AsyncConfig.MAX_CONCURRENCY);
            assertThat(executor.getMaxPoolSize()).isEqualTo(AsyncConfig.MAX_CONCURRENCY);
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void concurrencyWithinRangeIsKept() {
        ThreadPoolTaskExecutor executor = executorFor(4);
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(4);
            assertThat(executor.getMaxPoolSize()).isEqualTo(4);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("Baseline-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void defaultConcurrencyIsSequential() {
        ThreadPoolTaskExecutor executor = executorFor(1);
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(1);
        } finally {
            executor.shutdown();
        }
    }
}
