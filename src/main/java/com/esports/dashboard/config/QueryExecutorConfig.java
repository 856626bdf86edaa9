package com.esports.dashboard.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Pool that runs dashboard queries under the timeout guard.
 *
 * Bounded on both threads and queue: when both are full, new queries are
 * rejected (HTTP 503) instead of piling up behind a slow database.
 */
@Slf4j
@Configuration
public class QueryExecutorConfig {

    @Value("${app.executor.core-pool-size:4}")
    private int corePoolSize;

    @Value("${app.executor.max-pool-size:16}")
    private int maxPoolSize;

    @Value("${app.executor.queue-capacity:100}")
    private int queueCapacity;

    @Bean(name = "dashboardQueryExecutor")
    public ThreadPoolTaskExecutor dashboardQueryExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("dashboard-query-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Dashboard query executor: core={}, max={}, queue={}", corePoolSize, maxPoolSize, queueCapacity);
        return executor;
    }
}
