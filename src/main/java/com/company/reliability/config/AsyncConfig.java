package com.company.reliability.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Bounded pools for portfolio evaluation and notification fan-out.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Bean(name = "portfolioExecutor")
    public Executor portfolioExecutor(
            @Value("${reliability.portfolio.pool-size:4}") int poolSize,
            @Value("${reliability.portfolio.queue-capacity:200}") int queueCapacity) {
        return buildExecutor("portfolio-", poolSize, queueCapacity);
    }

    @Bean(name = "notificationExecutor")
    public Executor notificationExecutor(
            @Value("${reliability.notifications.pool-size:4}") int poolSize,
            @Value("${reliability.notifications.queue-capacity:500}") int queueCapacity) {
        return buildExecutor("notify-", poolSize, queueCapacity);
    }

    private ThreadPoolTaskExecutor buildExecutor(String prefix, int poolSize, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        // run on the caller when saturated instead of dropping work
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        log.info("Executor {} started with {} threads, queue {}", prefix, poolSize, queueCapacity);
        return executor;
    }
}
