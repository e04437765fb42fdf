package com.demo.messaging.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for store and aggregator calls behind the async command/query surface.
 * Request threads hand work off here and return a CompletableFuture.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "messagingExecutor")
    public ThreadPoolTaskExecutor messagingExecutor(
            @Value("${messaging.executor.pool-size:8}") int poolSize,
            @Value("${messaging.executor.queue-capacity:1000}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("messaging-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
