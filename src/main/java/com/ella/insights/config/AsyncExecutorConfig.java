package com.ella.insights.config;

import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncExecutorConfig {

    @Bean(name = "insightsTaskExecutor")
    public Executor insightsTaskExecutor(
            @Value("${ella.insights.executor.core-pool-size:2}") int corePoolSize,
            @Value("${ella.insights.executor.max-pool-size:4}") int maxPoolSize,
            @Value("${ella.insights.executor.queue-capacity:100}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("insights-");
        executor.initialize();
        return executor;
    }
}
