package com.example.scvl.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    public static final String PAGE_VIEW_EXECUTOR = "pageViewExecutor";

    /**
     * Bounded pool for page view writes. A full queue rejects the task, which the redirect path logs
     * and ignores.
     */
    @Bean(name = PAGE_VIEW_EXECUTOR)
    public ThreadPoolTaskExecutor pageViewExecutor(@Value("${app.analytics.pool-size:2}") int poolSize,
                                                   @Value("${app.analytics.queue-capacity:1000}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("page-view-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        return executor;
    }
}
