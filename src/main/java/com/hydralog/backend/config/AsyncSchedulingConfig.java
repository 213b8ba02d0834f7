package com.hydralog.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableAsync
public class AsyncSchedulingConfig {

    /** set-once sentinel reads (daily / weekly / monthly) run side by side on this pool */
    @Bean("summaryReadExecutor")
    public TaskExecutor summaryReadExecutor() {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(6);
        ex.setMaxPoolSize(12);
        ex.setQueueCapacity(200);
        ex.setThreadNamePrefix("summary-read-");
        ex.initialize();
        return ex;
    }

    @Bean("analyticsExecutor")
    public TaskExecutor analyticsExecutor() {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(1);
        ex.setMaxPoolSize(2);
        ex.setQueueCapacity(500);
        ex.setThreadNamePrefix("analytics-");
        ex.initialize();
        return ex;
    }
}
