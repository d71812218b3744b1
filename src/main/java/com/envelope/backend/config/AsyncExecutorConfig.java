package com.envelope.backend.config;

import java.util.concurrent.Executor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncExecutorConfig {

    public static final String OVERVIEW_EXECUTOR = "overviewTaskExecutor";

    @Bean(name = OVERVIEW_EXECUTOR)
    public Executor overviewTaskExecutor(OverviewProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.loaderPoolSize());
        executor.setMaxPoolSize(properties.loaderPoolSize());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("overview-load-");
        executor.initialize();
        return executor;
    }
}
