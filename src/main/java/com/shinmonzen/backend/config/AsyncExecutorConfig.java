package com.shinmonzen.backend.config;

import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncExecutorConfig {

    @Bean(name = "extractionTaskExecutor")
    public Executor extractionTaskExecutor(
            @Value("${shinmonzen.batch.core-pool-size:2}") int corePoolSize,
            @Value("${shinmonzen.batch.max-pool-size:4}") int maxPoolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int core = Math.max(1, corePoolSize);
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(Math.max(core, maxPoolSize));
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("extraction-");
        executor.initialize();
        return executor;
    }
}
