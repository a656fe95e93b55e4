package com.example.procurement.assistantservice.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class TaskExecutorConfig {

    /** Runs embedding batches during an index build. */
    @Bean("indexingExecutor")
    public ThreadPoolTaskExecutor indexingExecutor(@Value("${app.index.parallelism:4}") int parallelism) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(parallelism);
        executor.setMaxPoolSize(parallelism);
        executor.setQueueCapacity(1000);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setThreadNamePrefix("IndexWorker-");
        executor.initialize();
        return executor;
    }

    /** Runs generation calls so they can be abandoned on timeout. */
    @Bean("generationExecutor")
    public ThreadPoolTaskExecutor generationExecutor(@Value("${app.generation.pool-size:8}") int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize * 2);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("GenerationWorker-");
        executor.initialize();
        return executor;
    }
}
