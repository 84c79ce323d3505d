package com.crewflow.crewflow_backend.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Slf4j
@Configuration
public class ThreadPoolConfig {

    /**
     * Runs executions off the request and scheduler threads. Bounded on both threads and
     * queue; a full pool rejects the submission instead of running it on the caller.
     */
    @Bean(name = "executionWorkerPool")
    public ThreadPoolTaskExecutor executionWorkerPool(ExecutionProperties properties) {
        int poolSize = Math.max(properties.getWorkerPoolSize(), 1);
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(Math.max(properties.getQueueCapacity(), 0));
        executor.setThreadNamePrefix("execution-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        log.info("[EXECUTION] Worker pool size={}, queue={}", poolSize, properties.getQueueCapacity());
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
