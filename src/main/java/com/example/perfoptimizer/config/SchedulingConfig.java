package com.example.perfoptimizer.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;

/**
 * Thread pools for the orchestrator schedules, adapter collection and event dispatch.
 */
@Slf4j
@Configuration
public class SchedulingConfig {

    /**
     * Runs the optimization cycle, health check and rule sweep. One thread per schedule
     * so a slow cycle never delays the health check or the sweep.
     */
    @Bean(name = "optimizerScheduler")
    public ThreadPoolTaskScheduler optimizerScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(3);
        scheduler.setThreadNamePrefix("optimizer-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        scheduler.setErrorHandler(t -> log.error("Scheduled optimizer task escaped its boundary: {}", t.getMessage(), t));
        scheduler.initialize();
        return scheduler;
    }

    @Bean(name = "collectorExecutor")
    public Executor collectorExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(5);
        executor.setMaxPoolSize(20);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("collector-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "eventExecutor")
    public Executor eventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(5);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("event-");
        executor.initialize();
        return executor;
    }
}
