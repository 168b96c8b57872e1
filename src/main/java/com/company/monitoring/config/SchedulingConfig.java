package com.company.monitoring.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Threads of the service: the cycle timer, the per-cycle fetch fan-out, notification delivery
 * and general {@code @Async} listeners.
 */
@Configuration
@EnableScheduling
@EnableAsync
@Slf4j
public class SchedulingConfig {

    @Value("${monitoring.telemetry.fetch-concurrency:8}")
    private int fetchConcurrency;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "cycleTaskScheduler")
    public ThreadPoolTaskScheduler cycleTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("monitoring-timer-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    @Bean(name = "fetchExecutor")
    public Executor fetchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(fetchConcurrency);
        executor.setMaxPoolSize(fetchConcurrency);
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("telemetry-fetch-");
        executor.initialize();
        log.info("Telemetry fetch executor configured with {} threads", fetchConcurrency);
        return executor;
    }

    @Bean(name = "notificationExecutor")
    public Executor notificationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("notify-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * Default executor for {@code @Async} listeners without a qualifier
     */
    @Bean(name = "taskExecutor")
    public Executor taskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("monitoring-async-");
        executor.initialize();
        return executor;
    }
}
