package com.example.realtime.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class TaskConfig {

    /**
     * Customizes the thread pool for @Scheduled methods.
     */
    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("scheduler-");
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Blocking presence-store calls (Redis template, Caffeine compute) are moved off the Netty event loop.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler presenceScheduler() {
        return Schedulers.newBoundedElastic(64, 100_000, "presence-io-");
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler jdbcScheduler() {
        return Schedulers.newParallel("jdbc-io-", 10);
    }
}
