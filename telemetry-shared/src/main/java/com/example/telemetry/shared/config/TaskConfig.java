package com.example.telemetry.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class TaskConfig {

    /**
     * Customizes the thread pool for @Async methods.
     */
    @Bean
    @Primary
    public AsyncTaskExecutor asyncTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setThreadNamePrefix("async-task-");
        executor.initialize();
        return executor;
    }

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

    @Bean(destroyMethod = "dispose")
    public Scheduler jdbcScheduler() {
        // Fixed pool of platform threads for blocking JDBC work
        return Schedulers.newParallel("jdbc-io-", 10);
    }

    /**
     * Geo database reads are blocking file I/O and must stay off the connection-handling threads.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler geoLookupScheduler(AppProperties appProperties) {
        return Schedulers.newBoundedElastic(appProperties.getGeo().getLookupThreads(), 10_000, "geo-lookup-");
    }

    /**
     * Presence store calls (Redis round trips) issued on behalf of connections and REST queries.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler presenceIoScheduler() {
        return Schedulers.newBoundedElastic(50, 100_000, "presence-io-");
    }
}
