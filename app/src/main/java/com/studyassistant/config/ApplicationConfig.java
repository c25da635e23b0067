package com.studyassistant.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * General application beans: the clock and the executor for AI calls.
 */
@Configuration
@Slf4j
public class ApplicationConfig {

    @Value("${app.ai.executor.pool-size:2}")
    private int aiPoolSize;

    /**
     * Source of "now" and "today" for timestamps, the streak and due filters.
     *
     * @return the system clock in the default zone
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Executor that runs AI requests off the interactive thread.
     *
     * Abandoned requests keep running here until they finish or hit the
     * HTTP timeout, so the pool is small and its threads are daemons.
     *
     * @return the AI executor
     */
    @Bean(name = "aiExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor aiExecutor() {
        log.debug("Configuring AI executor with {} threads", aiPoolSize);
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(aiPoolSize);
        executor.setMaxPoolSize(aiPoolSize);
        executor.setQueueCapacity(10);
        executor.setThreadNamePrefix("ai-request-");
        executor.setDaemon(true);
        executor.initialize();
        return executor;
    }
}
