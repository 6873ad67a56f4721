package com.clapgrow.tracking.api.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class TrackingInfrastructureConfig {

    /**
     * Every "now" in the service comes from this clock so windows and retention ranges
     * can be driven deterministically in tests.
     */
    @Bean
    public Clock trackingClock() {
        return Clock.systemUTC();
    }

    /**
     * Drains per-subscriber live feed queues. A drain task never blocks on a slow client
     * for longer than one SSE write.
     */
    @Bean(name = "broadcastExecutor")
    public ThreadPoolTaskExecutor broadcastExecutor(
            @Value("${tracking.broadcast.executor.core-size:4}") int coreSize,
            @Value("${tracking.broadcast.executor.max-size:16}") int maxSize,
            @Value("${tracking.broadcast.executor.queue-capacity:2048}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("live-feed-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
