package com.clapgrow.bridge.api.config;

import com.clapgrow.bridge.api.delivery.BackoffSleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pools for inbound WhatsApp events and outbound webhook deliveries.
 * Deliveries sleep between attempts, so they get their own pool and never
 * hold up bridge handling.
 */
@Configuration
@Slf4j
public class ExecutorConfig {

    @Value("${bridge.executor.bridge.core-size:4}")
    private int bridgeCoreSize;

    @Value("${bridge.executor.bridge.max-size:16}")
    private int bridgeMaxSize;

    @Value("${bridge.executor.delivery.core-size:4}")
    private int deliveryCoreSize;

    @Value("${bridge.executor.delivery.max-size:32}")
    private int deliveryMaxSize;

    @Value("${bridge.executor.queue-capacity:1000}")
    private int queueCapacity;

    @Bean(name = "bridgeExecutor")
    public ThreadPoolTaskExecutor bridgeExecutor() {
        return buildExecutor("bridge-", bridgeCoreSize, bridgeMaxSize);
    }

    @Bean(name = "deliveryExecutor")
    public ThreadPoolTaskExecutor deliveryExecutor() {
        return buildExecutor("webhook-delivery-", deliveryCoreSize, deliveryMaxSize);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BackoffSleeper backoffSleeper() {
        return BackoffSleeper.THREAD_SLEEP;
    }

    private ThreadPoolTaskExecutor buildExecutor(String prefix, int coreSize, int maxSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        // Saturated pool: run on the caller rather than drop the event
        executor.setRejectedExecutionHandler((task, pool) -> {
            log.warn("{} pool saturated (active={}, queued={}) - running task on caller thread",
                prefix, pool.getActiveCount(), pool.getQueue().size());
            new ThreadPoolExecutor.CallerRunsPolicy().rejectedExecution(task, pool);
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
