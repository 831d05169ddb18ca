package com.phillippitts.voicechat.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the dispatch executor through Micrometer gauges:
 * {@code realtime.dispatch.pool.size}, {@code .active}, {@code .queued} and {@code .completed}.
 *
 * <p>Additionally logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> dispatchExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("realtimeDispatchExecutor") ObjectProvider<ThreadPoolTaskExecutor> dispatchExecutorProvider) {
        this.dispatchExecutorProvider = dispatchExecutorProvider;
    }

    @Bean
    public MeterBinder dispatchExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = dispatchExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("realtime.dispatch.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the dispatch pool")
                    .register(registry);

            Gauge.builder("realtime.dispatch.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads actively running callbacks")
                    .register(registry);

            Gauge.builder("realtime.dispatch.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of channel drains waiting in the queue")
                    .register(registry);

            Gauge.builder("realtime.dispatch.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed channel drains")
                    .register(registry);

            LOG.info("Dispatch pool metrics registered: realtime.dispatch.pool.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = dispatchExecutorProvider.getObject().getThreadPoolExecutor();

        LOG.info("Dispatch pool: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount()
        );
    }
}
