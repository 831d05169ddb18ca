package com.phillippitts.voicechat.config;

import com.phillippitts.voicechat.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pool that runs change-notification callbacks.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on subscriber count and callback cost.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the bounded pool behind {@link com.phillippitts.voicechat.service.realtime.ChannelDispatcher}.
     *
     * <p>Pool sizing strategy configured via {@code threadpool.dispatch.*} properties:
     * <ul>
     *   <li>Core pool: default 4 - one busy channel per thread in the common case</li>
     *   <li>Max pool: default 8 - absorbs bursts when several channels fire at once</li>
     *   <li>Queue: default 100 tasks - bounded to prevent unbounded memory growth</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}
     * When the pool and queue are full, the transport thread drains the channel itself,
     * providing backpressure instead of dropping events.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext from the transport thread to the
     * worker thread so channel context survives the hand-off.
     *
     * @return Configured executor for callback dispatch
     */
    @Bean(name = "realtimeDispatchExecutor")
    public ThreadPoolTaskExecutor realtimeDispatchExecutor() {
        ThreadPoolProperties.DispatchPoolProperties props = threadPoolProperties.getDispatch();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(props.getAwaitTerminationSeconds());

        // Propagate MDC to worker threads
        executor.setTaskDecorator(runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        });

        executor.initialize();
        return executor;
    }
}
