package com.phillippitts.voicechat.service.metrics;

import com.phillippitts.voicechat.domain.ChangeEventKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for change-notification delivery.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Change events received per table and kind</li>
 *   <li>Callback, decode and transport failures</li>
 *   <li>Time spent dispatching one event to its callbacks</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class RealtimeMetrics {

    private static final String METRIC_PREFIX = "voicechat.realtime";

    private final MeterRegistry registry;

    public RealtimeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Counts one change event handed over by the transport.
     *
     * @param table table name (conversations, conversation_turns, ...)
     * @param kind change kind
     */
    public void recordEvent(String table, ChangeEventKind kind) {
        Counter.builder(METRIC_PREFIX + ".events")
                .description("Number of change events received from the transport")
                .tag("table", table)
                .tag("kind", kind.name())
                .register(registry)
                .increment();
    }

    /**
     * @param scope subscription scope (conversation, turns, or a table name for registry subscriptions)
     */
    public void incrementCallbackFailure(String scope) {
        Counter.builder(METRIC_PREFIX + ".callback.failures")
                .description("Number of subscriber callbacks that threw during dispatch")
                .tag("scope", scope)
                .register(registry)
                .increment();
    }

    public void incrementDecodeFailure(String table) {
        Counter.builder(METRIC_PREFIX + ".decode.failures")
                .description("Number of change payloads dropped because they could not be decoded")
                .tag("table", table)
                .register(registry)
                .increment();
    }

    /**
     * @param operation transport operation that failed (open, activate, deactivate)
     */
    public void incrementTransportFailure(String operation) {
        Counter.builder(METRIC_PREFIX + ".transport.failures")
                .description("Number of failed transport channel operations")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void recordDispatchLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".dispatch.latency")
                .description("Time taken to dispatch one change event to its callbacks")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
