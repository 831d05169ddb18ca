package com.phillippitts.voicechat.service.metrics;

import com.phillippitts.voicechat.domain.ChangeEventKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RealtimeMetricsTest {

    private MeterRegistry registry;
    private RealtimeMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new RealtimeMetrics(registry);
    }

    @Test
    void shouldCountEventsPerTableAndKind() {
        metrics.recordEvent("conversations", ChangeEventKind.UPDATE);
        metrics.recordEvent("conversations", ChangeEventKind.UPDATE);
        metrics.recordEvent("conversation_turns", ChangeEventKind.INSERT);

        Counter updates = registry.find("voicechat.realtime.events")
                .tag("table", "conversations")
                .tag("kind", "UPDATE")
                .counter();
        Counter inserts = registry.find("voicechat.realtime.events")
                .tag("table", "conversation_turns")
                .tag("kind", "INSERT")
                .counter();

        assertThat(updates).isNotNull();
        assertThat(updates.count()).isEqualTo(2.0);
        assertThat(inserts.count()).isEqualTo(1.0);
    }

    @Test
    void shouldCountFailuresByTag() {
        metrics.incrementCallbackFailure("turns");
        metrics.incrementDecodeFailure("conversations");
        metrics.incrementTransportFailure("activate");
        metrics.incrementTransportFailure("activate");

        assertThat(registry.find("voicechat.realtime.callback.failures").tag("scope", "turns").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("voicechat.realtime.decode.failures").tag("table", "conversations").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("voicechat.realtime.transport.failures").tag("operation", "activate").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    void shouldRecordDispatchLatency() {
        long durationNanos = TimeUnit.MILLISECONDS.toNanos(15);

        metrics.recordDispatchLatency(durationNanos);

        Timer timer = registry.find("voicechat.realtime.dispatch.latency").timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.NANOSECONDS)).isEqualTo(durationNanos);
    }
}
