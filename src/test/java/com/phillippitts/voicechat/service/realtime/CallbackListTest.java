package com.phillippitts.voicechat.service.realtime;

import com.phillippitts.voicechat.service.metrics.RealtimeMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CallbackListTest {

    private SimpleMeterRegistry registry;
    private CallbackList<String> callbacks;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        callbacks = new CallbackList<>("conversation:c1", new RealtimeMetrics(registry));
    }

    @Test
    void shouldInvokeCallbacksInRegistrationOrder() {
        List<String> calls = new ArrayList<>();
        callbacks.add(e -> calls.add("first:" + e));
        callbacks.add(e -> calls.add("second:" + e));

        int delivered = callbacks.dispatch("x");

        assertThat(delivered).isEqualTo(2);
        assertThat(calls).containsExactly("first:x", "second:x");
    }

    @Test
    void shouldIsolateFailingCallback() {
        List<String> calls = new ArrayList<>();
        callbacks.add(e -> {
            throw new IllegalStateException("subscriber bug");
        });
        callbacks.add(calls::add);

        int delivered = callbacks.dispatch("x");

        assertThat(delivered).isEqualTo(1);
        assertThat(calls).containsExactly("x");
        assertThat(registry.find("voicechat.realtime.callback.failures")
                .tag("scope", "conversation").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldExposeSubscriptionKeyToCallbacksOnly() {
        List<String> seen = new ArrayList<>();
        callbacks.add(e -> seen.add(ThreadContext.get("subscription")));

        callbacks.dispatch("x");

        assertThat(seen).containsExactly("conversation:c1");
        assertThat(ThreadContext.get("subscription")).isNull();
    }

    @Test
    void shouldRemoveCallback() {
        ChangeCallback<String> callback = e -> { };
        callbacks.add(callback);

        assertThat(callbacks.remove(callback)).isTrue();
        assertThat(callbacks.isEmpty()).isTrue();
        assertThat(callbacks.dispatch("x")).isZero();
    }
}
