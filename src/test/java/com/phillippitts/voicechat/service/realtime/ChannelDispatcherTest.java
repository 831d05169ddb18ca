package com.phillippitts.voicechat.service.realtime;

import com.phillippitts.voicechat.service.metrics.RealtimeMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ChannelDispatcherTest {

    private ExecutorService executor;
    private SimpleMeterRegistry registry;
    private ChannelDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        registry = new SimpleMeterRegistry();
        dispatcher = new ChannelDispatcher(executor, new RealtimeMetrics(registry));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldPreserveOrderWithinChannel() throws InterruptedException {
        int events = 200;
        List<Integer> seen = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(events);

        for (int i = 0; i < events; i++) {
            int n = i;
            dispatcher.dispatch("turns:c1", () -> {
                seen.add(n);
                done.countDown();
            });
        }

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen).hasSize(events);
        for (int i = 0; i < events; i++) {
            assertThat(seen.get(i)).isEqualTo(i);
        }
    }

    @Test
    void shouldNotBlockOtherChannelsWhileOneIsSlow() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch slowStarted = new CountDownLatch(1);
        CountDownLatch fastDone = new CountDownLatch(1);

        dispatcher.dispatch("conversation:slow", () -> {
            slowStarted.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        assertThat(slowStarted.await(5, TimeUnit.SECONDS)).isTrue();

        dispatcher.dispatch("conversation:fast", fastDone::countDown);

        assertThat(fastDone.await(5, TimeUnit.SECONDS)).isTrue();
        release.countDown();
    }

    @Test
    void shouldKeepDrainingAfterTaskFailure() throws InterruptedException {
        CountDownLatch done = new CountDownLatch(1);

        dispatcher.dispatch("ch", () -> {
            throw new IllegalStateException("boom");
        });
        dispatcher.dispatch("ch", done::countDown);

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void shouldRecordDispatchLatency() throws InterruptedException {
        CountDownLatch done = new CountDownLatch(1);

        dispatcher.dispatch("ch", done::countDown);

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        assertThat(registry.find("voicechat.realtime.dispatch.latency").timer().count()).isEqualTo(1);
    }

    @Test
    void shouldForgetReleasedLanes() {
        ChannelDispatcher sync = new ChannelDispatcher(Runnable::run, new RealtimeMetrics(registry));
        sync.dispatch("a", () -> { });
        sync.dispatch("b", () -> { });

        assertThat(sync.laneCount()).isEqualTo(2);

        sync.release("a");

        assertThat(sync.laneCount()).isEqualTo(1);
    }
}
