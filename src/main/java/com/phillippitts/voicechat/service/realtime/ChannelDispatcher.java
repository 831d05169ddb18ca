package com.phillippitts.voicechat.service.realtime;

import com.phillippitts.voicechat.service.metrics.RealtimeMetrics;
import com.phillippitts.voicechat.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs change-event work off the transport thread while keeping per-channel order.
 *
 * <p>Each channel name owns a serial lane on top of the shared executor:
 * <ul>
 *   <li>Tasks on one lane run one at a time, in submission order</li>
 *   <li>Lanes are independent: a slow callback on one channel never delays another channel</li>
 *   <li>{@link #dispatch} returns immediately; the transport never waits for callbacks</li>
 * </ul>
 *
 * <p>Releasing a lane (on unsubscribe) only forgets it. Tasks already queued on it still
 * run, so in-flight callbacks are never cut short; they simply find no live subscribers.
 *
 * <p>Thread Safety: lanes are created through a concurrent map and guard their queue with
 * their own monitor, which is never held while a task runs.
 */
@Component
public class ChannelDispatcher {

    private static final Logger LOG = LogManager.getLogger(ChannelDispatcher.class);

    static final String CHANNEL_CONTEXT_KEY = "channel";
    private static final long SLOW_DISPATCH_WARN_MS = 1_000;

    private final Executor executor;
    private final RealtimeMetrics metrics;
    private final ConcurrentMap<String, SerialLane> lanes = new ConcurrentHashMap<>();

    public ChannelDispatcher(@Qualifier("realtimeDispatchExecutor") Executor executor, RealtimeMetrics metrics) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Queues work on the lane of the given channel.
     *
     * @param channelName channel the event arrived on
     * @param task        decode-and-fan-out work for one event
     */
    public void dispatch(String channelName, Runnable task) {
        Objects.requireNonNull(channelName, "channelName");
        Objects.requireNonNull(task, "task");
        lanes.computeIfAbsent(channelName, SerialLane::new).submit(task);
    }

    /** Forgets the lane of a torn-down channel. Already queued tasks still run. */
    public void release(String channelName) {
        lanes.remove(channelName);
    }

    /** Number of channels that currently own a lane. Visible for tests and status. */
    int laneCount() {
        return lanes.size();
    }

    private final class SerialLane {

        private final String channelName;
        private final Deque<Runnable> queue = new ArrayDeque<>();
        private boolean draining;

        SerialLane(String channelName) {
            this.channelName = channelName;
        }

        void submit(Runnable task) {
            boolean start;
            synchronized (this) {
                queue.addLast(task);
                start = !draining;
                draining = true;
            }
            if (start) {
                schedule();
            }
        }

        private void schedule() {
            try {
                executor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                int dropped;
                synchronized (this) {
                    dropped = queue.size();
                    queue.clear();
                    draining = false;
                }
                LOG.error("Dispatch executor rejected channel {}; dropped {} event(s)", channelName, dropped);
            }
        }

        private void drain() {
            while (true) {
                Runnable next;
                synchronized (this) {
                    next = queue.pollFirst();
                    if (next == null) {
                        draining = false;
                        return;
                    }
                }
                runOne(next);
            }
        }

        private void runOne(Runnable task) {
            long start = System.nanoTime();
            ThreadContext.put(CHANNEL_CONTEXT_KEY, channelName);
            try {
                task.run();
            } catch (RuntimeException e) {
                LOG.error("Unhandled error while dispatching on channel {}", channelName, e);
            } finally {
                ThreadContext.remove(CHANNEL_CONTEXT_KEY);
                metrics.recordDispatchLatency(System.nanoTime() - start);
                long elapsedMs = TimeUtils.elapsedMillis(start);
                if (elapsedMs > SLOW_DISPATCH_WARN_MS) {
                    LOG.warn("Slow dispatch on channel {}: {} ms", channelName, elapsedMs);
                }
            }
        }
    }
}
