package com.phillippitts.voicechat.service.realtime.transport;

import com.phillippitts.voicechat.domain.ChangeEventKind;
import com.phillippitts.voicechat.domain.FilterExpression;
import com.phillippitts.voicechat.domain.WatchedTable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process {@link RealtimeTransport} for deployments where changes originate inside the
 * same JVM (and for local development).
 *
 * <p>Delivery model:
 * <ul>
 *   <li>{@link #publish} delivers synchronously on the publishing thread, so events published
 *       from one thread reach each channel in publish order</li>
 *   <li>Only active channels receive events; activation and deactivation complete immediately</li>
 *   <li>Filters are evaluated against the new row, or the old row for deletes</li>
 * </ul>
 *
 * <p>Thread Safety: channel registry and handler lists are concurrent collections; handlers
 * may be registered while events are being published.
 */
public class InMemoryRealtimeTransport implements RealtimeTransport {

    private static final Logger LOG = LogManager.getLogger(InMemoryRealtimeTransport.class);

    private final ConcurrentMap<String, InMemoryChannel> channels = new ConcurrentHashMap<>();

    @Override
    public RealtimeChannel openChannel(String name) {
        Objects.requireNonNull(name, "name");
        InMemoryChannel channel = channels.compute(name, (n, existing) ->
                existing != null && !existing.closed.get() ? existing : new InMemoryChannel(n));
        LOG.debug("Opened in-memory channel {}", name);
        return channel;
    }

    /**
     * Delivers a change to every active channel with a matching registration.
     *
     * @return number of handlers invoked
     */
    public int publish(ChangePayload payload) {
        Objects.requireNonNull(payload, "payload");
        int delivered = 0;
        for (InMemoryChannel channel : channels.values()) {
            delivered += channel.deliver(payload);
        }
        LOG.debug("Published {} {} to {} handler(s)", payload.table(), payload.kind(), delivered);
        return delivered;
    }

    /**
     * Parses a wire payload whose envelope names table and event type, then publishes it.
     *
     * @return number of handlers invoked
     * @throws com.phillippitts.voicechat.exception.PayloadDecodeException if the JSON is not a valid envelope
     */
    public int publishJson(String json) {
        return publish(ChangePayload.fromJson(json));
    }

    /** Names of channels opened and not yet deactivated. */
    public List<String> openChannelNames() {
        List<String> names = new ArrayList<>();
        channels.forEach((name, ch) -> {
            if (!ch.closed.get()) {
                names.add(name);
            }
        });
        return names;
    }

    private record Registration(ChangeEventKind kind, WatchedTable table, FilterExpression filter,
                                ChangeHandler handler) {

        boolean accepts(ChangePayload payload) {
            if (kind != payload.kind() || table != payload.table()) {
                return false;
            }
            if (filter == null) {
                return true;
            }
            Map<String, Object> row = payload.kind() == ChangeEventKind.DELETE ? payload.oldRow() : payload.newRow();
            return filter.matches(row);
        }
    }

    private final class InMemoryChannel implements RealtimeChannel {

        private final String name;
        private final List<Registration> registrations = new CopyOnWriteArrayList<>();
        private final AtomicBoolean active = new AtomicBoolean(false);
        private final AtomicBoolean closed = new AtomicBoolean(false);

        InMemoryChannel(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public void on(ChangeEventKind kind, WatchedTable table, FilterExpression filter, ChangeHandler handler) {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(table, "table");
            Objects.requireNonNull(handler, "handler");
            registrations.add(new Registration(kind, table, filter, handler));
        }

        @Override
        public CompletableFuture<Void> activate() {
            if (closed.get()) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("Channel " + name + " was deactivated"));
            }
            active.set(true);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public CompletableFuture<Void> deactivate() {
            active.set(false);
            if (closed.compareAndSet(false, true)) {
                registrations.clear();
                channels.remove(name, this);
            }
            return CompletableFuture.completedFuture(null);
        }

        int deliver(ChangePayload payload) {
            if (!active.get()) {
                return 0;
            }
            int count = 0;
            for (Registration r : registrations) {
                if (r.accepts(payload)) {
                    r.handler().handle(payload);
                    count++;
                }
            }
            return count;
        }
    }
}
