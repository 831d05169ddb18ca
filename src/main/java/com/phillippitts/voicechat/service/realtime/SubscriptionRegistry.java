package com.phillippitts.voicechat.service.realtime;

import com.phillippitts.voicechat.config.properties.RealtimeProperties;
import com.phillippitts.voicechat.domain.ChangeEventKind;
import com.phillippitts.voicechat.domain.FilterExpression;
import com.phillippitts.voicechat.domain.WatchedTable;
import com.phillippitts.voicechat.exception.TransportException;
import com.phillippitts.voicechat.service.metrics.RealtimeMetrics;
import com.phillippitts.voicechat.service.realtime.transport.ChangePayload;
import com.phillippitts.voicechat.service.realtime.transport.RealtimeChannel;
import com.phillippitts.voicechat.service.realtime.transport.RealtimeTransport;
import com.phillippitts.voicechat.service.realtime.transport.TransportCalls;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Generic per-table subscription layer.
 *
 * <p>Owns one shared channel per {@link WatchedTable} (named {@code <table><suffix>}, e.g.
 * {@code conversations-changes}) and maps logical {@code (table, kind, filter)} triples onto
 * transport handler registrations on that channel.
 *
 * <p>Semantics:
 * <ul>
 *   <li><b>Deduplication:</b> a triple is registered with the transport at most once. Repeating
 *       {@link #subscribe} with the same triple appends the callback to the existing
 *       subscription and returns the same identifier.</li>
 *   <li><b>Identifiers:</b> {@code table:KIND:filter}, or {@code table:KIND:all} without filter.
 *       Filters are compared in their normalized wire form; cosmetic variants that normalize
 *       differently produce distinct subscriptions.</li>
 *   <li><b>Teardown:</b> {@link #unsubscribe} removes one logical subscription. The shared
 *       channel is deactivated only when its last subscription is gone, so siblings on the
 *       same table keep receiving events. The transport handler of a removed triple stays on
 *       the open channel, inert, and is reused if the triple is subscribed again.</li>
 *   <li><b>Error isolation:</b> callback failures are logged and counted per callback;
 *       transport failures propagate to the caller as {@link TransportException}.</li>
 * </ul>
 *
 * <p>Thread Safety: map mutations are serialized by a lock that is never held while waiting
 * on the transport.
 */
@Service
public class SubscriptionRegistry {

    private static final Logger LOG = LogManager.getLogger(SubscriptionRegistry.class);

    private static final String ALL_ROWS = "all";

    private final RealtimeTransport transport;
    private final ChannelDispatcher dispatcher;
    private final RealtimeMetrics metrics;
    private final RealtimeProperties properties;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<WatchedTable, RealtimeChannel> channels = new EnumMap<>(WatchedTable.class);
    private final Map<String, TableSubscription> subscriptions = new LinkedHashMap<>();
    // Every triple with a handler on a currently open channel, live or inert.
    private final Map<String, TableSubscription> handlerSlots = new LinkedHashMap<>();

    public SubscriptionRegistry(RealtimeTransport transport,
                                ChannelDispatcher dispatcher,
                                RealtimeMetrics metrics,
                                RealtimeProperties properties) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    /**
     * Builds the deterministic identifier of a logical subscription.
     *
     * @return {@code table:KIND:filter} or {@code table:KIND:all}
     */
    public static String subscriptionId(WatchedTable table, ChangeEventKind kind, FilterExpression filter) {
        return table.tableName() + ':' + kind.name() + ':' + (filter == null ? ALL_ROWS : filter.toString());
    }

    /**
     * Subscribes to every row change of one kind on a table.
     *
     * @see #subscribe(WatchedTable, ChangeEventKind, ChangeCallback, FilterExpression)
     */
    public String subscribe(WatchedTable table, ChangeEventKind kind, ChangeCallback<ChangePayload> callback) {
        return subscribe(table, kind, callback, (FilterExpression) null);
    }

    /**
     * Subscribes with a filter given in wire form.
     *
     * @throws IllegalArgumentException if the filter is not a single {@code column=eq.value} predicate
     * @see #subscribe(WatchedTable, ChangeEventKind, ChangeCallback, FilterExpression)
     */
    public String subscribe(WatchedTable table, ChangeEventKind kind, ChangeCallback<ChangePayload> callback,
                            String filter) {
        return subscribe(table, kind, callback, filter == null ? null : FilterExpression.parse(filter));
    }

    /**
     * Subscribes a callback to changes of one kind on a table.
     *
     * <p>Resolves (or lazily opens) the table's channel, registers a transport handler for a new
     * triple, and activates the channel unless it is already active.
     *
     * @param table    table to watch
     * @param kind     change kind to receive
     * @param callback receiver of raw change payloads
     * @param filter   optional row filter; null means all rows
     * @return subscription identifier, {@code table:KIND:filter-or-all}
     * @throws TransportException if the channel cannot be opened or activated; the registration
     *                            made by this call is rolled back
     */
    public String subscribe(WatchedTable table, ChangeEventKind kind, ChangeCallback<ChangePayload> callback,
                            FilterExpression filter) {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(callback, "callback");

        String id = subscriptionId(table, kind, filter);
        RealtimeChannel channel;
        TableSubscription subscription;
        boolean created;

        lock.lock();
        try {
            subscription = subscriptions.get(id);
            created = subscription == null;
            channel = channels.get(table);
            if (channel == null) {
                channel = openTableChannel(table);
                channels.put(table, channel);
            }
            if (created) {
                subscription = handlerSlots.get(id);
                if (subscription == null) {
                    subscription = new TableSubscription(id, table, kind, filter, channel.name());
                    subscription.open(new CallbackList<>(id, metrics));
                    registerHandler(channel, subscription);
                    handlerSlots.put(id, subscription);
                } else {
                    subscription.open(new CallbackList<>(id, metrics));
                    LOG.debug("Reusing transport handler for {}", id);
                }
                subscriptions.put(id, subscription);
            }
            subscription.callbacks.add(callback);
        } finally {
            lock.unlock();
        }

        if (!channel.isActive()) {
            try {
                TransportCalls.await(channel::activate, properties.getActivationTimeoutMs(), "activate", channel.name());
                LOG.info("Activated channel {}", channel.name());
            } catch (TransportException e) {
                rollback(subscription, callback);
                metrics.incrementTransportFailure("activate");
                LOG.error("Failed to subscribe to {} {} events: {}", table, kind, e.getMessage());
                throw e;
            }
        }

        if (created) {
            LOG.info("Subscribed to {} {} events with ID {}", table, kind, id);
        } else {
            LOG.info("Attached callback #{} to existing subscription {}", subscription.callbacks.size(), id);
        }
        return id;
    }

    /**
     * Removes one logical subscription. When it was the last one on its table channel, the
     * channel is deactivated and forgotten.
     *
     * @param subscriptionId identifier returned by {@link #subscribe}
     * @return true if the subscription existed, false if the identifier is unknown
     * @throws TransportException if deactivating the now-unused channel fails; the subscription
     *                            is removed regardless
     */
    public boolean unsubscribe(String subscriptionId) {
        if (subscriptionId == null) {
            return false;
        }
        RealtimeChannel toClose = null;
        lock.lock();
        try {
            TableSubscription subscription = subscriptions.remove(subscriptionId);
            if (subscription == null) {
                LOG.warn("Subscription {} not found", subscriptionId);
                return false;
            }
            subscription.close();
            WatchedTable table = tableOf(subscriptionId, subscription);
            boolean lastOnTable = subscriptions.values().stream().noneMatch(s -> s.table == table);
            if (lastOnTable) {
                toClose = channels.remove(table);
                dropHandlerSlots(table);
            }
        } finally {
            lock.unlock();
        }

        if (toClose != null) {
            closeChannel(toClose);
        }
        LOG.info("Unsubscribed from {}", subscriptionId);
        return true;
    }

    /**
     * Deactivates every open channel and forgets all subscriptions. Idempotent; a second call
     * finds nothing to close and returns true.
     *
     * @return true if every channel deactivated cleanly, false if any step failed (remaining
     *         channels are still attempted)
     */
    public boolean unsubscribeAll() {
        List<RealtimeChannel> toClose;
        lock.lock();
        try {
            subscriptions.values().forEach(TableSubscription::close);
            toClose = new ArrayList<>(channels.values());
            subscriptions.clear();
            handlerSlots.clear();
            channels.clear();
        } finally {
            lock.unlock();
        }

        boolean clean = true;
        for (RealtimeChannel channel : toClose) {
            try {
                closeChannel(channel);
            } catch (RuntimeException e) {
                clean = false;
                LOG.error("Failed to unsubscribe channel {}: {}", channel.name(), e.getMessage());
            }
        }
        if (clean) {
            LOG.info("Unsubscribed from all subscriptions ({} channel(s))", toClose.size());
        } else {
            LOG.error("Unsubscribe-all finished with failures; some channels may still be open");
        }
        return clean;
    }

    public boolean isSubscribed(String subscriptionId) {
        lock.lock();
        try {
            return subscriptions.containsKey(subscriptionId);
        } finally {
            lock.unlock();
        }
    }

    /** Identifiers of live subscriptions, in creation order. */
    public List<String> activeSubscriptionIds() {
        lock.lock();
        try {
            return List.copyOf(subscriptions.keySet());
        } finally {
            lock.unlock();
        }
    }

    public int openChannelCount() {
        lock.lock();
        try {
            return channels.size();
        } finally {
            lock.unlock();
        }
    }

    /** Number of triples holding a transport handler on an open channel, live or inert. */
    int handlerSlotCount() {
        lock.lock();
        try {
            return handlerSlots.size();
        } finally {
            lock.unlock();
        }
    }

    /** Number of callbacks attached to a subscription; 0 when unknown. */
    public int callbackCount(String subscriptionId) {
        lock.lock();
        try {
            TableSubscription s = subscriptions.get(subscriptionId);
            return s == null ? 0 : s.callbacks.size();
        } finally {
            lock.unlock();
        }
    }

    private RealtimeChannel openTableChannel(WatchedTable table) {
        String name = table.tableName() + properties.getTableChannelSuffix();
        try {
            RealtimeChannel channel = transport.openChannel(name);
            LOG.debug("Opened channel {} for table {}", name, table);
            return channel;
        } catch (TransportException e) {
            metrics.incrementTransportFailure("open");
            throw e;
        } catch (RuntimeException e) {
            metrics.incrementTransportFailure("open");
            throw new TransportException("Failed to open channel", name, e);
        }
    }

    private void registerHandler(RealtimeChannel channel, TableSubscription subscription) {
        channel.on(subscription.kind, subscription.table, subscription.filter, payload -> {
            if (subscription.closed) {
                return;
            }
            CallbackList<ChangePayload> target = subscription.callbacks;
            if (!properties.getSchema().equals(payload.schema())) {
                LOG.debug("Ignoring {} change from schema {}", subscription.table, payload.schema());
                return;
            }
            metrics.recordEvent(subscription.table.tableName(), payload.kind());
            dispatcher.dispatch(subscription.channelName, () -> target.dispatch(payload));
        });
    }

    private void rollback(TableSubscription subscription, ChangeCallback<ChangePayload> callback) {
        RealtimeChannel orphan = null;
        lock.lock();
        try {
            subscription.callbacks.remove(callback);
            if (subscription.callbacks.isEmpty() && subscriptions.remove(subscription.id, subscription)) {
                subscription.close();
            }
            boolean tableUnused = subscriptions.values().stream().noneMatch(s -> s.table == subscription.table);
            if (tableUnused) {
                orphan = channels.remove(subscription.table);
                dropHandlerSlots(subscription.table);
            }
        } finally {
            lock.unlock();
        }
        if (orphan != null) {
            try {
                closeChannel(orphan);
            } catch (TransportException e) {
                LOG.warn("Channel {} left open after failed activation", orphan.name());
            }
        }
    }

    private void dropHandlerSlots(WatchedTable table) {
        handlerSlots.values().removeIf(slot -> slot.table == table);
    }

    private void closeChannel(RealtimeChannel channel) {
        dispatcher.release(channel.name());
        try {
            TransportCalls.await(channel::deactivate, properties.getDeactivationTimeoutMs(), "deactivate",
                    channel.name());
            LOG.info("Deactivated channel {}", channel.name());
        } catch (TransportException e) {
            metrics.incrementTransportFailure("deactivate");
            LOG.error("Failed to deactivate channel {}: {}", channel.name(), e.getMessage());
            throw e;
        }
    }

    /** Resolves the table named by the identifier prefix, falling back to the recorded table. */
    private static WatchedTable tableOf(String subscriptionId, TableSubscription subscription) {
        int sep = subscriptionId.indexOf(':');
        if (sep > 0) {
            try {
                return WatchedTable.fromTableName(subscriptionId.substring(0, sep));
            } catch (IllegalArgumentException e) {
                LOG.debug("Subscription id {} has no table prefix", subscriptionId);
            }
        }
        return subscription.table;
    }

    private static final class TableSubscription {
        final String id;
        final WatchedTable table;
        final ChangeEventKind kind;
        final FilterExpression filter;
        final String channelName;
        volatile CallbackList<ChangePayload> callbacks;
        volatile boolean closed = true;

        TableSubscription(String id, WatchedTable table, ChangeEventKind kind, FilterExpression filter,
                          String channelName) {
            this.id = id;
            this.table = table;
            this.kind = kind;
            this.filter = filter;
            this.channelName = channelName;
        }

        // callbacks is published before closed flips, so a handler seeing closed == false reads the new list
        void open(CallbackList<ChangePayload> fresh) {
            callbacks = fresh;
            closed = false;
        }

        void close() {
            closed = true;
            callbacks.clear();
        }
    }
}
