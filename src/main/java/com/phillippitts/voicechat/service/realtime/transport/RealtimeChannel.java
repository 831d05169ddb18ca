package com.phillippitts.voicechat.service.realtime.transport;

import com.phillippitts.voicechat.domain.ChangeEventKind;
import com.phillippitts.voicechat.domain.FilterExpression;
import com.phillippitts.voicechat.domain.WatchedTable;

import java.util.concurrent.CompletableFuture;

/**
 * One push connection multiplexing any number of (kind, table, filter, handler) registrations.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Obtained from {@link RealtimeTransport#openChannel(String)}</li>
 *   <li>Handlers registered with {@link #on}</li>
 *   <li>{@link #activate()} starts delivery; idempotent when already active</li>
 *   <li>{@link #deactivate()} stops delivery; the channel must not be reused afterwards</li>
 * </ol>
 *
 * <p>Activation and deactivation complete when the transport acknowledges them. Callers
 * must not hold locks while waiting on the returned futures.
 */
public interface RealtimeChannel {

    /**
     * @return human-readable channel name, e.g. {@code conversation:c1}
     */
    String name();

    /**
     * Registers a handler for one kind of change on one table.
     *
     * @param kind    change kind to receive
     * @param table   table to watch
     * @param filter  optional row filter; null means all rows
     * @param handler receiver invoked for each matching change
     */
    void on(ChangeEventKind kind, WatchedTable table, FilterExpression filter, ChangeHandler handler);

    /**
     * Starts event delivery.
     *
     * @return future completed when the transport acknowledges the subscription
     */
    CompletableFuture<Void> activate();

    boolean isActive();

    /**
     * Stops event delivery and releases the underlying connection resources.
     *
     * @return future completed when the transport acknowledges the teardown
     */
    CompletableFuture<Void> deactivate();
}
