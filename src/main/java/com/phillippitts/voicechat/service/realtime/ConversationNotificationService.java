package com.phillippitts.voicechat.service.realtime;

import com.phillippitts.voicechat.config.properties.RealtimeProperties;
import com.phillippitts.voicechat.domain.ChangeEventKind;
import com.phillippitts.voicechat.domain.ConversationChangeEvent;
import com.phillippitts.voicechat.domain.FilterExpression;
import com.phillippitts.voicechat.domain.TurnChangeEvent;
import com.phillippitts.voicechat.domain.WatchedTable;
import com.phillippitts.voicechat.exception.PayloadDecodeException;
import com.phillippitts.voicechat.exception.TransportException;
import com.phillippitts.voicechat.service.metrics.RealtimeMetrics;
import com.phillippitts.voicechat.service.realtime.codec.ChangeEventDecoder;
import com.phillippitts.voicechat.service.realtime.transport.ChangePayload;
import com.phillippitts.voicechat.service.realtime.transport.RealtimeChannel;
import com.phillippitts.voicechat.service.realtime.transport.RealtimeTransport;
import com.phillippitts.voicechat.service.realtime.transport.TransportCalls;
import com.phillippitts.voicechat.util.LogSanitizer;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Conversation-aware façade over the change-notification transport.
 *
 * <p>Two call shapes are offered:
 * <ul>
 *   <li><b>Per-entity watches</b> ({@link #watchConversation}, {@link #watchTurns}): one direct
 *       channel per entity, named {@code conversation:<id>} or {@code turns:<id>}, opened once
 *       per process. Further watches on the same entity only append callbacks; a watch that
 *       arrives while the channel is still activating shares that activation's outcome. Payloads
 *       are decoded into {@link ConversationChangeEvent} / {@link TurnChangeEvent} before fan-out.
 *       Events still queued when a channel is torn down reach no callback.</li>
 *   <li><b>Group watches</b> ({@link #watchUserConversations}, {@link #watchConversationTurns}):
 *       delegate to the {@link SubscriptionRegistry} and record the returned identifiers under a
 *       group id ({@code user:<id>} or {@code conversation:<id>}) for bulk teardown. Insert and
 *       update callbacks receive decoded events; delete callbacks receive the raw
 *       {@link ChangePayload}, since deletes carry no post-change row.</li>
 * </ul>
 *
 * <p>Error handling: per-entity operations report transport failures by logging and returning
 * false; group subscribe operations propagate {@link TransportException}. Decode failures drop
 * the event; callback failures are isolated per callback.
 *
 * <p>Thread Safety: state changes are serialized by one lock, never held across transport
 * waits. Callback lists are read lock-free from dispatch threads.
 */
@Service
public class ConversationNotificationService {

    private static final Logger LOG = LogManager.getLogger(ConversationNotificationService.class);

    private static final int CONTENT_PREVIEW_CHARS = 40;

    private final RealtimeTransport transport;
    private final SubscriptionRegistry registry;
    private final ChannelDispatcher dispatcher;
    private final ChangeEventDecoder decoder;
    private final RealtimeMetrics metrics;
    private final RealtimeProperties properties;

    private final ReentrantLock lock = new ReentrantLock();

    // Activated direct channels only; channels still activating live in pendingActivations.
    private final Map<String, RealtimeChannel> directChannels = new LinkedHashMap<>();
    private final Map<String, CompletableFuture<Boolean>> pendingActivations = new HashMap<>();
    private final Map<String, CallbackList<ConversationChangeEvent>> conversationCallbacks = new HashMap<>();
    private final Map<String, CallbackList<TurnChangeEvent>> turnInsertCallbacks = new HashMap<>();
    private final Map<String, CallbackList<TurnChangeEvent>> turnUpdateCallbacks = new HashMap<>();
    private final Map<String, List<String>> userSubscriptionIds = new LinkedHashMap<>();
    private final Map<String, List<String>> conversationSubscriptionIds = new LinkedHashMap<>();

    private volatile boolean running = true;

    public ConversationNotificationService(RealtimeTransport transport,
                                           SubscriptionRegistry registry,
                                           ChannelDispatcher dispatcher,
                                           ChangeEventDecoder decoder,
                                           RealtimeMetrics metrics,
                                           RealtimeProperties properties) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    static String conversationChannelName(String conversationId) {
        return "conversation:" + conversationId;
    }

    static String turnsChannelName(String conversationId) {
        return "turns:" + conversationId;
    }

    static String userGroupId(String userId) {
        return "user:" + userId;
    }

    static String conversationGroupId(String conversationId) {
        return "conversation:" + conversationId;
    }

    // ---------------------------------------------------------------------------------------
    // Per-entity watches
    // ---------------------------------------------------------------------------------------

    /**
     * Watches updates of one conversation.
     *
     * @param conversationId conversation to watch
     * @param onUpdate       optional callback for decoded updates
     * @return true if the conversation is watched (newly or already), false if the channel
     *         could not be activated or the service is shut down; a watch joining an activation
     *         in flight returns that activation's outcome
     */
    public boolean watchConversation(String conversationId, ChangeCallback<ConversationChangeEvent> onUpdate) {
        requireId(conversationId, "conversationId");
        String channelName = conversationChannelName(conversationId);

        RealtimeChannel channel;
        CallbackList<ConversationChangeEvent> callbacks;
        CompletableFuture<Boolean> activation;
        lock.lock();
        try {
            if (!running) {
                LOG.warn("Refusing to watch conversation {}: service is shut down", conversationId);
                return false;
            }
            CompletableFuture<Boolean> inFlight = pendingActivations.get(channelName);
            if (directChannels.containsKey(channelName) || inFlight != null) {
                appendCallback(conversationCallbacks.get(conversationId), onUpdate);
                if (inFlight == null) {
                    LOG.info("Already subscribed to conversation {}", conversationId);
                    return true;
                }
                activation = inFlight;
                channel = null;
                callbacks = null;
            } else {
                channel = openDirectChannel(channelName);
                if (channel == null) {
                    return false;
                }
                callbacks = new CallbackList<>(channelName, metrics);
                CallbackList<ConversationChangeEvent> target = callbacks;
                channel.on(ChangeEventKind.UPDATE, WatchedTable.CONVERSATIONS,
                        FilterExpression.eq("id", conversationId),
                        payload -> onConversationUpdate(channelName, conversationId, payload, target));
                conversationCallbacks.put(conversationId, callbacks);
                appendCallback(callbacks, onUpdate);
                activation = new CompletableFuture<>();
                pendingActivations.put(channelName, activation);
            }
        } finally {
            lock.unlock();
        }

        if (channel == null) {
            LOG.debug("Waiting for in-flight activation of {}", channelName);
            return activation.join();
        }
        CallbackList<ConversationChangeEvent> opened = callbacks;
        if (!completeActivation(channel, activation, () -> dropCallbacks(conversationCallbacks, conversationId, opened))) {
            LOG.error("Failed to subscribe to conversation {}", conversationId);
            return false;
        }
        LOG.info("Subscribed to conversation {}", conversationId);
        return true;
    }

    /**
     * Watches turn inserts and updates of one conversation.
     *
     * @param conversationId conversation whose turns to watch
     * @param onInsert       optional callback for new turns
     * @param onUpdate       optional callback for changed turns
     * @return true if the turns are watched (newly or already), false if the channel could not
     *         be activated or the service is shut down; a watch joining an activation in flight
     *         returns that activation's outcome
     */
    public boolean watchTurns(String conversationId,
                              ChangeCallback<TurnChangeEvent> onInsert,
                              ChangeCallback<TurnChangeEvent> onUpdate) {
        requireId(conversationId, "conversationId");
        String channelName = turnsChannelName(conversationId);

        RealtimeChannel channel;
        CallbackList<TurnChangeEvent> inserts;
        CallbackList<TurnChangeEvent> updates;
        CompletableFuture<Boolean> activation;
        lock.lock();
        try {
            if (!running) {
                LOG.warn("Refusing to watch turns of {}: service is shut down", conversationId);
                return false;
            }
            CompletableFuture<Boolean> inFlight = pendingActivations.get(channelName);
            if (directChannels.containsKey(channelName) || inFlight != null) {
                appendCallback(turnInsertCallbacks.get(conversationId), onInsert);
                appendCallback(turnUpdateCallbacks.get(conversationId), onUpdate);
                if (inFlight == null) {
                    LOG.info("Already subscribed to turns for conversation {}", conversationId);
                    return true;
                }
                activation = inFlight;
                channel = null;
                inserts = null;
                updates = null;
            } else {
                channel = openDirectChannel(channelName);
                if (channel == null) {
                    return false;
                }
                inserts = new CallbackList<>(channelName, metrics);
                updates = new CallbackList<>(channelName, metrics);
                CallbackList<TurnChangeEvent> insertTarget = inserts;
                CallbackList<TurnChangeEvent> updateTarget = updates;
                FilterExpression filter = FilterExpression.eq("conversation_id", conversationId);
                channel.on(ChangeEventKind.INSERT, WatchedTable.CONVERSATION_TURNS, filter,
                        payload -> onTurnChange(channelName, conversationId, payload, insertTarget));
                channel.on(ChangeEventKind.UPDATE, WatchedTable.CONVERSATION_TURNS, filter,
                        payload -> onTurnChange(channelName, conversationId, payload, updateTarget));
                turnInsertCallbacks.put(conversationId, inserts);
                turnUpdateCallbacks.put(conversationId, updates);
                appendCallback(inserts, onInsert);
                appendCallback(updates, onUpdate);
                activation = new CompletableFuture<>();
                pendingActivations.put(channelName, activation);
            }
        } finally {
            lock.unlock();
        }

        if (channel == null) {
            LOG.debug("Waiting for in-flight activation of {}", channelName);
            return activation.join();
        }
        CallbackList<TurnChangeEvent> openedInserts = inserts;
        CallbackList<TurnChangeEvent> openedUpdates = updates;
        if (!completeActivation(channel, activation, () -> {
            dropCallbacks(turnInsertCallbacks, conversationId, openedInserts);
            dropCallbacks(turnUpdateCallbacks, conversationId, openedUpdates);
        })) {
            LOG.error("Failed to subscribe to turns for conversation {}", conversationId);
            return false;
        }
        LOG.info("Subscribed to turns for conversation {}", conversationId);
        return true;
    }

    /**
     * Stops watching a conversation and drops its callbacks.
     *
     * @return true if a channel was torn down, false if none was open or deactivation failed
     */
    public boolean unwatchConversation(String conversationId) {
        RealtimeChannel channel;
        lock.lock();
        try {
            channel = directChannels.remove(conversationChannelName(conversationId));
            if (channel == null) {
                LOG.warn("Not subscribed to conversation {}", conversationId);
                return false;
            }
            dropCallbacks(conversationCallbacks, conversationId, conversationCallbacks.get(conversationId));
        } finally {
            lock.unlock();
        }
        if (!deactivate(channel)) {
            return false;
        }
        LOG.info("Unsubscribed from conversation {}", conversationId);
        return true;
    }

    /**
     * Stops watching the turns of a conversation and drops their callbacks.
     *
     * @return true if a channel was torn down, false if none was open or deactivation failed
     */
    public boolean unwatchTurns(String conversationId) {
        RealtimeChannel channel;
        lock.lock();
        try {
            channel = directChannels.remove(turnsChannelName(conversationId));
            if (channel == null) {
                LOG.warn("Not subscribed to turns for conversation {}", conversationId);
                return false;
            }
            dropCallbacks(turnInsertCallbacks, conversationId, turnInsertCallbacks.get(conversationId));
            dropCallbacks(turnUpdateCallbacks, conversationId, turnUpdateCallbacks.get(conversationId));
        } finally {
            lock.unlock();
        }
        if (!deactivate(channel)) {
            return false;
        }
        LOG.info("Unsubscribed from turns for conversation {}", conversationId);
        return true;
    }

    // ---------------------------------------------------------------------------------------
    // Group watches (registry-backed)
    // ---------------------------------------------------------------------------------------

    /**
     * Watches the conversations of one user through the shared conversations channel.
     * One registry subscription is made per non-null callback. Updates and inserts are decoded
     * first; a row that fails to decode is logged, counted and dropped.
     *
     * @return group id {@code user:<userId>}
     * @throws TransportException if the registry cannot activate its channel; subscriptions made
     *                            before the failure stay recorded under the group
     * @throws IllegalStateException if the service is shut down
     */
    public String watchUserConversations(String userId,
                                         ChangeCallback<ConversationChangeEvent> onUpdate,
                                         ChangeCallback<ConversationChangeEvent> onInsert,
                                         ChangeCallback<ChangePayload> onDelete) {
        requireId(userId, "userId");
        Map<ChangeEventKind, ChangeCallback<ChangePayload>> byKind = new LinkedHashMap<>();
        byKind.put(ChangeEventKind.UPDATE, decoding(onUpdate, decoder::decodeConversation, userId));
        byKind.put(ChangeEventKind.INSERT, decoding(onInsert, decoder::decodeConversation, userId));
        byKind.put(ChangeEventKind.DELETE, onDelete);
        String groupId = userGroupId(userId);
        subscribeGroup(groupId, userSubscriptionIds, WatchedTable.CONVERSATIONS,
                FilterExpression.eq("user_id", userId), byKind);
        LOG.info("Subscribed to conversations for user {}", userId);
        return groupId;
    }

    /**
     * Watches the turns of one conversation through the shared turns channel.
     * One registry subscription is made per non-null callback. Inserts and updates are decoded
     * into {@link TurnChangeEvent}s first; a row that fails to decode is logged, counted and dropped.
     *
     * @return group id {@code conversation:<conversationId>}
     * @throws TransportException if the registry cannot activate its channel; subscriptions made
     *                            before the failure stay recorded under the group
     * @throws IllegalStateException if the service is shut down
     */
    public String watchConversationTurns(String conversationId,
                                         ChangeCallback<TurnChangeEvent> onInsert,
                                         ChangeCallback<TurnChangeEvent> onUpdate,
                                         ChangeCallback<ChangePayload> onDelete) {
        requireId(conversationId, "conversationId");
        Map<ChangeEventKind, ChangeCallback<ChangePayload>> byKind = new LinkedHashMap<>();
        byKind.put(ChangeEventKind.INSERT, decoding(onInsert, decoder::decodeTurn, conversationId));
        byKind.put(ChangeEventKind.UPDATE, decoding(onUpdate, decoder::decodeTurn, conversationId));
        byKind.put(ChangeEventKind.DELETE, onDelete);
        String groupId = conversationGroupId(conversationId);
        subscribeGroup(groupId, conversationSubscriptionIds, WatchedTable.CONVERSATION_TURNS,
                FilterExpression.eq("conversation_id", conversationId), byKind);
        LOG.info("Subscribed to turns for conversation {}", conversationId);
        return groupId;
    }

    /**
     * Tears down every registry subscription of a user's group.
     *
     * @return false if the user has no recorded subscriptions or a teardown step failed
     */
    public boolean unwatchUserConversations(String userId) {
        return unsubscribeGroup(userGroupId(userId), userSubscriptionIds);
    }

    /**
     * Tears down every registry subscription of a conversation's turns group.
     *
     * @return false if the conversation has no recorded subscriptions or a teardown step failed
     */
    public boolean unwatchConversationTurns(String conversationId) {
        return unsubscribeGroup(conversationGroupId(conversationId), conversationSubscriptionIds);
    }

    // ---------------------------------------------------------------------------------------
    // Lifecycle and introspection
    // ---------------------------------------------------------------------------------------

    /**
     * Closes every direct channel and every registry subscription, then clears all state.
     * Idempotent: a second call has nothing left to close.
     *
     * @return true if everything closed cleanly, false if any step failed
     */
    public boolean shutdown() {
        List<RealtimeChannel> toClose;
        lock.lock();
        try {
            running = false;
            toClose = new ArrayList<>(directChannels.values());
            directChannels.clear();
            conversationCallbacks.values().forEach(CallbackList::clear);
            turnInsertCallbacks.values().forEach(CallbackList::clear);
            turnUpdateCallbacks.values().forEach(CallbackList::clear);
            conversationCallbacks.clear();
            turnInsertCallbacks.clear();
            turnUpdateCallbacks.clear();
            userSubscriptionIds.clear();
            conversationSubscriptionIds.clear();
        } finally {
            lock.unlock();
        }

        boolean clean = true;
        for (RealtimeChannel channel : toClose) {
            clean &= deactivate(channel);
        }
        try {
            clean &= registry.unsubscribeAll();
        } catch (RuntimeException e) {
            clean = false;
            LOG.error("Failed to release registry subscriptions: {}", e.getMessage());
        }

        if (clean) {
            LOG.info("Unsubscribed from all subscriptions");
        } else {
            LOG.error("Shutdown finished with failures; some channels may still be open");
        }
        return clean;
    }

    @PreDestroy
    void stop() {
        if (!shutdown()) {
            LOG.warn("Realtime notifications did not shut down cleanly");
        }
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isWatchingConversation(String conversationId) {
        lock.lock();
        try {
            return directChannels.containsKey(conversationChannelName(conversationId));
        } finally {
            lock.unlock();
        }
    }

    public boolean isWatchingTurns(String conversationId) {
        lock.lock();
        try {
            return directChannels.containsKey(turnsChannelName(conversationId));
        } finally {
            lock.unlock();
        }
    }

    /** Callbacks attached to a conversation's direct channel, activating or active. Visible for tests. */
    int conversationCallbackCount(String conversationId) {
        lock.lock();
        try {
            CallbackList<ConversationChangeEvent> callbacks = conversationCallbacks.get(conversationId);
            return callbacks == null ? 0 : callbacks.size();
        } finally {
            lock.unlock();
        }
    }

    /** Registry subscription ids recorded under a group id; empty when none. */
    public List<String> groupSubscriptionIds(String groupId) {
        lock.lock();
        try {
            List<String> ids = userSubscriptionIds.get(groupId);
            if (ids == null) {
                ids = conversationSubscriptionIds.get(groupId);
            }
            return ids == null ? List.of() : List.copyOf(ids);
        } finally {
            lock.unlock();
        }
    }

    public RealtimeStatus snapshot() {
        lock.lock();
        try {
            List<String> conversations = new ArrayList<>();
            List<String> turns = new ArrayList<>();
            for (String name : directChannels.keySet()) {
                if (name.startsWith("conversation:")) {
                    conversations.add(name.substring("conversation:".length()));
                } else {
                    turns.add(name.substring("turns:".length()));
                }
            }
            Map<String, List<String>> groups = new LinkedHashMap<>();
            userSubscriptionIds.forEach((k, v) -> groups.put(k, List.copyOf(v)));
            conversationSubscriptionIds.forEach((k, v) -> groups.put(k, List.copyOf(v)));
            return new RealtimeStatus(
                    running,
                    List.copyOf(conversations),
                    List.copyOf(turns),
                    Map.copyOf(groups),
                    registry.activeSubscriptionIds(),
                    directChannels.size() + registry.openChannelCount()
            );
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------------------------------
    // Dispatch
    // ---------------------------------------------------------------------------------------

    private void onConversationUpdate(String channelName, String conversationId, ChangePayload payload,
                                      CallbackList<ConversationChangeEvent> callbacks) {
        if (!acceptSchema(payload)) {
            return;
        }
        metrics.recordEvent(payload.table().tableName(), payload.kind());
        dispatcher.dispatch(channelName, () -> {
            ConversationChangeEvent event = decode(payload, decoder::decodeConversation, conversationId);
            if (event != null) {
                callbacks.dispatch(event);
            }
        });
    }

    private void onTurnChange(String channelName, String conversationId, ChangePayload payload,
                              CallbackList<TurnChangeEvent> callbacks) {
        if (!acceptSchema(payload)) {
            return;
        }
        metrics.recordEvent(payload.table().tableName(), payload.kind());
        dispatcher.dispatch(channelName, () -> {
            TurnChangeEvent turn = decode(payload, decoder::decodeTurn, conversationId);
            if (turn == null) {
                return;
            }
            if (LOG.isDebugEnabled()) {
                LOG.debug("Turn {} {} in {}: role={}, content='{}'", turn.id(), payload.kind(), conversationId,
                        turn.role(), LogSanitizer.truncate(turn.content(), CONTENT_PREVIEW_CHARS));
            }
            callbacks.dispatch(turn);
        });
    }

    /** Adapts a typed group callback to the registry's raw payloads; null stays null. */
    private <T> ChangeCallback<ChangePayload> decoding(ChangeCallback<T> callback,
                                                       Function<ChangePayload, T> decodeFn, String entityId) {
        if (callback == null) {
            return null;
        }
        return payload -> {
            T event = decode(payload, decodeFn, entityId);
            if (event != null) {
                callback.onChange(event);
            }
        };
    }

    private <T> T decode(ChangePayload payload, Function<ChangePayload, T> decodeFn, String entityId) {
        try {
            return decodeFn.apply(payload);
        } catch (PayloadDecodeException e) {
            metrics.incrementDecodeFailure(e.getTable());
            LOG.error("Dropping {} {} for {}: {}", payload.table(), payload.kind(), entityId, e.getMessage());
            return null;
        }
    }

    private boolean acceptSchema(ChangePayload payload) {
        if (properties.getSchema().equals(payload.schema())) {
            return true;
        }
        LOG.debug("Ignoring {} change from schema {}", payload.table(), payload.schema());
        return false;
    }

    // ---------------------------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------------------------

    private void subscribeGroup(String groupId,
                                Map<String, List<String>> groups,
                                WatchedTable table,
                                FilterExpression filter,
                                Map<ChangeEventKind, ChangeCallback<ChangePayload>> callbacksByKind) {
        if (!running) {
            throw new IllegalStateException("Realtime notifications are shut down");
        }
        List<String> created = new ArrayList<>();
        try {
            callbacksByKind.forEach((kind, callback) -> {
                if (callback != null) {
                    created.add(registry.subscribe(table, kind, callback, filter));
                }
            });
        } finally {
            recordGroup(groupId, groups, created);
        }
    }

    private void recordGroup(String groupId, Map<String, List<String>> groups, List<String> ids) {
        lock.lock();
        try {
            if (ids.isEmpty()) {
                LOG.debug("Group {} requested with no callbacks; nothing to record", groupId);
                return;
            }
            List<String> group = groups.computeIfAbsent(groupId, k -> new ArrayList<>());
            for (String id : ids) {
                if (!group.contains(id)) {
                    group.add(id);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private boolean unsubscribeGroup(String groupId, Map<String, List<String>> groups) {
        List<String> ids;
        lock.lock();
        try {
            ids = groups.remove(groupId);
        } finally {
            lock.unlock();
        }
        if (ids == null || ids.isEmpty()) {
            LOG.warn("No subscriptions found for {}", groupId);
            return false;
        }

        boolean clean = true;
        for (String id : ids) {
            try {
                registry.unsubscribe(id);
            } catch (TransportException e) {
                clean = false;
                LOG.error("Failed to unsubscribe {} of {}: {}", id, groupId, e.getMessage());
            }
        }
        LOG.info("Unsubscribed {} subscription(s) of {}", ids.size(), groupId);
        return clean;
    }

    private static <T> void appendCallback(CallbackList<T> callbacks, ChangeCallback<T> callback) {
        if (callback != null && callbacks != null) {
            callbacks.add(callback);
        }
    }

    /** Forgets an entity's callback list and empties it so queued dispatches reach nobody. Caller holds the lock. */
    private static <T> void dropCallbacks(Map<String, CallbackList<T>> lists, String entityId,
                                          CallbackList<T> callbacks) {
        if (callbacks == null) {
            return;
        }
        lists.remove(entityId, callbacks);
        callbacks.clear();
    }

    /** Opens a direct channel; returns null (logged) when the transport refuses. Caller holds the lock. */
    private RealtimeChannel openDirectChannel(String channelName) {
        try {
            return transport.openChannel(channelName);
        } catch (RuntimeException e) {
            metrics.incrementTransportFailure("open");
            LOG.error("Failed to open channel {}: {}", channelName, e.getMessage());
            return null;
        }
    }

    private boolean activate(RealtimeChannel channel) {
        try {
            TransportCalls.await(channel::activate, properties.getActivationTimeoutMs(), "activate", channel.name());
            return true;
        } catch (TransportException e) {
            metrics.incrementTransportFailure("activate");
            LOG.error("Failed to activate channel {}: {}", channel.name(), e.getMessage());
            return false;
        }
    }

    private boolean deactivate(RealtimeChannel channel) {
        dispatcher.release(channel.name());
        try {
            TransportCalls.await(channel::deactivate, properties.getDeactivationTimeoutMs(), "deactivate",
                    channel.name());
            return true;
        } catch (TransportException e) {
            metrics.incrementTransportFailure("deactivate");
            LOG.error("Failed to deactivate channel {}: {}", channel.name(), e.getMessage());
            return false;
        }
    }

    /**
     * Activates a freshly opened direct channel and records it on success. On failure, or when
     * the service shut down meanwhile, the callbacks are dropped and the channel is deactivated
     * so its handler registrations do not outlive it. Watches waiting on the activation get the
     * same outcome.
     */
    private boolean completeActivation(RealtimeChannel channel, CompletableFuture<Boolean> activation,
                                       Runnable dropCallbacks) {
        boolean recorded = false;
        try {
            boolean active = activate(channel);
            lock.lock();
            try {
                pendingActivations.remove(channel.name(), activation);
                recorded = active && running;
                if (recorded) {
                    directChannels.put(channel.name(), channel);
                } else {
                    dropCallbacks.run();
                }
            } finally {
                lock.unlock();
            }
            if (!recorded) {
                if (active) {
                    LOG.warn("Service shut down while {} was activating", channel.name());
                }
                deactivate(channel);
            }
        } finally {
            activation.complete(recorded);
        }
        return recorded;
    }

    private static void requireId(String id, String name) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
