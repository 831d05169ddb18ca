package com.phillippitts.voicechat.service.realtime;

import com.phillippitts.voicechat.service.metrics.RealtimeMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered fan-out list of callbacks attached to one logical subscription.
 *
 * <p>{@link #dispatch(Object)} invokes every callback registered at the time of the call, in
 * registration order, each inside its own error boundary. Appending or removing callbacks
 * while a dispatch is running affects only later dispatches.
 *
 * @param <T> event type delivered to the callbacks
 */
public final class CallbackList<T> {

    private static final Logger LOG = LogManager.getLogger(CallbackList.class);

    static final String SUBSCRIPTION_CONTEXT_KEY = "subscription";

    private final String key;
    private final String scope;
    private final RealtimeMetrics metrics;
    private final List<ChangeCallback<? super T>> callbacks = new CopyOnWriteArrayList<>();

    /**
     * @param key     subscription key used in logs, e.g. {@code conversation:c1}
     * @param metrics failure counter sink
     */
    public CallbackList(String key, RealtimeMetrics metrics) {
        this.key = Objects.requireNonNull(key, "key");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        int sep = key.indexOf(':');
        this.scope = sep > 0 ? key.substring(0, sep) : key;
    }

    public String key() {
        return key;
    }

    public void add(ChangeCallback<? super T> callback) {
        callbacks.add(Objects.requireNonNull(callback, "callback"));
    }

    public boolean remove(ChangeCallback<? super T> callback) {
        return callbacks.remove(callback);
    }

    /** Detaches every callback; dispatches already queued against this list deliver to nobody. */
    public void clear() {
        callbacks.clear();
    }

    public int size() {
        return callbacks.size();
    }

    public boolean isEmpty() {
        return callbacks.isEmpty();
    }

    /**
     * Delivers the event to every callback.
     *
     * @param event decoded event
     * @return number of callbacks that completed without throwing
     */
    public int dispatch(T event) {
        int delivered = 0;
        for (ChangeCallback<? super T> callback : callbacks) {
            ThreadContext.put(SUBSCRIPTION_CONTEXT_KEY, key);
            try {
                callback.onChange(event);
                delivered++;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Callback for {} interrupted", key);
                metrics.incrementCallbackFailure(scope);
            } catch (Exception e) {
                LOG.warn("Callback for {} failed: {}", key, e.toString(), e);
                metrics.incrementCallbackFailure(scope);
            } finally {
                ThreadContext.remove(SUBSCRIPTION_CONTEXT_KEY);
            }
        }
        return delivered;
    }
}
