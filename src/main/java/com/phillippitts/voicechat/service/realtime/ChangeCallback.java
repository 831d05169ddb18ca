package com.phillippitts.voicechat.service.realtime;

/**
 * Consumer of decoded change events.
 *
 * <p>Callbacks run on the dispatch pool, one event at a time per channel. A callback may start
 * asynchronous work of its own; anything it throws is logged and discarded without affecting
 * other callbacks or the channel. Callbacks may read, but must not change, subscription state.
 *
 * @param <T> event type
 */
@FunctionalInterface
public interface ChangeCallback<T> {

    void onChange(T event) throws Exception;
}
