package com.phillippitts.voicechat.service.realtime.transport;

/**
 * Transport-level receiver for change payloads registered on a {@link RealtimeChannel}.
 * Invoked by the transport in per-channel delivery order.
 */
@FunctionalInterface
public interface ChangeHandler {

    void handle(ChangePayload payload);
}
