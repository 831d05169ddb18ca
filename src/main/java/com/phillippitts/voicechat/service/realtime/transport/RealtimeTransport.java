package com.phillippitts.voicechat.service.realtime.transport;

/**
 * Change-notification transport consumed by the realtime layer.
 *
 * <p>Implementations deliver ordered per-channel events over a persistent connection.
 * How changes are captured at the source is outside this contract.
 *
 * @see InMemoryRealtimeTransport
 */
public interface RealtimeTransport {

    /**
     * Creates (or returns the open) channel with the given name. The channel is inactive
     * until {@link RealtimeChannel#activate()} is called.
     *
     * @param name channel name
     * @return channel handle
     * @throws com.phillippitts.voicechat.exception.TransportException if the channel cannot be created
     */
    RealtimeChannel openChannel(String name);
}
