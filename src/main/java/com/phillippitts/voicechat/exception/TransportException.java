package com.phillippitts.voicechat.exception;

/**
 * Thrown when a channel cannot be opened, activated or deactivated at the transport boundary.
 * Always propagated to the caller that requested the subscription change.
 */
public class TransportException extends VoiceChatException {

    private final String channelName;

    public TransportException(String message, String channelName) {
        super(message + " (channel: " + channelName + ")");
        this.channelName = channelName;
    }

    public TransportException(String message, String channelName, Throwable cause) {
        super(message + " (channel: " + channelName + ")", cause);
        this.channelName = channelName;
    }

    public String getChannelName() {
        return channelName;
    }
}
