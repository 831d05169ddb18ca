package com.phillippitts.voicechat.exception;

/**
 * Base exception for all voice chat application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class VoiceChatException extends RuntimeException {

    public VoiceChatException(String message) {
        super(message);
    }

    public VoiceChatException(String message, Throwable cause) {
        super(message, cause);
    }

    public VoiceChatException(Throwable cause) {
        super(cause);
    }
}
