package com.phillippitts.voicechat.domain;

/**
 * Lifecycle status of a conversation row.
 */
public enum ConversationStatus {
    ACTIVE("active"),
    ARCHIVED("archived"),
    DELETED("deleted");

    private final String wireValue;

    ConversationStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * @throws IllegalArgumentException if the value is not a known status
     */
    public static ConversationStatus fromWire(String value) {
        for (ConversationStatus s : values()) {
            if (s.wireValue.equals(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown conversation status: " + value);
    }
}
