package com.phillippitts.voicechat.domain;

/**
 * Author of a conversation turn.
 */
public enum ConversationRole {
    USER("user"),
    ASSISTANT("assistant"),
    SYSTEM("system");

    private final String wireValue;

    ConversationRole(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * @throws IllegalArgumentException if the value is not one of user, assistant, system
     */
    public static ConversationRole fromWire(String value) {
        for (ConversationRole r : values()) {
            if (r.wireValue.equals(value)) {
                return r;
            }
        }
        throw new IllegalArgumentException("Unknown conversation role: " + value);
    }
}
