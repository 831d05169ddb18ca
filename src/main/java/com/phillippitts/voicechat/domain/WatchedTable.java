package com.phillippitts.voicechat.domain;

/**
 * Entity collections whose row changes can be watched. Each table is multiplexed onto
 * at most one shared channel by the subscription registry.
 */
public enum WatchedTable {
    CONVERSATIONS("conversations"),
    CONVERSATION_TURNS("conversation_turns"),
    SYSTEM_PROMPTS("system_prompts"),
    USERS("users");

    private final String tableName;

    WatchedTable(String tableName) {
        this.tableName = tableName;
    }

    /** Table name as it appears on the wire and in subscription identifiers. */
    public String tableName() {
        return tableName;
    }

    /**
     * Looks up a table by its wire name.
     *
     * @param tableName wire name, e.g. {@code "conversation_turns"}
     * @return matching table
     * @throws IllegalArgumentException if no table has that name
     */
    public static WatchedTable fromTableName(String tableName) {
        for (WatchedTable t : values()) {
            if (t.tableName.equals(tableName)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown table: " + tableName);
    }

    @Override
    public String toString() {
        return tableName;
    }
}
