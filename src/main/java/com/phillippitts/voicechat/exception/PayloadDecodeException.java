package com.phillippitts.voicechat.exception;

/**
 * Thrown when a change payload is malformed or misses a required field.
 * Decode failures never reach subscriber callbacks: the event is logged and dropped.
 */
public class PayloadDecodeException extends VoiceChatException {

    private final String table;
    private final String field;

    public PayloadDecodeException(String message, String table, String field) {
        super(message + " (table: " + table + ", field: " + field + ")");
        this.table = table;
        this.field = field;
    }

    public PayloadDecodeException(String message, String table, String field, Throwable cause) {
        super(message + " (table: " + table + ", field: " + field + ")", cause);
        this.table = table;
        this.field = field;
    }

    public String getTable() {
        return table;
    }

    public String getField() {
        return field;
    }
}
