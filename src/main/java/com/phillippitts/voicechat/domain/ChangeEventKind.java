package com.phillippitts.voicechat.domain;

import java.util.Locale;

/**
 * Kind of row-level change carried by a change notification.
 *
 * <p>{@link #SELECT} exists so the set mirrors the transport's vocabulary; it is never
 * delivered as a live change event.
 */
public enum ChangeEventKind {
    INSERT,
    UPDATE,
    DELETE,
    SELECT;

    /**
     * Resolves a wire value such as {@code "INSERT"} (case-insensitive).
     *
     * @param value wire value
     * @return matching kind
     * @throws IllegalArgumentException if the value is blank or unknown
     */
    public static ChangeEventKind fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Change event kind must not be blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
