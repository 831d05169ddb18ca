package com.phillippitts.voicechat.domain;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable view of a conversation row after a change.
 *
 * @param id             conversation id
 * @param title          conversation title (may be empty, never null)
 * @param userId         owning user
 * @param systemPromptId optional system prompt reference, null when unset
 * @param status         lifecycle status
 * @param createdAt      row creation time
 * @param updatedAt      last modification time
 * @param metadata       free-form metadata, empty when the row carries none
 */
public record ConversationChangeEvent(
        String id,
        String title,
        String userId,
        String systemPromptId,
        ConversationStatus status,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        Map<String, Object> metadata
) {

    public ConversationChangeEvent {
        Objects.requireNonNull(id, "Conversation id must not be null");
        Objects.requireNonNull(userId, "User id must not be null");
        Objects.requireNonNull(status, "Status must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        Objects.requireNonNull(updatedAt, "updatedAt must not be null");
        title = title == null ? "" : title;
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
