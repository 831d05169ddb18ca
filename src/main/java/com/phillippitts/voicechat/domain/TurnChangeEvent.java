package com.phillippitts.voicechat.domain;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable view of a conversation turn row after a change.
 *
 * @param id             turn id
 * @param conversationId owning conversation
 * @param role           author of the turn
 * @param content        turn text (empty for audio-only turns, never null)
 * @param audioUrl       optional recorded audio location
 * @param createdAt      row creation time
 * @param updatedAt      last modification time
 * @param metadata       free-form metadata, empty when the row carries none
 */
public record TurnChangeEvent(
        String id,
        String conversationId,
        ConversationRole role,
        String content,
        String audioUrl,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        Map<String, Object> metadata
) {

    public TurnChangeEvent {
        Objects.requireNonNull(id, "Turn id must not be null");
        Objects.requireNonNull(conversationId, "Conversation id must not be null");
        Objects.requireNonNull(role, "Role must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        Objects.requireNonNull(updatedAt, "updatedAt must not be null");
        content = content == null ? "" : content;
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
