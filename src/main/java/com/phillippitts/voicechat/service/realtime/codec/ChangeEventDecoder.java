package com.phillippitts.voicechat.service.realtime.codec;

import com.phillippitts.voicechat.domain.ConversationChangeEvent;
import com.phillippitts.voicechat.domain.ConversationRole;
import com.phillippitts.voicechat.domain.ConversationStatus;
import com.phillippitts.voicechat.domain.TurnChangeEvent;
import com.phillippitts.voicechat.domain.WatchedTable;
import com.phillippitts.voicechat.exception.PayloadDecodeException;
import com.phillippitts.voicechat.service.realtime.transport.ChangePayload;
import com.phillippitts.voicechat.util.TimeUtils;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decodes the post-change row of a {@link ChangePayload} into domain events.
 *
 * <p>Rules applied to the {@code new} row:
 * <ul>
 *   <li>{@code created_at}/{@code updated_at} are required ISO-8601 timestamps</li>
 *   <li>{@code role} must be one of user, assistant, system</li>
 *   <li>{@code metadata} defaults to an empty map when absent or null</li>
 *   <li>{@code status} defaults to active when absent</li>
 * </ul>
 *
 * <p>Any violation raises {@link PayloadDecodeException}; callers drop the event.
 */
@Component
public class ChangeEventDecoder {

    /**
     * @throws PayloadDecodeException if the row is missing or malformed
     */
    public ConversationChangeEvent decodeConversation(ChangePayload payload) {
        Map<String, Object> row = requireRow(payload, WatchedTable.CONVERSATIONS);
        String table = WatchedTable.CONVERSATIONS.tableName();
        return new ConversationChangeEvent(
                requiredString(row, "id", table),
                optionalString(row, "title", table),
                requiredString(row, "user_id", table),
                optionalString(row, "system_prompt_id", table),
                status(row, table),
                timestamp(row, "created_at", table),
                timestamp(row, "updated_at", table),
                metadata(row, table)
        );
    }

    /**
     * @throws PayloadDecodeException if the row is missing or malformed
     */
    public TurnChangeEvent decodeTurn(ChangePayload payload) {
        Map<String, Object> row = requireRow(payload, WatchedTable.CONVERSATION_TURNS);
        String table = WatchedTable.CONVERSATION_TURNS.tableName();
        return new TurnChangeEvent(
                requiredString(row, "id", table),
                requiredString(row, "conversation_id", table),
                role(row, table),
                optionalString(row, "content", table),
                optionalString(row, "audio_url", table),
                timestamp(row, "created_at", table),
                timestamp(row, "updated_at", table),
                metadata(row, table)
        );
    }

    private static Map<String, Object> requireRow(ChangePayload payload, WatchedTable expected) {
        if (payload == null) {
            throw new PayloadDecodeException("Payload is null", expected.tableName(), "new");
        }
        if (payload.table() != expected) {
            throw new PayloadDecodeException("Payload is for table " + payload.table(),
                    expected.tableName(), "table");
        }
        if (payload.newRow().isEmpty()) {
            throw new PayloadDecodeException("Payload has no post-change row", expected.tableName(), "new");
        }
        return payload.newRow();
    }

    private static String requiredString(Map<String, Object> row, String field, String table) {
        String value = optionalString(row, field, table);
        if (value == null || value.isBlank()) {
            throw new PayloadDecodeException("Missing required field", table, field);
        }
        return value;
    }

    private static String optionalString(Map<String, Object> row, String field, String table) {
        Object value = row.get(field);
        if (value == null) {
            return null;
        }
        if (value instanceof Map || value instanceof Iterable) {
            throw new PayloadDecodeException("Expected a scalar value", table, field);
        }
        return String.valueOf(value);
    }

    private static OffsetDateTime timestamp(Map<String, Object> row, String field, String table) {
        String raw = requiredString(row, field, table);
        try {
            return TimeUtils.parseTimestamp(raw);
        } catch (DateTimeParseException e) {
            throw new PayloadDecodeException("Invalid ISO-8601 timestamp '" + raw + "'", table, field, e);
        }
    }

    private static ConversationRole role(Map<String, Object> row, String table) {
        String raw = requiredString(row, "role", table);
        try {
            return ConversationRole.fromWire(raw);
        } catch (IllegalArgumentException e) {
            throw new PayloadDecodeException("Unknown role '" + raw + "'", table, "role", e);
        }
    }

    private static ConversationStatus status(Map<String, Object> row, String table) {
        String raw = optionalString(row, "status", table);
        if (raw == null) {
            return ConversationStatus.ACTIVE;
        }
        try {
            return ConversationStatus.fromWire(raw);
        } catch (IllegalArgumentException e) {
            throw new PayloadDecodeException("Unknown status '" + raw + "'", table, "status", e);
        }
    }

    private static Map<String, Object> metadata(Map<String, Object> row, String table) {
        Object raw = row.get("metadata");
        if (raw == null) {
            return Map.of();
        }
        if (!(raw instanceof Map<?, ?> map)) {
            throw new PayloadDecodeException("Metadata must be a JSON object", table, "metadata");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return copy;
    }
}
