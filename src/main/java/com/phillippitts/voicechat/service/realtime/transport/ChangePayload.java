package com.phillippitts.voicechat.service.realtime.transport;

import com.phillippitts.voicechat.domain.ChangeEventKind;
import com.phillippitts.voicechat.domain.WatchedTable;
import com.phillippitts.voicechat.exception.PayloadDecodeException;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Raw change event delivered by the transport.
 *
 * <p>Wire shape: {@code {"new": {<row>}}}. The transport envelope may add {@code old},
 * {@code eventType}, {@code table}, {@code schema} and {@code commit_timestamp}; all of them
 * are optional here.
 *
 * @param table           table the change happened on
 * @param kind            change kind
 * @param schema          database schema, {@code public} unless the envelope says otherwise
 * @param newRow          post-change row, empty for deletes
 * @param oldRow          pre-change row (primary key only unless replica identity is full)
 * @param commitTimestamp commit time as sent by the transport, null when absent
 */
public record ChangePayload(
        WatchedTable table,
        ChangeEventKind kind,
        String schema,
        Map<String, Object> newRow,
        Map<String, Object> oldRow,
        String commitTimestamp
) {

    private static final String DEFAULT_SCHEMA = "public";

    public ChangePayload {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(kind, "kind");
        schema = schema == null ? DEFAULT_SCHEMA : schema;
        newRow = newRow == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(newRow));
        oldRow = oldRow == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(oldRow));
    }

    /**
     * Creates a payload carrying only a post-change row.
     */
    public static ChangePayload of(WatchedTable table, ChangeEventKind kind, Map<String, Object> newRow) {
        return new ChangePayload(table, kind, DEFAULT_SCHEMA, newRow, Map.of(), null);
    }

    /**
     * Parses a payload whose envelope names its table and event type.
     *
     * @throws PayloadDecodeException if the JSON is malformed or the envelope is incomplete
     */
    public static ChangePayload fromJson(String json) {
        return fromJson(json, null, null);
    }

    /**
     * Parses a payload, using the envelope's table and event type when present and the given
     * defaults otherwise.
     *
     * @param json         payload JSON
     * @param defaultTable table to assume when the envelope has none (nullable)
     * @param defaultKind  kind to assume when the envelope has none (nullable)
     * @throws PayloadDecodeException if the JSON is malformed or table/kind cannot be resolved
     */
    public static ChangePayload fromJson(String json, WatchedTable defaultTable, ChangeEventKind defaultKind) {
        String tableLabel = defaultTable == null ? "unknown" : defaultTable.tableName();
        if (json == null || json.isBlank()) {
            throw new PayloadDecodeException("Empty payload", tableLabel, "new");
        }
        JSONObject root;
        try {
            root = new JSONObject(json);
        } catch (JSONException e) {
            throw new PayloadDecodeException("Malformed payload JSON", tableLabel, "new", e);
        }

        WatchedTable table = defaultTable;
        if (root.has("table")) {
            try {
                table = WatchedTable.fromTableName(root.getString("table"));
            } catch (RuntimeException e) {
                throw new PayloadDecodeException("Unknown table in payload", tableLabel, "table", e);
            }
        }
        if (table == null) {
            throw new PayloadDecodeException("Payload does not name its table", tableLabel, "table");
        }

        ChangeEventKind kind = defaultKind;
        if (root.has("eventType")) {
            try {
                kind = ChangeEventKind.fromWire(root.getString("eventType"));
            } catch (RuntimeException e) {
                throw new PayloadDecodeException("Unknown event type in payload", table.tableName(), "eventType", e);
            }
        }
        if (kind == null) {
            throw new PayloadDecodeException("Payload does not name its event type", table.tableName(), "eventType");
        }

        return new ChangePayload(
                table,
                kind,
                root.optString("schema", DEFAULT_SCHEMA),
                rowOf(root, "new", table),
                rowOf(root, "old", table),
                root.has("commit_timestamp") && !root.isNull("commit_timestamp")
                        ? root.getString("commit_timestamp") : null
        );
    }

    private static Map<String, Object> rowOf(JSONObject root, String key, WatchedTable table) {
        if (!root.has(key) || root.isNull(key)) {
            return Map.of();
        }
        JSONObject row = root.optJSONObject(key);
        if (row == null) {
            throw new PayloadDecodeException("Row must be a JSON object", table.tableName(), key);
        }
        return row.toMap();
    }
}
