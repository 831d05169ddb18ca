package com.phillippitts.voicechat.service.realtime.transport;

import com.phillippitts.voicechat.domain.ChangeEventKind;
import com.phillippitts.voicechat.domain.WatchedTable;
import com.phillippitts.voicechat.exception.PayloadDecodeException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChangePayloadTest {

    @Test
    void shouldParseFullEnvelope() {
        String json = """
                {"table": "conversations", "eventType": "UPDATE", "schema": "public",
                 "commit_timestamp": "2024-01-01T00:00:01Z",
                 "new": {"id": "c1", "title": "Renamed"},
                 "old": {"id": "c1"}}
                """;

        ChangePayload payload = ChangePayload.fromJson(json);

        assertThat(payload.table()).isEqualTo(WatchedTable.CONVERSATIONS);
        assertThat(payload.kind()).isEqualTo(ChangeEventKind.UPDATE);
        assertThat(payload.schema()).isEqualTo("public");
        assertThat(payload.newRow()).containsEntry("title", "Renamed");
        assertThat(payload.oldRow()).containsEntry("id", "c1");
        assertThat(payload.commitTimestamp()).isEqualTo("2024-01-01T00:00:01Z");
    }

    @Test
    void shouldFallBackToDefaultsWhenEnvelopeIsBare() {
        String json = "{\"new\": {\"id\": \"t1\", \"metadata\": null}}";

        ChangePayload payload = ChangePayload.fromJson(json, WatchedTable.CONVERSATION_TURNS, ChangeEventKind.INSERT);

        assertThat(payload.table()).isEqualTo(WatchedTable.CONVERSATION_TURNS);
        assertThat(payload.kind()).isEqualTo(ChangeEventKind.INSERT);
        assertThat(payload.schema()).isEqualTo("public");
        assertThat(payload.oldRow()).isEmpty();
        assertThat(payload.newRow()).containsKey("metadata");
        assertThat(payload.newRow().get("metadata")).isNull();
    }

    @Test
    void shouldRejectMalformedJson() {
        assertThatThrownBy(() -> ChangePayload.fromJson("{not json", WatchedTable.CONVERSATIONS, ChangeEventKind.UPDATE))
                .isInstanceOf(PayloadDecodeException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    void shouldRejectEnvelopeWithoutTable() {
        assertThatThrownBy(() -> ChangePayload.fromJson("{\"eventType\": \"INSERT\", \"new\": {}}"))
                .isInstanceOf(PayloadDecodeException.class)
                .extracting("field").isEqualTo("table");
    }

    @Test
    void shouldRejectUnknownEventType() {
        assertThatThrownBy(() -> ChangePayload.fromJson("{\"table\": \"users\", \"eventType\": \"MERGE\"}"))
                .isInstanceOf(PayloadDecodeException.class)
                .extracting("field").isEqualTo("eventType");
    }

    @Test
    void shouldRejectNonObjectRow() {
        assertThatThrownBy(() -> ChangePayload.fromJson("{\"new\": [1, 2]}", WatchedTable.USERS, ChangeEventKind.INSERT))
                .isInstanceOf(PayloadDecodeException.class)
                .extracting("field").isEqualTo("new");
    }

    @Test
    void shouldCopyRowsDefensively() {
        java.util.Map<String, Object> row = new java.util.HashMap<>(Map.of("id", "c1"));
        ChangePayload payload = ChangePayload.of(WatchedTable.CONVERSATIONS, ChangeEventKind.INSERT, row);

        row.put("id", "changed");

        assertThat(payload.newRow()).containsEntry("id", "c1");
    }
}
