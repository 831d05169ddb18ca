package com.phillippitts.voicechat.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DomainEnumsTest {

    @Test
    void shouldResolveRolesFromWire() {
        assertThat(ConversationRole.fromWire("user")).isEqualTo(ConversationRole.USER);
        assertThat(ConversationRole.fromWire("assistant")).isEqualTo(ConversationRole.ASSISTANT);
        assertThat(ConversationRole.fromWire("system")).isEqualTo(ConversationRole.SYSTEM);
        assertThat(ConversationRole.USER.wireValue()).isEqualTo("user");
    }

    @Test
    void shouldRejectUnknownRole() {
        assertThatThrownBy(() -> ConversationRole.fromWire("moderator"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldResolveStatusFromWire() {
        assertThat(ConversationStatus.fromWire("archived")).isEqualTo(ConversationStatus.ARCHIVED);
        assertThat(ConversationStatus.ACTIVE.wireValue()).isEqualTo("active");
    }

    @Test
    void shouldResolveTablesByWireName() {
        assertThat(WatchedTable.fromTableName("conversation_turns")).isEqualTo(WatchedTable.CONVERSATION_TURNS);
        assertThat(WatchedTable.CONVERSATIONS.toString()).isEqualTo("conversations");
        assertThatThrownBy(() -> WatchedTable.fromTableName("messages"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldResolveKindCaseInsensitively() {
        assertThat(ChangeEventKind.fromWire("insert")).isEqualTo(ChangeEventKind.INSERT);
        assertThat(ChangeEventKind.fromWire("DELETE")).isEqualTo(ChangeEventKind.DELETE);
        assertThatThrownBy(() -> ChangeEventKind.fromWire("upsert"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
