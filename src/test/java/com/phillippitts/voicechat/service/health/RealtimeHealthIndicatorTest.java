package com.phillippitts.voicechat.service.health;

import com.phillippitts.voicechat.service.realtime.ConversationNotificationService;
import com.phillippitts.voicechat.service.realtime.RealtimeStatus;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RealtimeHealthIndicatorTest {

    @Test
    void shouldReportUpWhileRunning() {
        ConversationNotificationService service = mock(ConversationNotificationService.class);
        when(service.snapshot()).thenReturn(new RealtimeStatus(true, List.of("c1"), List.of(),
                Map.of("user:u1", List.of("conversations:UPDATE:user_id=eq.u1")),
                List.of("conversations:UPDATE:user_id=eq.u1"), 2));

        Health health = new RealtimeHealthIndicator(service).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("openChannels", 2);
        assertThat(health.getDetails()).containsEntry("watchedConversations", 1);
        assertThat(health.getDetails()).containsEntry("groups", 1);
    }

    @Test
    void shouldReportOutOfServiceAfterShutdown() {
        ConversationNotificationService service = mock(ConversationNotificationService.class);
        when(service.snapshot()).thenReturn(new RealtimeStatus(false, List.of(), List.of(), Map.of(), List.of(), 0));

        Health health = new RealtimeHealthIndicator(service).health();

        assertThat(health.getStatus()).isEqualTo(Status.OUT_OF_SERVICE);
        assertThat(health.getDetails()).containsEntry("openChannels", 0);
    }
}
