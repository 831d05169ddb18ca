package com.phillippitts.voicechat.presentation.controller;

import com.phillippitts.voicechat.service.realtime.ConversationNotificationService;
import com.phillippitts.voicechat.service.realtime.RealtimeStatus;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RealtimeStatusControllerTest {

    @Test
    void shouldReturnServiceSnapshot() {
        ConversationNotificationService service = mock(ConversationNotificationService.class);
        RealtimeStatus status = new RealtimeStatus(true, List.of("c1"), List.of("c1"), Map.of(), List.of(), 2);
        when(service.snapshot()).thenReturn(status);

        ResponseEntity<RealtimeStatus> response = new RealtimeStatusController(service).status();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isEqualTo(status);
    }
}
