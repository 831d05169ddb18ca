package com.phillippitts.voicechat.presentation.controller;

import com.phillippitts.voicechat.service.realtime.ConversationNotificationService;
import com.phillippitts.voicechat.service.realtime.RealtimeStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of the open watches, groups and channels.
 */
@RestController
class RealtimeStatusController {

    private static final Logger log = LogManager.getLogger(RealtimeStatusController.class);

    private final ConversationNotificationService notifications;

    RealtimeStatusController(ConversationNotificationService notifications) {
        this.notifications = notifications;
    }

    @GetMapping("/realtime/status")
    ResponseEntity<RealtimeStatus> status() {
        RealtimeStatus status = notifications.snapshot();
        log.debug("Realtime status requested: running={}, openChannels={}", status.running(), status.openChannels());
        return ResponseEntity.ok(status);
    }
}
