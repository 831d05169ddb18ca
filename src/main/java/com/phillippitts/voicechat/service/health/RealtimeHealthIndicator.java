package com.phillippitts.voicechat.service.health;

import com.phillippitts.voicechat.service.realtime.ConversationNotificationService;
import com.phillippitts.voicechat.service.realtime.RealtimeStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the realtime notification layer.
 *
 * <ul>
 *   <li>UP: service accepting watches</li>
 *   <li>OUT_OF_SERVICE: service has been shut down</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class RealtimeHealthIndicator implements HealthIndicator {

    private final ConversationNotificationService notifications;

    public RealtimeHealthIndicator(ConversationNotificationService notifications) {
        this.notifications = notifications;
    }

    @Override
    public Health health() {
        RealtimeStatus status = notifications.snapshot();
        Health.Builder builder = status.running() ? Health.up() : Health.outOfService();
        return builder
                .withDetail("openChannels", status.openChannels())
                .withDetail("watchedConversations", status.watchedConversations().size())
                .withDetail("watchedTurnStreams", status.watchedTurnStreams().size())
                .withDetail("groups", status.groups().size())
                .withDetail("registrySubscriptions", status.registrySubscriptions().size())
                .build();
    }
}
