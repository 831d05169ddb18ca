package com.phillippitts.voicechat.service.realtime;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of the notification layer, served by the status endpoint.
 *
 * @param running                 false once the service has been shut down
 * @param watchedConversations    conversation ids with a direct update channel
 * @param watchedTurnStreams      conversation ids with a direct turns channel
 * @param groups                  group id to registry subscription ids
 * @param registrySubscriptions   live registry subscription ids
 * @param openChannels            direct channels plus shared table channels
 */
public record RealtimeStatus(
        boolean running,
        List<String> watchedConversations,
        List<String> watchedTurnStreams,
        Map<String, List<String>> groups,
        List<String> registrySubscriptions,
        int openChannels
) {
}
