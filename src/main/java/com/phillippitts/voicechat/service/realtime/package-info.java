/**
 * Change-notification subscriptions for conversations and their turns.
 *
 * <p>{@link com.phillippitts.voicechat.service.realtime.SubscriptionRegistry} is the generic
 * table-level layer with deduplicated subscription ids;
 * {@link com.phillippitts.voicechat.service.realtime.ConversationNotificationService} adds
 * per-entity watches with decoded events and group-level bulk teardown. Both hand events to
 * {@link com.phillippitts.voicechat.service.realtime.ChannelDispatcher}, which keeps delivery
 * ordered within a channel.
 */
package com.phillippitts.voicechat.service.realtime;
