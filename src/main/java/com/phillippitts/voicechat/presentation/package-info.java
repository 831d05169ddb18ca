/**
 * Presentation layer (REST controllers and exception handling).
 *
 * <p>Presentation depends on the service layer but not vice versa. Controllers are thin
 * adapters over {@link com.phillippitts.voicechat.service.realtime.ConversationNotificationService};
 * exception handlers map realtime exceptions to HTTP status codes.
 *
 * @see com.phillippitts.voicechat.presentation.controller
 * @see com.phillippitts.voicechat.presentation.exception
 */
package com.phillippitts.voicechat.presentation;
