/**
 * Immutable domain model for conversation change notifications.
 *
 * <p>Closed enumerations ({@link com.phillippitts.voicechat.domain.ChangeEventKind},
 * {@link com.phillippitts.voicechat.domain.WatchedTable},
 * {@link com.phillippitts.voicechat.domain.ConversationRole},
 * {@link com.phillippitts.voicechat.domain.ConversationStatus}) describe the wire vocabulary;
 * records describe decoded rows and filters. Nothing here depends on Spring or the transport.
 *
 * @since 1.0
 */
package com.phillippitts.voicechat.domain;
