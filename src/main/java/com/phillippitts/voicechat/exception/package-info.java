/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.voicechat.exception.VoiceChatException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.voicechat.exception.TransportException} - Thrown when a
 *       channel fails to open, activate or deactivate; surfaces to the subscribing caller</li>
 *   <li>{@link com.phillippitts.voicechat.exception.PayloadDecodeException} - Thrown while
 *       decoding a change payload; contained by the dispatch path, which drops the event</li>
 * </ul>
 *
 * <p>Callback failures and unknown subscription identifiers are not modelled as
 * exceptions: both are logged at the point they occur and never reach callers.
 *
 * @see com.phillippitts.voicechat.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.voicechat.exception;
