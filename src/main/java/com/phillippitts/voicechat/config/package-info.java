/**
 * Application-wide configuration beans and properties.
 *
 * <ul>
 *   <li>{@link com.phillippitts.voicechat.config.ThreadPoolConfig} - dispatch executor shared by
 *       all channel lanes</li>
 *   <li>{@link com.phillippitts.voicechat.config.ThreadPoolMetricsConfig} - executor gauges and
 *       periodic health logging</li>
 *   <li>{@link com.phillippitts.voicechat.config.RealtimeConfig} - transport selection</li>
 * </ul>
 *
 * <p>Externalized settings live in {@code application.properties}.
 */
package com.phillippitts.voicechat.config;
