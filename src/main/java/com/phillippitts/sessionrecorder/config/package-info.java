/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.sessionrecorder.config.ThreadPoolConfig} - recorder loop,
 *       transcription pool and presentation scheduler</li>
 *   <li>{@link com.phillippitts.sessionrecorder.config.recorder.RecorderConfig} - initializes the
 *       process-wide recorder</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed, validated {@code @ConfigurationProperties}</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 */
package com.phillippitts.sessionrecorder.config;
