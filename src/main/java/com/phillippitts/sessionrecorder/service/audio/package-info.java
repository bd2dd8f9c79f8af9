/**
 * Recording format constants and WAV encoding.
 *
 * <p>Only one format is supported (16 kHz, 16-bit, mono PCM in a WAV container). Format selection
 * is intentionally absent.
 *
 * @since 1.0
 */
package com.phillippitts.sessionrecorder.service.audio;
