/**
 * Capture session contract and the Java Sound implementation.
 *
 * <p>A {@link com.phillippitts.sessionrecorder.service.capture.CaptureSession} owns one recording
 * from device open to WAV payload. Sessions never touch recorder state; they report back through
 * a {@link com.phillippitts.sessionrecorder.service.capture.CaptureSessionListener}.
 */
package com.phillippitts.sessionrecorder.service.capture;
