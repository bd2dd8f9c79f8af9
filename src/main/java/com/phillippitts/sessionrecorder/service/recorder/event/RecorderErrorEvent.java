package com.phillippitts.sessionrecorder.service.recorder.event;

import java.time.Instant;

/**
 * Published when the recorder recovers from a failure by resetting to idle.
 *
 * @param stage where the failure surfaced (start, stop, persist, capture)
 * @param message user-facing message shown for the failure
 * @param timestamp when the failure was handled
 */
public record RecorderErrorEvent(String stage, String message, Instant timestamp) {}
