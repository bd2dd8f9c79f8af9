package com.phillippitts.sessionrecorder.service.presentation;

/**
 * Point-in-time copy of what the surface currently shows.
 *
 * @param visible whether the surface is open
 * @param recording recording indicator
 * @param status last status message, may be {@code null}
 * @param timerRunning whether the elapsed-time display is running
 * @param elapsedMs elapsed time shown by the timer (0 when never started)
 * @param streamDevice device name of the attached stream, or {@code null}
 * @param level current level of the attached stream, 0 when none is attached
 */
public record PresentationView(
        boolean visible,
        boolean recording,
        String status,
        boolean timerRunning,
        long elapsedMs,
        String streamDevice,
        double level
) {
}
