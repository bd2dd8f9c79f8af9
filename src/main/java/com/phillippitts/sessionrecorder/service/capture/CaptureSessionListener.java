package com.phillippitts.sessionrecorder.service.capture;

import com.phillippitts.sessionrecorder.domain.RecordingResult;

/**
 * Callbacks from a {@link CaptureSession} to its owner. Invoked on the session's own thread;
 * the owner is responsible for moving work onto its own execution context.
 */
public interface CaptureSessionListener {

    /** Short human-readable progress message. */
    default void onStatus(String message) {
    }

    /** A failure that happened after start resolved (a start failure completes the start future instead). */
    default void onError(Throwable error) {
    }

    /** The live stream became available or changed. */
    default void onStreamChanged(MediaStream stream) {
    }

    /** Capture finished; called exactly once per session unless the session was disposed first. */
    void onComplete(RecordingResult result);
}
