package com.phillippitts.sessionrecorder.service.recorder;

/**
 * Handle returned by {@link RecorderService#onToggle(RecordingStateListener)}.
 * Removing it affects only this subscription, even if the same listener was registered twice.
 */
@FunctionalInterface
public interface ListenerRegistration {

    /** Unsubscribes. Idempotent; safe to call from inside a notification. */
    void remove();
}
