package com.phillippitts.sessionrecorder.service.recorder.event;

import com.phillippitts.sessionrecorder.domain.LifecycleState;

import java.time.Instant;

/**
 * Emitted on every recording-state fan-out, alongside the registered listeners.
 *
 * @param recording whether the recorder is actively recording
 * @param state lifecycle state at the time of the change
 * @param timestamp when the change was fanned out
 */
public record RecordingStateChangedEvent(
        boolean recording,
        LifecycleState state,
        Instant timestamp
) {}
