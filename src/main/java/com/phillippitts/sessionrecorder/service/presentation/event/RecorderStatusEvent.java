package com.phillippitts.sessionrecorder.service.presentation.event;

import java.time.Instant;
import java.util.Objects;

/**
 * Published whenever the presentation surface shows a new status message.
 *
 * @param message status text shown to the user
 * @param recording recording indicator at the time of the change
 * @param at when the status was shown
 */
public record RecorderStatusEvent(String message, boolean recording, Instant at) {
    public RecorderStatusEvent {
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(at, "at must not be null");
    }
}
