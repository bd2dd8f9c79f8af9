package com.phillippitts.sessionrecorder.service.presentation;

import com.phillippitts.sessionrecorder.service.capture.MediaStream;

/**
 * Renders recording state to the user and forwards the single user stop action back to the recorder.
 *
 * <p>The recorder calls these from its own loop thread; implementations must not call back into
 * the recorder synchronously except through the stop callback passed to {@link #open(Runnable)}.
 */
public interface PresentationSurface {

    /**
     * Shows the surface. A pending {@link #closeAfter(long)} or {@link #linger(String, long)} is cancelled.
     *
     * @param stopCallback invoked when the user asks to stop recording
     */
    void open(Runnable stopCallback);

    void close();

    void setStatus(String message);

    void setRecordingState(boolean recording);

    void startTimer();

    void stopTimer();

    void attachStream(MediaStream stream);

    void detachStream();

    /** Shows {@code message}, then closes the surface after {@code durationMs}. */
    void linger(String message, long durationMs);

    /** Closes the surface after {@code durationMs}. */
    void closeAfter(long durationMs);

    boolean isVisible();
}
