package com.phillippitts.sessionrecorder.util;

import java.time.Duration;

/**
 * Standard timeout values for capture threads and transcription subprocesses.
 *
 * <p><b>Usage:</b> Used by {@link com.phillippitts.sessionrecorder.service.capture.JavaSoundCaptureSession}
 * and {@link com.phillippitts.sessionrecorder.service.transcription.ProcessTranscriptionCoordinator}.
 *
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Timeout for stream gobbler threads to flush buffered output after process completion.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for graceful process shutdown via {@link Process#destroy()}.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for forceful process termination via {@link Process#destroyForcibly()}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * How long {@code dispose()} waits for a capture thread to release the input line.
     * The thread is a daemon, so a line stuck in a blocking read does not hold up JVM exit.
     */
    public static final Duration CAPTURE_THREAD_DISPOSE_TIMEOUT = Duration.ofMillis(500);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
