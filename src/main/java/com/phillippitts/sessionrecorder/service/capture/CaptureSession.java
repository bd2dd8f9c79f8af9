package com.phillippitts.sessionrecorder.service.capture;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * One in-progress recording.
 *
 * <p>A session is single-use: it is started once, stopped at most once, and reports its
 * {@link com.phillippitts.sessionrecorder.domain.RecordingResult} exactly once through the
 * {@link CaptureSessionListener} it was created with. Implementations may also end capture on
 * their own (device lost, maximum duration); that is reported as a normal completion with a
 * distinguishing stop reason.
 */
public interface CaptureSession {

    /**
     * Begins capture asynchronously.
     *
     * @return future completing once audio is actively being captured, or exceptionally with a
     *         {@link com.phillippitts.sessionrecorder.exception.CaptureStartException}
     */
    CompletableFuture<Void> start();

    /**
     * Requests capture to end. Fire-and-forget; the completion arrives through
     * {@link CaptureSessionListener#onComplete}. Must only be called after {@link #start()} resolved.
     */
    void stop();

    /**
     * Releases the device. Any completion not yet delivered is suppressed. Idempotent.
     */
    void dispose();

    /** True while audio is being captured. */
    boolean isActive();

    /** Live stream handle for level meters; empty before start and after completion. */
    Optional<MediaStream> getMediaStream();

    /** Path the recording will be persisted to; {@code null} until start has picked one. */
    String getOutputPath();
}
