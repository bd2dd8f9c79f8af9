package com.phillippitts.sessionrecorder.testutil;

import com.phillippitts.sessionrecorder.domain.RecordingResult;
import com.phillippitts.sessionrecorder.domain.StopReason;
import com.phillippitts.sessionrecorder.service.capture.CaptureRequest;
import com.phillippitts.sessionrecorder.service.capture.CaptureSession;
import com.phillippitts.sessionrecorder.service.capture.CaptureSessionListener;
import com.phillippitts.sessionrecorder.service.capture.MediaStream;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Scriptable capture session.
 *
 * <p>The start future is held until {@link #resolveStart()} (or resolved immediately when the
 * factory is configured to). Completion is delivered by {@link #complete(StopReason)}, or
 * automatically on {@link #stop()} when {@code completeOnStop} is set.
 *
 * <p><b>Public fields:</b> call counters are exposed so tests can assert the stop-at-most-once rule.
 */
public class FakeCaptureSession implements CaptureSession {

    public final CaptureRequest request;
    public final CaptureSessionListener listener;
    public final String outputPath;
    public final CompletableFuture<Void> startFuture = new CompletableFuture<>();

    public int startCalls;
    public int stopCalls;
    public int disposeCalls;
    public boolean startResolvedWhenStopCalled = true;
    public RuntimeException stopFailure;

    private final boolean completeOnStop;
    private boolean active;
    private boolean disposed;
    private boolean completed;

    FakeCaptureSession(CaptureRequest request, CaptureSessionListener listener, String outputPath,
                       boolean completeOnStop) {
        this.request = request;
        this.listener = listener;
        this.outputPath = outputPath;
        this.completeOnStop = completeOnStop;
    }

    @Override
    public CompletableFuture<Void> start() {
        startCalls++;
        return startFuture;
    }

    /** Capture becomes active and the start future completes. */
    public void resolveStart() {
        active = true;
        startFuture.complete(null);
    }

    public void failStart(Throwable error) {
        startFuture.completeExceptionally(error);
    }

    @Override
    public void stop() {
        stopCalls++;
        if (!startFuture.isDone() || startFuture.isCompletedExceptionally()) {
            startResolvedWhenStopCalled = false;
        }
        if (stopFailure != null) {
            throw stopFailure;
        }
        if (completeOnStop) {
            complete(StopReason.MANUAL);
        }
    }

    /** Emits the single completion with a small WAV-sized payload. */
    public void complete(StopReason reason) {
        if (disposed || completed) {
            return;
        }
        completed = true;
        active = false;
        listener.onComplete(new RecordingResult(outputPath, payload(), Instant.now(), 1000, reason));
    }

    @Override
    public void dispose() {
        disposeCalls++;
        disposed = true;
        active = false;
    }

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public Optional<MediaStream> getMediaStream() {
        if (!active) {
            return Optional.empty();
        }
        return Optional.of(new MediaStream() {
            @Override
            public String deviceName() {
                return "fake-mic";
            }

            @Override
            public double level() {
                return 0.5;
            }
        });
    }

    @Override
    public String getOutputPath() {
        return outputPath;
    }

    public boolean isDisposed() {
        return disposed;
    }

    public static byte[] payload() {
        return new byte[] {'R', 'I', 'F', 'F', 1, 2, 3, 4};
    }
}
