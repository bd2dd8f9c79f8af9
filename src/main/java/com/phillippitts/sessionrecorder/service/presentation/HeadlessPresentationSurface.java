package com.phillippitts.sessionrecorder.service.presentation;

import com.phillippitts.sessionrecorder.service.capture.MediaStream;
import com.phillippitts.sessionrecorder.service.presentation.event.RecorderStatusEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;

/**
 * Presentation surface without a window: state is kept in memory, status changes are logged and
 * published as {@link RecorderStatusEvent}s, and the REST layer reads it through {@link #view()}.
 *
 * <p>Delayed closes run on the presentation {@link TaskScheduler}. Opening the surface again
 * cancels a pending close so a lingering message from the previous session cannot hide the next one.
 */
@Component
public class HeadlessPresentationSurface implements PresentationSurface {

    private static final Logger LOG = LogManager.getLogger(HeadlessPresentationSurface.class);

    private final TaskScheduler scheduler;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private final Object lock = new Object();
    private boolean visible;
    private boolean recording;
    private String status;
    private Runnable stopCallback;
    private Instant timerStartedAt;
    private long frozenElapsedMs;
    private MediaStream stream;
    private ScheduledFuture<?> pendingClose;
    private long closeGeneration;

    @Autowired
    public HeadlessPresentationSurface(@Qualifier("presentationScheduler") TaskScheduler scheduler,
                                       ApplicationEventPublisher publisher) {
        this(scheduler, publisher, Clock.systemUTC());
    }

    HeadlessPresentationSurface(TaskScheduler scheduler, ApplicationEventPublisher publisher, Clock clock) {
        this.scheduler = Objects.requireNonNull(scheduler);
        this.publisher = Objects.requireNonNull(publisher);
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public void open(Runnable stopCallback) {
        synchronized (lock) {
            cancelPendingClose();
            this.stopCallback = stopCallback;
            this.visible = true;
            this.frozenElapsedMs = 0;
            this.timerStartedAt = null;
        }
        LOG.debug("Surface opened");
    }

    @Override
    public void close() {
        synchronized (lock) {
            cancelPendingClose();
            visible = false;
            stopCallback = null;
        }
        LOG.debug("Surface closed");
    }

    @Override
    public void setStatus(String message) {
        boolean rec;
        synchronized (lock) {
            status = message;
            rec = recording;
        }
        LOG.info("Status: {}", message);
        if (message != null) {
            publisher.publishEvent(new RecorderStatusEvent(message, rec, clock.instant()));
        }
    }

    @Override
    public void setRecordingState(boolean recording) {
        synchronized (lock) {
            this.recording = recording;
        }
    }

    @Override
    public void startTimer() {
        synchronized (lock) {
            timerStartedAt = clock.instant();
            frozenElapsedMs = 0;
        }
    }

    @Override
    public void stopTimer() {
        synchronized (lock) {
            if (timerStartedAt != null) {
                frozenElapsedMs = Duration.between(timerStartedAt, clock.instant()).toMillis();
                timerStartedAt = null;
            }
        }
    }

    @Override
    public void attachStream(MediaStream stream) {
        synchronized (lock) {
            this.stream = stream;
        }
    }

    @Override
    public void detachStream() {
        synchronized (lock) {
            this.stream = null;
        }
    }

    @Override
    public void linger(String message, long durationMs) {
        setStatus(message);
        closeAfter(durationMs);
    }

    @Override
    public void closeAfter(long durationMs) {
        synchronized (lock) {
            cancelPendingClose();
            long delay = Math.max(0, durationMs);
            long generation = closeGeneration;
            pendingClose = scheduler.schedule(() -> closeIfStillPending(generation),
                    clock.instant().plusMillis(delay));
        }
    }

    @Override
    public boolean isVisible() {
        synchronized (lock) {
            return visible;
        }
    }

    /**
     * Triggers the stop action registered by the last {@link #open(Runnable)}.
     *
     * @return false when the surface is closed or no stop action is registered
     */
    public boolean requestStop() {
        Runnable callback;
        synchronized (lock) {
            callback = visible ? stopCallback : null;
        }
        if (callback == null) {
            LOG.debug("Stop requested but surface has no active stop action");
            return false;
        }
        callback.run();
        return true;
    }

    /** Snapshot of what the surface currently shows. */
    public PresentationView view() {
        synchronized (lock) {
            long elapsed = timerStartedAt != null
                    ? Duration.between(timerStartedAt, clock.instant()).toMillis()
                    : frozenElapsedMs;
            return new PresentationView(
                    visible,
                    recording,
                    status,
                    timerStartedAt != null,
                    elapsed,
                    stream != null ? stream.deviceName() : null,
                    stream != null ? stream.level() : 0.0);
        }
    }

    private void closeIfStillPending(long generation) {
        synchronized (lock) {
            // Superseded by open() or a newer closeAfter()
            if (generation != closeGeneration) {
                return;
            }
            pendingClose = null;
            visible = false;
            stopCallback = null;
        }
        LOG.debug("Surface closed after delay");
    }

    private void cancelPendingClose() {
        closeGeneration++;
        if (pendingClose != null) {
            pendingClose.cancel(false);
            pendingClose = null;
        }
    }
}
