package com.phillippitts.sessionrecorder.service.recorder;

import com.phillippitts.sessionrecorder.config.properties.RecorderProperties;
import com.phillippitts.sessionrecorder.domain.LifecycleState;
import com.phillippitts.sessionrecorder.domain.RecordingResult;
import com.phillippitts.sessionrecorder.domain.StopReason;
import com.phillippitts.sessionrecorder.exception.OfflineRecordingNotFoundException;
import com.phillippitts.sessionrecorder.service.capture.CaptureRequest;
import com.phillippitts.sessionrecorder.service.capture.CaptureSession;
import com.phillippitts.sessionrecorder.service.capture.CaptureSessionFactory;
import com.phillippitts.sessionrecorder.service.capture.CaptureSessionListener;
import com.phillippitts.sessionrecorder.service.capture.MediaStream;
import com.phillippitts.sessionrecorder.service.presentation.PresentationSurface;
import com.phillippitts.sessionrecorder.service.recorder.event.RecorderErrorEvent;
import com.phillippitts.sessionrecorder.service.recorder.event.RecordingCompletedEvent;
import com.phillippitts.sessionrecorder.service.recorder.event.RecordingStateChangedEvent;
import com.phillippitts.sessionrecorder.service.storage.DurableStore;
import com.phillippitts.sessionrecorder.service.transcription.TranscriptionCoordinator;
import com.phillippitts.sessionrecorder.service.transcription.TranscriptionOptions;
import com.phillippitts.sessionrecorder.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Process-wide recorder: owns the recording lifecycle, serializes toggle requests, hands finished
 * recordings to persistence and transcription, and fans state changes out to listeners.
 *
 * <p><b>Threading:</b> every state mutation runs on the loop executor from
 * {@link RecorderDependencies#loopExecutor()}, which executes one task at a time. Callbacks from
 * capture sessions and the presentation surface are re-submitted to it. Waiting is never done by
 * blocking the loop; toggle futures are chained on the session start and lifecycle futures instead.
 *
 * <p><b>Lifecycle:</b>
 * <pre>
 * IDLE --toggle--> STARTING --start resolves--> RECORDING --toggle--> STOPPING --completion--> IDLE
 *                     |                                                   ^
 *                     +--stop action before start resolves (intent)-------+
 * </pre>
 * Any completion or error returns the recorder to IDLE.
 *
 * @see SessionLifecycleGate
 * @see RecorderStateMachine
 */
public final class RecorderService {

    private static final Logger LOG = LogManager.getLogger(RecorderService.class);

    static final String SESSION_CONTEXT_KEY = "recordingSession";

    static final String STATUS_PREPARING = "Preparing recorder...";
    static final String STATUS_STOPPING = "Stopping recording...";
    static final String STATUS_TRANSCRIBING = "Saved. Transcribing...";
    static final String MESSAGE_READY = "Transcription ready.";
    static final String MESSAGE_READY_POST_PROCESSED = "Transcription ready. Post-processing complete.";
    static final String MESSAGE_TRANSCRIPTION_FAILED = "Transcription failed";

    static final long SAVED_LINGER_MS = 2400;
    static final long BACKGROUND_LINGER_MS = 4200;
    static final long BACKUP_ERROR_LINGER_MS = 3200;
    static final long ERROR_LINGER_MS = 2600;
    static final long TRANSCRIPTION_FAILED_LINGER_MS = 3200;
    static final long CALLBACK_FAILED_LINGER_MS = 3000;
    static final long TRANSCRIPTION_READY_LINGER_MS = 2600;
    static final long CALLBACK_CLOSE_DELAY_MS = 800;

    private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);

    private static RecorderService instance;

    private final CaptureSessionFactory sessionFactory;
    private final PresentationSurface ui;
    private final TranscriptionCoordinator transcriptionCoordinator;
    private final DurableStore durableStore;
    private final RecorderProperties props;
    private final ApplicationEventPublisher publisher;
    private final RecorderMetricsPublisher metrics;
    private final Executor loop;

    private final RecorderStateMachine stateMachine = new RecorderStateMachine();
    private final SessionLifecycleGate lifecycleGate = new SessionLifecycleGate();
    private final OfflineRecordingStore offlineRecordings = new OfflineRecordingStore();
    private final List<Registration> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean unloaded = new AtomicBoolean(false);

    private final Object queueLock = new Object();
    private CompletableFuture<Void> toggleQueue = DONE;

    private volatile CaptureSession session;
    private volatile UUID sessionId;
    private volatile String lastRecordingPath;
    private volatile Consumer<String> onTranscriptionComplete;

    private RecorderService(RecorderDependencies deps, RecorderOptions options) {
        this.sessionFactory = deps.captureSessionFactory();
        this.ui = deps.presentationSurface();
        this.transcriptionCoordinator = deps.transcriptionCoordinator();
        this.durableStore = deps.durableStore();
        this.props = deps.properties();
        this.publisher = deps.publisher();
        this.metrics = deps.metricsPublisher();
        this.loop = deps.loopExecutor();
        this.onTranscriptionComplete = options.onTranscriptionComplete();
        this.metrics.bindOfflineRecordings(offlineRecordings::size);
    }

    /**
     * Returns the process-wide recorder, creating it on first call.
     *
     * <p>When the recorder already exists, {@code deps} is ignored and a non-null
     * {@link RecorderOptions#onTranscriptionComplete()} replaces the registered callback.
     *
     * @throws IllegalStateException if no recorder exists and {@code deps} is null
     */
    public static synchronized RecorderService getInstance(RecorderDependencies deps, RecorderOptions options) {
        if (instance == null) {
            if (deps == null) {
                throw new IllegalStateException("RecorderService has not been initialized");
            }
            instance = new RecorderService(deps, options == null ? RecorderOptions.none() : options);
            LOG.info("RecorderService initialized (recordings-directory={}, auto-transcribe={})",
                    instance.props.getRecordingsDirectory(), instance.props.isAutoTranscribe());
        } else if (options != null && options.onTranscriptionComplete() != null) {
            instance.onTranscriptionComplete = options.onTranscriptionComplete();
        }
        return instance;
    }

    /**
     * @throws IllegalStateException if the recorder has not been initialized
     */
    public static RecorderService getInstance() {
        return getInstance(null, null);
    }

    // Package-private for tests
    static synchronized void resetInstance() {
        instance = null;
    }

    /**
     * Subscribes to recording-state changes.
     *
     * @return handle that removes exactly this subscription
     */
    public ListenerRegistration onToggle(RecordingStateListener listener) {
        Registration registration = new Registration(listener);
        listeners.add(registration);
        return registration;
    }

    /**
     * Starts a session when idle, stops the active one when recording.
     *
     * <p>Requests run strictly one at a time in call order. The returned future completes when
     * this request has been processed: a start once capture is running (or failed), a stop once
     * the session has settled. A failed request never blocks later ones.
     */
    public CompletableFuture<Void> toggleRecording() {
        LOG.debug("toggleRecording invoked {}", snapshot());
        synchronized (queueLock) {
            CompletableFuture<Void> next = toggleQueue.thenComposeAsync(v -> performToggle(), loop);
            toggleQueue = next.handle((v, ex) -> null);
            return next;
        }
    }

    /**
     * Stops any active session, closes the surface, drops all listeners and releases the
     * process-wide slot. Idempotent. Must not be called from the loop executor.
     */
    public void unload() {
        if (!unloaded.compareAndSet(false, true)) {
            return;
        }
        long timeoutMs = props.getUnloadTimeoutMs();
        LOG.info("Unloading recorder {}", snapshot());
        try {
            CompletableFuture<Void> stopped = submit(() ->
                    stateMachine.state() == LifecycleState.RECORDING ? stopRecording() : DONE)
                    .thenCompose(Function.identity());
            waitFor(stopped, timeoutMs, "stop active session");

            CompletableFuture<Void> teardown = submit(() -> {
                cleanup(true);
                listeners.clear();
                return null;
            });
            waitFor(teardown, timeoutMs, "teardown");
        } catch (RejectedExecutionException e) {
            LOG.warn("Recorder loop unavailable during unload; cleaning up on caller thread");
            cleanup(true);
            listeners.clear();
        } finally {
            synchronized (RecorderService.class) {
                if (instance == this) {
                    instance = null;
                }
            }
            LOG.info("Recorder unloaded");
        }
    }

    /**
     * Blocks until no session is pending or the timeout elapses.
     *
     * @return true if settled
     */
    public boolean awaitSettled(Duration timeout) {
        try {
            lifecycleGate.await().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            LOG.debug("Session did not settle within {}ms", timeout.toMillis());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            // await() never completes exceptionally
            throw new IllegalStateException(e.getCause());
        }
    }

    public RecorderSnapshot snapshot() {
        CaptureSession s = session;
        LifecycleState state = stateMachine.state();
        return new RecorderSnapshot(
                state,
                state == LifecycleState.RECORDING,
                s != null,
                s != null && s.isActive(),
                ui.isVisible(),
                listeners.size(),
                lifecycleGate.isPending(),
                offlineRecordings.size());
    }

    /** Output paths of recordings currently held only in memory, oldest first. */
    public List<String> offlineRecordingPaths() {
        return offlineRecordings.paths();
    }

    /**
     * Writes an in-memory recording to durable storage again and drops it from memory once written.
     *
     * @throws OfflineRecordingNotFoundException if nothing is held for {@code outputPath}
     * @throws com.phillippitts.sessionrecorder.exception.RecordingPersistenceException if the write fails;
     *         the recording stays in memory
     */
    public Path recoverOfflineRecording(String outputPath) {
        byte[] payload = offlineRecordings.get(outputPath)
                .orElseThrow(() -> new OfflineRecordingNotFoundException(outputPath));
        Path written = durableStore.persist(outputPath, payload);
        offlineRecordings.remove(outputPath);
        LOG.info("Recovered in-memory recording {}", LogSanitizer.fileName(outputPath));
        return written;
    }

    private CompletableFuture<Void> performToggle() {
        LOG.debug("performToggle running {}", snapshot());
        if (stateMachine.state() == LifecycleState.RECORDING) {
            return stopRecording();
        }
        return startRecording();
    }

    private CompletableFuture<Void> startRecording() {
        LifecycleState state = stateMachine.state();
        if (state == LifecycleState.RECORDING || state == LifecycleState.STARTING) {
            LOG.debug("startRecording aborted due to active state {}", state);
            return DONE;
        }
        // A session that is still stopping settles first
        return lifecycleGate.await().thenComposeAsync(v -> beginSession(), loop);
    }

    private CompletableFuture<Void> beginSession() {
        if (!stateMachine.beginStart()) {
            LOG.debug("beginSession skipped; state is {}", stateMachine.state());
            return DONE;
        }
        UUID id = UUID.randomUUID();
        sessionId = id;
        lastRecordingPath = null;
        return inSessionContext(id, () -> {
            ui.open(() -> loop.execute(this::requestStop));
            ui.setStatus(STATUS_PREPARING);
            lifecycleGate.begin();
            try {
                CaptureRequest request = new CaptureRequest(
                        id, Path.of(props.getRecordingsDirectory()), props.getPreferredDevice());
                CaptureSession created = sessionFactory.create(request, new SessionCallbacks(id));
                session = created;
                LOG.debug("Capture session created {}", snapshot());
                return created.start()
                        .handleAsync((v, ex) -> onStartSettled(id, ex), loop)
                        .thenCompose(Function.identity());
            } catch (RuntimeException e) {
                onStartFailed(id, e);
                return DONE;
            }
        });
    }

    private CompletableFuture<Void> onStartSettled(UUID id, Throwable failure) {
        return inSessionContext(id, () -> {
            if (failure != null) {
                onStartFailed(id, unwrap(failure));
                return DONE;
            }
            return onCaptureStarted(id);
        });
    }

    private void onStartFailed(UUID id, Throwable failure) {
        if (!isCurrent(id)) {
            LOG.debug("Ignoring start failure of superseded session: {}", failure.toString());
            return;
        }
        LOG.error("startRecording failed", failure);
        handleError(failure, "start");
    }

    private CompletableFuture<Void> onCaptureStarted(UUID id) {
        CaptureSession current = session;
        if (!isCurrent(id) || current == null) {
            LOG.debug("Start resolved for a session that is no longer active");
            return DONE;
        }
        boolean stopPending = stateMachine.markRecording();
        metrics.recordStarted();
        if (stopPending) {
            LOG.debug("Stop requested during start; stopping immediately");
            return stopRecording();
        }
        LOG.info("Recording started (preferred-device={})", props.getPreferredDevice());
        ui.setRecordingState(true);
        ui.startTimer();
        notifyListeners();
        current.getMediaStream().ifPresent(stream -> {
            LOG.debug("Attaching level stream");
            ui.attachStream(stream);
        });
        return DONE;
    }

    /**
     * User stop action. While the session is still starting only the intent is recorded; the
     * stop is issued once start resolves.
     */
    private void requestStop() {
        LOG.debug("requestStop invoked {}", snapshot());
        if (stateMachine.requestStopDuringStart()) {
            ui.setStatus(STATUS_STOPPING);
            ui.setRecordingState(false);
            ui.stopTimer();
            notifyListeners();
            return;
        }
        stopRecording();
    }

    private CompletableFuture<Void> stopRecording() {
        CaptureSession current = session;
        if (current == null || !stateMachine.beginStop()) {
            LOG.debug("stopRecording aborted - nothing active");
            return DONE;
        }
        ui.setStatus(STATUS_STOPPING);
        ui.setRecordingState(false);
        ui.stopTimer();
        notifyListeners();
        try {
            current.stop();
        } catch (RuntimeException e) {
            LOG.error("stopRecording failed", e);
            handleError(e, "stop");
            cleanup(true);
            return DONE;
        }
        return lifecycleGate.await().thenRun(() -> LOG.info("Recording stopped"));
    }

    /**
     * Completion from a capture session. Runs on the loop.
     */
    void handleRecordingComplete(UUID id, RecordingResult result) {
        inSessionContext(id, () -> {
            String path = result.outputPath();
            byte[] payload = result.payload();
            LOG.info("Recording session completed (file={}, durationMs={}, reason={})",
                    result.fileName(), result.durationMs(), result.stopReason());

            if (!isCurrent(id)) {
                // Superseded (e.g. after unload): keep the audio, leave lifecycle alone
                offlineRecordings.put(path, payload);
                persistQuietly(path, payload);
                return null;
            }

            lastRecordingPath = path;
            session = null;
            sessionId = null;
            stateMachine.reset();
            ui.setRecordingState(false);
            ui.stopTimer();
            ui.detachStream();
            notifyListeners();
            metrics.recordCompleted(result.stopReason(), result.durationMs());

            offlineRecordings.put(path, payload);
            LOG.debug("Offline recording cached (in-memory={})", offlineRecordings.size());

            boolean persisted;
            try {
                durableStore.persist(path, payload);
                persisted = true;
            } catch (RuntimeException e) {
                persisted = false;
                handleError(e, "persist");
            }

            String name = result.fileName();
            boolean background = result.stopReason() == StopReason.BACKGROUND_HIDDEN;
            if (persisted) {
                if (background) {
                    ui.linger(backgroundMessage(name), BACKGROUND_LINGER_MS);
                } else if (props.isAutoTranscribe()) {
                    ui.setStatus(STATUS_TRANSCRIBING);
                } else {
                    ui.linger("Saved to " + name, SAVED_LINGER_MS);
                }
            }
            // Transcription works from the in-memory payload, so a failed write does not block it
            if (props.isAutoTranscribe()) {
                transcribe(id, result);
            }

            lifecycleGate.resolve();
            publishQuietly(new RecordingCompletedEvent(
                    path, result.stopReason(), result.durationMs(), persisted, Instant.now()));
            return null;
        });
    }

    private void transcribe(UUID id, RecordingResult result) {
        TranscriptionOptions options = new TranscriptionOptions(
                props.isPostProcessingEnabled(),
                status -> loop.execute(() -> ui.setStatus(status)));
        CompletableFuture<String> transcript;
        try {
            transcript = transcriptionCoordinator.start(result.payload(), result.outputPath(), options);
        } catch (RuntimeException e) {
            transcript = CompletableFuture.failedFuture(e);
        }
        transcript.whenCompleteAsync((text, ex) -> inSessionContext(id, () -> {
            if (ex != null) {
                onTranscriptionFailed(unwrap(ex));
            } else {
                handleTranscriptionComplete(text);
            }
            return null;
        }), loop);
    }

    private void onTranscriptionFailed(Throwable failure) {
        LOG.warn("Transcription failed: {}", failure.toString());
        metrics.recordTranscription("failure");
        ui.setStatus("Transcription failed: " + messageOf(failure));
        ui.linger(MESSAGE_TRANSCRIPTION_FAILED, TRANSCRIPTION_FAILED_LINGER_MS);
    }

    /**
     * Delivers a transcript to the registered callback, or confirms it on the surface when none is
     * registered. A throwing callback is reported on the surface and never propagates.
     */
    void handleTranscriptionComplete(String text) {
        Consumer<String> callback = onTranscriptionComplete;
        try {
            LOG.info("Transcription complete callback received (chars={})", text == null ? 0 : text.length());
            if (callback != null) {
                callback.accept(text);
                ui.closeAfter(CALLBACK_CLOSE_DELAY_MS);
            } else {
                ui.linger(props.isPostProcessingEnabled() ? MESSAGE_READY_POST_PROCESSED : MESSAGE_READY,
                        TRANSCRIPTION_READY_LINGER_MS);
            }
            metrics.recordTranscription("success");
        } catch (RuntimeException e) {
            LOG.warn("Transcription callback failed", e);
            metrics.recordTranscription("callback_failure");
            ui.setStatus("Failed to process transcription: " + messageOf(e));
            ui.linger(MESSAGE_TRANSCRIPTION_FAILED, CALLBACK_FAILED_LINGER_MS);
        }
    }

    void handleStreamChanged(MediaStream stream) {
        LOG.debug("Microphone stream updated (device={})", stream == null ? null : stream.deviceName());
        if (stream != null) {
            ui.attachStream(stream);
        }
    }

    /**
     * Single funnel for capture, start, stop and persistence failures. Always returns the recorder
     * to IDLE and settles the pending session.
     */
    void handleError(Throwable error, String stage) {
        LOG.error("Recorder failure encountered (stage={}) {}", stage, snapshot(), error);
        String backupPath = lastRecordingPath;
        boolean hasBackup = offlineRecordings.contains(backupPath);
        String message = hasBackup
                ? "Could not save " + LogSanitizer.fileName(backupPath)
                        + ". Your audio is still available in memory."
                : "Recording error: " + messageOf(error);

        ui.setStatus(message);
        ui.linger(message, hasBackup ? BACKUP_ERROR_LINGER_MS : ERROR_LINGER_MS);

        disposeSession();
        stateMachine.reset();
        ui.setRecordingState(false);
        ui.stopTimer();
        ui.detachStream();
        lifecycleGate.resolve();
        notifyListeners();

        metrics.recordError(stage);
        publishQuietly(new RecorderErrorEvent(stage, message, Instant.now()));
    }

    private void cleanup(boolean hideUi) {
        LOG.debug("cleanup invoked (hideUi={})", hideUi);
        disposeSession();
        stateMachine.reset();
        ui.setRecordingState(false);
        ui.stopTimer();
        ui.detachStream();
        lifecycleGate.resolve();
        if (hideUi) {
            ui.close();
        }
        notifyListeners();
    }

    private void disposeSession() {
        CaptureSession current = session;
        session = null;
        sessionId = null;
        if (current == null) {
            return;
        }
        try {
            current.dispose();
        } catch (RuntimeException e) {
            LOG.warn("Failed to dispose capture session: {}", e.toString());
        }
    }

    private void notifyListeners() {
        LifecycleState state = stateMachine.state();
        boolean recording = state == LifecycleState.RECORDING;
        LOG.debug("notifyListeners firing (listeners={}, recording={})", listeners.size(), recording);
        for (Registration registration : listeners) {
            try {
                registration.listener.onRecordingStateChanged(recording);
            } catch (RuntimeException e) {
                LOG.warn("Recording state listener failed: {}", e.toString());
            }
        }
        publishQuietly(new RecordingStateChangedEvent(recording, state, Instant.now()));
    }

    private void persistQuietly(String path, byte[] payload) {
        try {
            durableStore.persist(path, payload);
        } catch (RuntimeException e) {
            LOG.warn("Persisting superseded recording {} failed; kept in memory: {}",
                    LogSanitizer.fileName(path), e.getMessage());
        }
    }

    private void publishQuietly(Object event) {
        try {
            publisher.publishEvent(event);
        } catch (RuntimeException e) {
            LOG.warn("Event listener failed for {}: {}", event.getClass().getSimpleName(), e.toString());
        }
    }

    private boolean isCurrent(UUID id) {
        return id != null && id.equals(sessionId);
    }

    private <T> CompletableFuture<T> submit(Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, loop);
    }

    private static void waitFor(CompletableFuture<?> future, long timeoutMs, String what) {
        try {
            future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.warn("Timed out after {}ms waiting to {}", timeoutMs, what);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting to {}", what);
        } catch (ExecutionException e) {
            LOG.warn("Failed to {}: {}", what, e.getCause() == null ? e.toString() : e.getCause().toString());
        }
    }

    private static <T> T inSessionContext(UUID id, Supplier<T> work) {
        String previous = ThreadContext.get(SESSION_CONTEXT_KEY);
        ThreadContext.put(SESSION_CONTEXT_KEY, id.toString());
        try {
            return work.get();
        } finally {
            if (previous == null) {
                ThreadContext.remove(SESSION_CONTEXT_KEY);
            } else {
                ThreadContext.put(SESSION_CONTEXT_KEY, previous);
            }
        }
    }

    private static String backgroundMessage(String name) {
        return "Recording stopped because the system ended audio capture (device lost or app hidden). "
                + "Saved to " + name + ".";
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String messageOf(Throwable t) {
        String message = t.getMessage();
        return message == null || message.isBlank() ? t.getClass().getSimpleName() : message;
    }

    /** Identity-keyed subscription so duplicate listeners are removed one at a time. */
    private final class Registration implements ListenerRegistration {
        private final RecordingStateListener listener;

        private Registration(RecordingStateListener listener) {
            this.listener = listener;
        }

        @Override
        public void remove() {
            listeners.remove(this);
        }
    }

    /** Routes one session's callbacks onto the loop, tagged with its id. */
    private final class SessionCallbacks implements CaptureSessionListener {
        private final UUID id;

        private SessionCallbacks(UUID id) {
            this.id = id;
        }

        @Override
        public void onStatus(String message) {
            loop.execute(() -> {
                if (isCurrent(id)) {
                    ui.setStatus(message);
                }
            });
        }

        @Override
        public void onError(Throwable error) {
            loop.execute(() -> inSessionContext(id, () -> {
                if (isCurrent(id)) {
                    handleError(error, "capture");
                } else {
                    LOG.warn("Capture error after session settled: {}", error.toString());
                }
                return null;
            }));
        }

        @Override
        public void onStreamChanged(MediaStream stream) {
            loop.execute(() -> {
                if (isCurrent(id)) {
                    handleStreamChanged(stream);
                }
            });
        }

        @Override
        public void onComplete(RecordingResult result) {
            loop.execute(() -> handleRecordingComplete(id, result));
        }
    }
}
