package com.phillippitts.sessionrecorder.service.capture;

import com.phillippitts.sessionrecorder.config.properties.AudioCaptureProperties;
import com.phillippitts.sessionrecorder.domain.RecordingResult;
import com.phillippitts.sessionrecorder.domain.StopReason;
import com.phillippitts.sessionrecorder.exception.CaptureStartException;
import com.phillippitts.sessionrecorder.service.audio.AudioFormat;
import com.phillippitts.sessionrecorder.service.audio.WavWriter;
import com.phillippitts.sessionrecorder.service.storage.DurableStore;
import com.phillippitts.sessionrecorder.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.TargetDataLine;
import java.io.ByteArrayOutputStream;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Java Sound based capture session producing a 16 kHz mono PCM16LE recording wrapped as WAV.
 *
 * <p>Capture runs on a dedicated daemon thread. {@link #start()} resolves once the line is open
 * and running; {@link #stop()} only flags the thread, which then emits the single completion.
 * When the line ends without a stop request (device unplugged, OS revoked the input while the
 * app was hidden), the session completes on its own with {@link StopReason#BACKGROUND_HIDDEN}.
 * Reaching the maximum duration ends the session like a manual stop, announced through
 * {@link CaptureSessionListener#onStatus(String)}.
 */
public class JavaSoundCaptureSession implements CaptureSession {

    private static final Logger LOG = LogManager.getLogger(JavaSoundCaptureSession.class);

    static final String MAX_DURATION_STATUS = "Maximum recording length reached. Stopping...";
    static final DateTimeFormatter FILE_NAME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss-SSS");

    private final CaptureRequest request;
    private final CaptureSessionListener listener;
    private final AudioCaptureProperties props;
    private final DurableStore store;
    private final ApplicationEventPublisher publisher;
    private final DataLineProvider provider;
    private final Clock clock;

    private final CompletableFuture<Void> startFuture = new CompletableFuture<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicBoolean disposed = new AtomicBoolean(false);
    private final AtomicBoolean completed = new AtomicBoolean(false);

    private volatile boolean active;
    private volatile Thread thread;
    private volatile TargetDataLine line;
    private volatile String outputPath;
    private volatile Instant startedAt;
    private volatile LevelStream stream;

    JavaSoundCaptureSession(CaptureRequest request,
                            CaptureSessionListener listener,
                            AudioCaptureProperties props,
                            DurableStore store,
                            ApplicationEventPublisher publisher,
                            DataLineProvider provider,
                            Clock clock) {
        this.request = Objects.requireNonNull(request);
        this.listener = Objects.requireNonNull(listener);
        this.props = Objects.requireNonNull(props);
        this.store = Objects.requireNonNull(store);
        this.publisher = Objects.requireNonNull(publisher);
        this.provider = Objects.requireNonNull(provider);
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public CompletableFuture<Void> start() {
        if (!started.compareAndSet(false, true)) {
            return startFuture;
        }
        String id = request.sessionId().toString().substring(0, 8);
        Thread t = new Thread(this::run, "audio-capture-" + id);
        t.setDaemon(true);
        thread = t;
        t.start();
        return startFuture;
    }

    @Override
    public void stop() {
        if (stopRequested.compareAndSet(false, true)) {
            LOG.debug("Stop requested for capture session {}", request.sessionId());
        }
    }

    @Override
    public void dispose() {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }
        stopRequested.set(true);
        active = false;
        TargetDataLine l = line;
        if (l != null) {
            // Closing unblocks a pending read
            closeLine(l);
        }
        Thread t = thread;
        if (t != null && t != Thread.currentThread()) {
            joinThread(t, ProcessTimeouts.CAPTURE_THREAD_DISPOSE_TIMEOUT.toMillis());
        }
        if (!startFuture.isDone()) {
            startFuture.completeExceptionally(new CaptureStartException("Capture session disposed before start"));
        }
        LOG.debug("Capture session {} disposed", request.sessionId());
    }

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public Optional<MediaStream> getMediaStream() {
        return Optional.ofNullable(stream);
    }

    @Override
    public String getOutputPath() {
        return outputPath;
    }

    private void run() {
        ThreadContext.put("recordingSession", request.sessionId().toString());
        try {
            TargetDataLine l = openLine();
            if (l == null) {
                return;
            }
            capture(l);
        } finally {
            ThreadContext.remove("recordingSession");
        }
    }

    private TargetDataLine openLine() {
        TargetDataLine l;
        try {
            store.ensureDirectory(request.recordingsDirectory());
            outputPath = request.recordingsDirectory()
                    .resolve(FILE_NAME_FORMAT.format(clock.instant().atZone(clock.getZone()))
                            + "." + AudioFormat.FILE_EXTENSION)
                    .toString();
            l = provider.open(AudioFormat.javaSoundFormat(), request.device());
            l.start();
        } catch (LineUnavailableException e) {
            failStart("Microphone unavailable: " + e.getMessage(), "MIC_UNAVAILABLE", e);
            return null;
        } catch (SecurityException e) {
            failStart("Microphone access denied: " + e.getMessage(), "MIC_PERMISSION_DENIED", e);
            return null;
        } catch (RuntimeException e) {
            failStart("Failed to start capture: " + e.getMessage(), "CAPTURE_START_FAILED", e);
            return null;
        }

        if (disposed.get()) {
            closeLine(l);
            startFuture.completeExceptionally(new CaptureStartException("Capture session disposed before start"));
            return null;
        }
        line = l;
        startedAt = clock.instant();
        stream = new LevelStream(request.device().orElse("default"));
        active = true;
        LOG.info("Audio capture started: device='{}', output={}, chunk={}ms, max-duration={}ms",
                stream.deviceName(), outputPath, props.getChunkMillis(), props.getMaxDurationMs());
        listener.onStatus("Recording...");
        listener.onStreamChanged(stream);
        startFuture.complete(null);
        return l;
    }

    private void capture(TargetDataLine l) {
        final int bytesPerChunk = AudioFormat.millisToPcmBytes(props.getChunkMillis());
        final long hardStopBytes = AudioFormat.millisToPcmBytes(props.getMaxDurationMs());
        ByteArrayOutputStream pcm = new ByteArrayOutputStream();
        byte[] buf = new byte[bytesPerChunk];
        StopReason reason;
        RuntimeException failure = null;
        try {
            while (true) {
                if (stopRequested.get()) {
                    reason = StopReason.MANUAL;
                    break;
                }
                if (!l.isOpen()) {
                    LOG.info("Input line closed without a stop request");
                    reason = StopReason.BACKGROUND_HIDDEN;
                    break;
                }
                int n = l.read(buf, 0, buf.length);
                if (n < 0) {
                    reason = stopRequested.get() ? StopReason.MANUAL : StopReason.BACKGROUND_HIDDEN;
                    break;
                }
                if (n == 0) {
                    if (!l.isActive() && !stopRequested.get()) {
                        LOG.info("Input line went inactive without a stop request");
                        reason = StopReason.BACKGROUND_HIDDEN;
                        break;
                    }
                    continue;
                }
                pcm.write(buf, 0, n);
                stream.update(buf, n);
                if (pcm.size() >= hardStopBytes) {
                    LOG.info("Max capture duration reached ({} ms)", props.getMaxDurationMs());
                    listener.onStatus(MAX_DURATION_STATUS);
                    reason = StopReason.MANUAL;
                    break;
                }
            }
        } catch (RuntimeException e) {
            LOG.warn("Capture failed mid-recording: {}", e.toString());
            publisher.publishEvent(new CaptureErrorEvent("CAPTURE_ERROR", Instant.now()));
            reason = StopReason.ERROR;
            failure = e;
        } finally {
            active = false;
            closeLine(l);
        }
        LOG.info("Audio capture completed: reason={}, {} bytes captured", reason, pcm.size());
        completeWith(reason, pcm.toByteArray());
        // Reported after the completion so the captured audio is handed over first
        if (failure != null && !disposed.get()) {
            listener.onError(failure);
        }
    }

    private void completeWith(StopReason reason, byte[] pcm) {
        if (disposed.get()) {
            LOG.debug("Capture session {} disposed; completion suppressed", request.sessionId());
            return;
        }
        if (!completed.compareAndSet(false, true)) {
            return;
        }
        RecordingResult result = new RecordingResult(
                outputPath,
                WavWriter.encode(pcm),
                startedAt,
                AudioFormat.pcmBytesToMillis(pcm.length),
                reason);
        stream = null;
        listener.onComplete(result);
    }

    private void failStart(String message, String reason, Throwable cause) {
        LOG.warn("{}", message);
        publisher.publishEvent(new CaptureErrorEvent(reason, Instant.now()));
        startFuture.completeExceptionally(new CaptureStartException(message, reason, cause));
    }

    private static void closeLine(TargetDataLine l) {
        try {
            l.stop();
            l.close();
        } catch (RuntimeException e) {
            LOG.debug("Failed to close input line: {}", e.toString());
        }
    }

    private static void joinThread(Thread thread, long timeoutMs) {
        if (!thread.isAlive()) {
            return;
        }
        try {
            thread.join(timeoutMs);
            if (thread.isAlive()) {
                LOG.warn("Capture thread did not terminate within {}ms", timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for capture thread to terminate");
        }
    }

    /** Live level of the most recent chunk. */
    static final class LevelStream implements MediaStream {
        private final String deviceName;
        private volatile double level;

        LevelStream(String deviceName) {
            this.deviceName = deviceName;
        }

        @Override
        public String deviceName() {
            return deviceName;
        }

        @Override
        public double level() {
            return level;
        }

        void update(byte[] buf, int len) {
            int samples = len / AudioFormat.BLOCK_ALIGN;
            if (samples == 0) {
                return;
            }
            double sum = 0;
            for (int i = 0; i + 1 < len; i += AudioFormat.BLOCK_ALIGN) {
                short s = (short) ((buf[i] & 0xFF) | (buf[i + 1] << 8));
                double v = s / 32768.0;
                sum += v * v;
            }
            level = Math.min(1.0, Math.sqrt(sum / samples));
        }
    }
}
