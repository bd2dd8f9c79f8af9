package com.phillippitts.sessionrecorder.service.capture;

import com.phillippitts.sessionrecorder.config.properties.AudioCaptureProperties;
import com.phillippitts.sessionrecorder.domain.RecordingResult;
import com.phillippitts.sessionrecorder.domain.StopReason;
import com.phillippitts.sessionrecorder.exception.CaptureStartException;
import com.phillippitts.sessionrecorder.service.audio.WavWriter;
import com.phillippitts.sessionrecorder.testutil.EventCapturingPublisher;
import com.phillippitts.sessionrecorder.testutil.FakeDurableStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import javax.sound.sampled.Control;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineListener;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.TargetDataLine;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JavaSoundCaptureSessionTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:15:30.123Z"), ZoneOffset.UTC);
    private static final Path DIR = Path.of("target", "capture-test");

    private final EventCapturingPublisher publisher = new EventCapturingPublisher();
    private final RecordingListener listener = new RecordingListener();
    private final AtomicReference<RepeatingTargetDataLine> opened = new AtomicReference<>();
    private JavaSoundCaptureSession session;

    @AfterEach
    void tearDown() {
        if (session != null) {
            session.dispose();
        }
    }

    private JavaSoundCaptureSession newSession(AudioCaptureProperties props, DataLineProvider provider) {
        CaptureRequest request = new CaptureRequest(UUID.randomUUID(), DIR, null);
        session = new JavaSoundCaptureSession(
                request, listener, props, new FakeDurableStore(), publisher, provider, CLOCK);
        return session;
    }

    private DataLineProvider repeatingLine(int failAfterReads) {
        return (fmt, dev) -> {
            RepeatingTargetDataLine line = new RepeatingTargetDataLine(fmt, failAfterReads);
            line.open(fmt);
            opened.set(line);
            return line;
        };
    }

    @Test
    void manualStopProducesSingleWavCompletion() throws Exception {
        // Arrange
        JavaSoundCaptureSession s = newSession(new AudioCaptureProperties(20, 60_000), repeatingLine(-1));

        // Act
        s.start().get(2, TimeUnit.SECONDS);
        assertThat(s.isActive()).isTrue();
        Thread.sleep(150); // let a few chunks arrive
        s.stop();

        // Assert
        RecordingResult result = listener.awaitResult();
        assertThat(result.stopReason()).isEqualTo(StopReason.MANUAL);
        assertThat(result.outputPath()).isEqualTo(DIR.resolve("2024-03-01_10-15-30-123.wav").toString());
        assertThat(WavWriter.isWav(result.payload())).isTrue();
        assertThat(result.durationMs()).isGreaterThan(0);
        assertThat(s.isActive()).isFalse();
        assertThat(s.getMediaStream()).isEmpty();
        assertThat(listener.results).hasSize(1);
        assertThat(listener.statuses).contains("Recording...");
        assertThat(listener.streams).hasSize(1);
        assertThat(listener.streams.get(0).deviceName()).isEqualTo("default");
        assertThat(publisher.eventsOfType(CaptureErrorEvent.class)).isEmpty();
    }

    @Test
    void reachingMaxDurationEndsLikeManualStop() throws Exception {
        JavaSoundCaptureSession s = newSession(new AudioCaptureProperties(20, 100), repeatingLine(-1));

        s.start().get(2, TimeUnit.SECONDS);

        RecordingResult result = listener.awaitResult();
        assertThat(result.stopReason()).isEqualTo(StopReason.MANUAL);
        assertThat(result.durationMs()).isGreaterThanOrEqualTo(100);
        assertThat(listener.statuses).contains(JavaSoundCaptureSession.MAX_DURATION_STATUS);
    }

    @Test
    void lineClosedWithoutStopEndsAsForcedStop() throws Exception {
        JavaSoundCaptureSession s = newSession(new AudioCaptureProperties(20, 60_000), repeatingLine(-1));
        s.start().get(2, TimeUnit.SECONDS);

        opened.get().close();

        assertThat(listener.awaitResult().stopReason()).isEqualTo(StopReason.BACKGROUND_HIDDEN);
    }

    @Test
    void readFailureKeepsAudioThenReportsError() throws Exception {
        // Arrange
        JavaSoundCaptureSession s = newSession(new AudioCaptureProperties(20, 60_000), repeatingLine(5));

        // Act
        s.start().get(2, TimeUnit.SECONDS);

        // Assert
        RecordingResult result = listener.awaitResult();
        assertThat(result.stopReason()).isEqualTo(StopReason.ERROR);
        assertThat(listener.errorLatch.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(listener.errors.get(0)).hasMessageContaining("device removed");
        assertThat(publisher.find(CaptureErrorEvent.class).reason()).isEqualTo("CAPTURE_ERROR");
    }

    @Test
    void permissionDeniedFailsStart() {
        JavaSoundCaptureSession s = newSession(new AudioCaptureProperties(20, 60_000), (fmt, dev) -> {
            throw new SecurityException("not allowed");
        });

        assertThatThrownBy(() -> s.start().get(2, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(CaptureStartException.class)
                .hasMessageContaining("Microphone access denied");
        assertThat(publisher.find(CaptureErrorEvent.class).reason()).isEqualTo("MIC_PERMISSION_DENIED");
        assertThat(listener.results).isEmpty();
    }

    @Test
    void unavailableLineFailsStartWithReason() {
        JavaSoundCaptureSession s = newSession(new AudioCaptureProperties(20, 60_000), (fmt, dev) -> {
            throw new LineUnavailableException("busy");
        });

        assertThatThrownBy(() -> s.start().get(2, TimeUnit.SECONDS))
                .hasCauseInstanceOf(CaptureStartException.class)
                .satisfies(e -> assertThat(((CaptureStartException) e.getCause()).getReason())
                        .isEqualTo("MIC_UNAVAILABLE"));
        assertThat(publisher.find(CaptureErrorEvent.class).reason()).isEqualTo("MIC_UNAVAILABLE");
    }

    @Test
    void disposeSuppressesCompletion() throws Exception {
        JavaSoundCaptureSession s = newSession(new AudioCaptureProperties(20, 60_000), repeatingLine(-1));
        s.start().get(2, TimeUnit.SECONDS);

        s.dispose();
        s.dispose();

        assertThat(listener.resultLatch.await(300, TimeUnit.MILLISECONDS)).isFalse();
        assertThat(s.isActive()).isFalse();
        assertThat(opened.get().isOpen()).isFalse();
    }

    @Test
    void startIsIdempotent() throws Exception {
        JavaSoundCaptureSession s = newSession(new AudioCaptureProperties(20, 60_000), repeatingLine(-1));

        assertThat(s.start()).isSameAs(s.start());
        s.start().get(2, TimeUnit.SECONDS);
        s.stop();
        listener.awaitResult();

        assertThat(listener.results).hasSize(1);
    }

    @Test
    void levelStreamReportsRms() {
        JavaSoundCaptureSession.LevelStream stream = new JavaSoundCaptureSession.LevelStream("mic");
        byte[] loud = new byte[] {(byte) 0xFF, 0x7F, (byte) 0xFF, 0x7F};

        stream.update(loud, loud.length);

        assertThat(stream.level()).isGreaterThan(0.99);
        assertThat(stream.deviceName()).isEqualTo("mic");
    }

    /** Captures callbacks from the capture thread. */
    static final class RecordingListener implements CaptureSessionListener {
        final List<RecordingResult> results = new CopyOnWriteArrayList<>();
        final List<Throwable> errors = new CopyOnWriteArrayList<>();
        final List<String> statuses = new CopyOnWriteArrayList<>();
        final List<MediaStream> streams = new CopyOnWriteArrayList<>();
        final CountDownLatch resultLatch = new CountDownLatch(1);
        final CountDownLatch errorLatch = new CountDownLatch(1);

        @Override
        public void onStatus(String message) {
            statuses.add(message);
        }

        @Override
        public void onError(Throwable error) {
            errors.add(error);
            errorLatch.countDown();
        }

        @Override
        public void onStreamChanged(MediaStream stream) {
            streams.add(stream);
        }

        @Override
        public void onComplete(RecordingResult result) {
            results.add(result);
            resultLatch.countDown();
        }

        RecordingResult awaitResult() throws InterruptedException {
            assertThat(resultLatch.await(3, TimeUnit.SECONDS)).as("completion delivered").isTrue();
            return results.get(0);
        }
    }

    static final class RepeatingTargetDataLine implements TargetDataLine {
        private final javax.sound.sampled.AudioFormat fmt;
        private final int failAfterReads;
        private final byte[] pattern;
        private volatile boolean started;
        private volatile boolean open;
        private int reads;
        private int pos = 0;

        RepeatingTargetDataLine(javax.sound.sampled.AudioFormat fmt, int failAfterReads) {
            this.fmt = fmt;
            this.failAfterReads = failAfterReads;
            this.pattern = new byte[320]; // ~10ms at 16k mono 16-bit
            for (int i = 0; i < pattern.length; i++) {
                pattern[i] = (byte) (i & 0xFF);
            }
        }

        @Override public javax.sound.sampled.AudioFormat getFormat() {
            return fmt;
        }
        @Override public void open(javax.sound.sampled.AudioFormat format, int bufferSize) {
            open = true;
        }
        @Override public void open(javax.sound.sampled.AudioFormat format) {
            open = true;
        }
        @Override public int read(byte[] b, int off, int len) {
            if (!open) {
                return -1;
            }
            if (!started) {
                return 0;
            }
            if (failAfterReads >= 0 && reads++ >= failAfterReads) {
                throw new IllegalStateException("device removed");
            }
            // Throttle to simulate real-time audio capture (~10ms per read)
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            int n = Math.min(len, pattern.length);
            int first = Math.min(n, pattern.length - pos);
            System.arraycopy(pattern, pos, b, off, first);
            System.arraycopy(pattern, 0, b, off + first, n - first);
            pos = (pos + n) % pattern.length;
            return n;
        }
        @Override public void start() {
            started = true;
        }
        @Override public void stop() {
            started = false;
        }
        @Override public void close() {
            open = false;
        }
        @Override public boolean isOpen() {
            return open;
        }
        @Override public int available() {
            return 0;
        }
        @Override public void drain() {
        }
        @Override public void flush() {
        }
        @Override public int getBufferSize() {
            return 0;
        }
        @Override public int getFramePosition() {
            return 0;
        }
        @Override public float getLevel() {
            return 0;
        }
        @Override public long getLongFramePosition() {
            return 0;
        }
        @Override public Control getControl(Control.Type control) {
            throw new IllegalArgumentException();
        }
        @Override public Control[] getControls() {
            return new Control[0];
        }
        @Override public boolean isControlSupported(Control.Type control) {
            return false;
        }
        @Override public void addLineListener(LineListener listener) {
        }
        @Override public void removeLineListener(LineListener listener) {
        }
        @Override public javax.sound.sampled.Line.Info getLineInfo() {
            return new DataLine.Info(TargetDataLine.class, fmt);
        }
        @Override public void open() {
            open = true;
        }
        @Override public boolean isActive() {
            return started;
        }
        @Override public boolean isRunning() {
            return started;
        }
        @Override public long getMicrosecondPosition() {
            return 0L;
        }
    }
}
