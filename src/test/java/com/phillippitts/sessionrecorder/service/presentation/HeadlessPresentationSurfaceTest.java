package com.phillippitts.sessionrecorder.service.presentation;

import com.phillippitts.sessionrecorder.service.capture.MediaStream;
import com.phillippitts.sessionrecorder.service.presentation.event.RecorderStatusEvent;
import com.phillippitts.sessionrecorder.testutil.EventCapturingPublisher;
import com.phillippitts.sessionrecorder.testutil.MutableClock;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class HeadlessPresentationSurfaceTest {

    private ThreadPoolTaskScheduler scheduler;
    private EventCapturingPublisher publisher;
    private HeadlessPresentationSurface surface;

    @BeforeEach
    void setUp() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("presentation-test-");
        scheduler.initialize();
        publisher = new EventCapturingPublisher();
        surface = new HeadlessPresentationSurface(scheduler, publisher);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void stopActionRunsOnlyWhileOpen() {
        AtomicInteger stops = new AtomicInteger();
        surface.open(stops::incrementAndGet);

        assertThat(surface.isVisible()).isTrue();
        assertThat(surface.requestStop()).isTrue();

        surface.close();

        assertThat(surface.requestStop()).isFalse();
        assertThat(stops.get()).isEqualTo(1);
    }

    @Test
    void statusIsPublishedWithRecordingIndicator() {
        surface.setRecordingState(true);

        surface.setStatus("Recording...");

        RecorderStatusEvent event = publisher.find(RecorderStatusEvent.class);
        assertThat(event.message()).isEqualTo("Recording...");
        assertThat(event.recording()).isTrue();
        assertThat(surface.view().status()).isEqualTo("Recording...");
    }

    @Test
    void lingerShowsMessageThenCloses() {
        surface.open(() -> { });

        surface.linger("Saved to a.wav", 50);

        assertThat(surface.view().status()).isEqualTo("Saved to a.wav");
        Awaitility.await().atMost(2, TimeUnit.SECONDS).until(() -> !surface.isVisible());
    }

    @Test
    void openCancelsPendingClose() throws InterruptedException {
        surface.open(() -> { });
        surface.closeAfter(100);

        surface.open(() -> { });
        Thread.sleep(300);

        assertThat(surface.isVisible()).isTrue();
    }

    @Test
    void newerCloseAfterSupersedesEarlierOne() throws InterruptedException {
        surface.open(() -> { });
        surface.closeAfter(50);

        surface.closeAfter(60_000);
        Thread.sleep(300);

        assertThat(surface.isVisible()).isTrue();
    }

    @Test
    void timerFreezesElapsedTimeWhenStopped() {
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        HeadlessPresentationSurface timed = new HeadlessPresentationSurface(scheduler, publisher, clock);
        timed.open(() -> { });

        timed.startTimer();
        clock.advance(Duration.ofMillis(1500));
        assertThat(timed.view().timerRunning()).isTrue();
        assertThat(timed.view().elapsedMs()).isEqualTo(1500);

        timed.stopTimer();
        clock.advance(Duration.ofSeconds(10));

        assertThat(timed.view().timerRunning()).isFalse();
        assertThat(timed.view().elapsedMs()).isEqualTo(1500);
    }

    @Test
    void viewReflectsAttachedStream() {
        surface.attachStream(new MediaStream() {
            @Override
            public String deviceName() {
                return "USB Mic";
            }

            @Override
            public double level() {
                return 0.25;
            }
        });

        assertThat(surface.view().streamDevice()).isEqualTo("USB Mic");
        assertThat(surface.view().level()).isEqualTo(0.25);

        surface.detachStream();

        assertThat(surface.view().streamDevice()).isNull();
        assertThat(surface.view().level()).isZero();
    }
}
