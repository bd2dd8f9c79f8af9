package com.phillippitts.sessionrecorder.service.recorder;

import com.phillippitts.sessionrecorder.domain.StopReason;
import com.phillippitts.sessionrecorder.service.metrics.RecorderMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link RecorderMetricsPublisher}, including the {@link RecorderMetricsPublisher#NOOP} default.
 */
class RecorderMetricsPublisherTest {

    @Test
    void noopShouldBeDisabledAndSafe() {
        RecorderMetricsPublisher noop = RecorderMetricsPublisher.NOOP;

        assertFalse(noop.isEnabled(), "No-op publisher should always report as disabled");
        assertDoesNotThrow(() -> {
            noop.recordStarted();
            noop.recordCompleted(StopReason.MANUAL, 10);
            noop.recordError("start");
            noop.recordTranscription("success");
            noop.bindOfflineRecordings(() -> 1);
        });
    }

    @Test
    void shouldForwardToRecorderMetrics() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        RecorderMetricsPublisher publisher = new RecorderMetricsPublisher(new RecorderMetrics(registry));
        AtomicInteger offline = new AtomicInteger(3);

        publisher.recordStarted();
        publisher.recordCompleted(StopReason.BACKGROUND_HIDDEN, 1500);
        publisher.recordError("persist");
        publisher.bindOfflineRecordings(offline::get);

        assertTrue(publisher.isEnabled());
        assertEquals(1.0, registry.get("sessionrecorder.sessions.started").counter().count());
        assertEquals(1.0, registry.get("sessionrecorder.sessions.completed")
                .tag("reason", "BACKGROUND_HIDDEN").counter().count());
        assertEquals(1.0, registry.get("sessionrecorder.errors").tag("stage", "persist").counter().count());
        assertEquals(3.0, registry.get("sessionrecorder.offline.recordings").gauge().value());
    }
}
