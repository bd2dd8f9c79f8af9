package com.phillippitts.sessionrecorder.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Centralized metrics tracking for recording sessions.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Sessions started and completed, tagged by stop reason</li>
 *   <li>Recorded duration per completed session</li>
 *   <li>Errors per stage (start, stop, persist, capture)</li>
 *   <li>Transcription outcomes</li>
 *   <li>Number of recordings held only in memory</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available under /actuator/metrics.
 */
@Component
public class RecorderMetrics {

    private static final String METRIC_PREFIX = "sessionrecorder";

    private final MeterRegistry registry;

    public RecorderMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementStarted() {
        Counter.builder(METRIC_PREFIX + ".sessions.started")
                .description("Number of capture sessions that became active")
                .register(registry)
                .increment();
    }

    /**
     * @param stopReason why capture ended (MANUAL, BACKGROUND_HIDDEN, ERROR)
     * @param durationMs captured audio length
     */
    public void recordCompleted(String stopReason, long durationMs) {
        Counter.builder(METRIC_PREFIX + ".sessions.completed")
                .description("Number of completed capture sessions")
                .tag("reason", stopReason)
                .register(registry)
                .increment();
        DistributionSummary.builder(METRIC_PREFIX + ".sessions.duration")
                .description("Recorded audio length")
                .baseUnit("milliseconds")
                .register(registry)
                .record(durationMs);
    }

    /**
     * @param stage where the failure surfaced (start, stop, persist, capture)
     */
    public void incrementError(String stage) {
        Counter.builder(METRIC_PREFIX + ".errors")
                .description("Number of recorder errors")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome success, failure or callback_failure
     */
    public void incrementTranscription(String outcome) {
        Counter.builder(METRIC_PREFIX + ".transcriptions")
                .description("Number of transcription hand-offs by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Registers the gauge tracking recordings that exist only in memory.
     */
    public void bindOfflineRecordings(Supplier<Number> count) {
        Gauge.builder(METRIC_PREFIX + ".offline.recordings", count)
                .description("Recordings held in memory because persistence was not confirmed")
                .register(registry);
    }
}
