package com.phillippitts.sessionrecorder.service.recorder;

import com.phillippitts.sessionrecorder.domain.StopReason;
import com.phillippitts.sessionrecorder.service.metrics.RecorderMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Centralizes recorder metrics so the recorder itself never deals with a missing registry.
 *
 * <p><b>Null Safety:</b> All methods handle a null {@link RecorderMetrics} gracefully, allowing the
 * recorder to run without metrics in test environments.
 *
 * @see RecorderMetrics
 */
@Component
public final class RecorderMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(RecorderMetricsPublisher.class);

    /** No-op instance for test environments and builder defaults. */
    public static final RecorderMetricsPublisher NOOP = new RecorderMetricsPublisher(null);

    private final RecorderMetrics metrics;

    /**
     * @param metrics metrics tracking service (nullable for test mode)
     */
    public RecorderMetricsPublisher(RecorderMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("RecorderMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordStarted() {
        if (metrics == null) {
            return;
        }
        metrics.incrementStarted();
    }

    public void recordCompleted(StopReason reason, long durationMs) {
        if (metrics == null) {
            return;
        }
        metrics.recordCompleted(reason.name(), durationMs);
    }

    public void recordError(String stage) {
        if (metrics == null) {
            return;
        }
        metrics.incrementError(stage);
    }

    public void recordTranscription(String outcome) {
        if (metrics == null) {
            return;
        }
        metrics.incrementTranscription(outcome);
    }

    void bindOfflineRecordings(Supplier<Number> count) {
        if (metrics == null) {
            return;
        }
        metrics.bindOfflineRecordings(count);
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
