package com.phillippitts.sessionrecorder.domain;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Outcome of one completed capture session. Produced once by the capture session and
 * consumed once by the recorder.
 *
 * @param outputPath where the recording is to be persisted (vault-relative or absolute)
 * @param payload encoded audio (WAV); copied on the way in and out
 * @param startedAt when capture became active
 * @param durationMs captured audio length in milliseconds
 * @param stopReason why capture ended; {@code null} is treated as {@link StopReason#MANUAL}
 */
public record RecordingResult(
        String outputPath,
        byte[] payload,
        Instant startedAt,
        long durationMs,
        StopReason stopReason
) {

    public RecordingResult {
        Objects.requireNonNull(outputPath, "outputPath must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        if (outputPath.isBlank()) {
            throw new IllegalArgumentException("outputPath must not be blank");
        }
        if (durationMs < 0) {
            throw new IllegalArgumentException("durationMs must be >= 0");
        }
        payload = payload.clone();
        startedAt = startedAt == null ? Instant.now() : startedAt;
        stopReason = stopReason == null ? StopReason.MANUAL : stopReason;
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    /** File name portion of {@link #outputPath()}. */
    public String fileName() {
        int slash = Math.max(outputPath.lastIndexOf('/'), outputPath.lastIndexOf('\\'));
        return slash >= 0 ? outputPath.substring(slash + 1) : outputPath;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RecordingResult other)) {
            return false;
        }
        return durationMs == other.durationMs
                && outputPath.equals(other.outputPath)
                && Arrays.equals(payload, other.payload)
                && startedAt.equals(other.startedAt)
                && stopReason == other.stopReason;
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(outputPath, startedAt, durationMs, stopReason);
        return 31 * result + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "RecordingResult[outputPath=" + outputPath
                + ", bytes=" + payload.length
                + ", startedAt=" + startedAt
                + ", durationMs=" + durationMs
                + ", stopReason=" + stopReason + ']';
    }
}
