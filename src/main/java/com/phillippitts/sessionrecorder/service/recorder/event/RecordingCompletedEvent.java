package com.phillippitts.sessionrecorder.service.recorder.event;

import com.phillippitts.sessionrecorder.domain.StopReason;

import java.time.Instant;

/**
 * Emitted once per completed session after the recorder handled the result.
 *
 * @param outputPath where the recording was (or was meant to be) persisted
 * @param stopReason why capture ended
 * @param durationMs captured audio length
 * @param persisted false when the recording currently exists only in memory
 * @param timestamp when handling finished
 */
public record RecordingCompletedEvent(
        String outputPath,
        StopReason stopReason,
        long durationMs,
        boolean persisted,
        Instant timestamp
) {}
