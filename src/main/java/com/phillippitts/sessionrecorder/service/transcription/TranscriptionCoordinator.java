package com.phillippitts.sessionrecorder.service.transcription;

import java.util.concurrent.CompletableFuture;

/**
 * Turns a finished recording into text, asynchronously. Each call is independent and may be retried.
 */
public interface TranscriptionCoordinator {

    /**
     * @param payload encoded recording (WAV); the coordinator receives its own copy
     * @param outputPath where the recording was persisted, used for naming and logs
     * @param options post-processing flag and progress callback
     * @return future with the transcript, or completing exceptionally with a
     *         {@link com.phillippitts.sessionrecorder.exception.TranscriptionException}
     */
    CompletableFuture<String> start(byte[] payload, String outputPath, TranscriptionOptions options);
}
