package com.phillippitts.sessionrecorder.service.transcription;

import java.util.function.Consumer;

/**
 * Per-call transcription options.
 *
 * @param postProcessing normalize the raw transcript before returning it
 * @param onStatus receives progress messages; may be invoked from a worker thread
 */
public record TranscriptionOptions(boolean postProcessing, Consumer<String> onStatus) {

    public TranscriptionOptions {
        onStatus = onStatus == null ? message -> { } : onStatus;
    }

    public static TranscriptionOptions defaults() {
        return new TranscriptionOptions(false, null);
    }
}
