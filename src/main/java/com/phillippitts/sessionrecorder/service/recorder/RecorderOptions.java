package com.phillippitts.sessionrecorder.service.recorder;

import java.util.function.Consumer;

/**
 * Options passed to {@link RecorderService#getInstance(RecorderDependencies, RecorderOptions)}.
 *
 * @param onTranscriptionComplete receives finished transcripts; {@code null} shows a self-dismissing
 *                                confirmation instead
 */
public record RecorderOptions(Consumer<String> onTranscriptionComplete) {

    public static RecorderOptions none() {
        return new RecorderOptions(null);
    }
}
