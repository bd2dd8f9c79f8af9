package com.phillippitts.sessionrecorder.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the process-backed transcription coordinator.
 * Binds to properties prefixed with "transcription".
 *
 * <p>Example application.properties:
 * <pre>
 * transcription.binary-path=tools/whisper.cpp/main
 * transcription.model-path=models/ggml-base.en.bin
 * transcription.timeout-seconds=120
 * transcription.language=en
 * transcription.threads=4
 * transcription.max-stdout-bytes=1048576
 * </pre>
 *
 * @param binaryPath Path to the whisper.cpp-compatible binary
 * @param modelPath Path to the model file passed with {@code -m}
 * @param timeoutSeconds Maximum time to wait for one transcription
 * @param language Language code (e.g., "en")
 * @param threads Number of CPU threads passed with {@code -t}
 * @param maxStdoutBytes Maximum stdout accumulation in bytes
 */
@ConfigurationProperties(prefix = "transcription")
@Validated
public record TranscriptionProperties(
        @NotBlank(message = "Transcription binary path must not be blank")
        @DefaultValue("tools/whisper.cpp/main")
        String binaryPath,

        @NotBlank(message = "Transcription model path must not be blank")
        @DefaultValue("models/ggml-base.en.bin")
        String modelPath,

        @Positive(message = "Timeout must be positive")
        @DefaultValue("120")
        int timeoutSeconds,

        @NotBlank(message = "Language code must not be blank")
        @DefaultValue("en")
        String language,

        @Positive(message = "Thread count must be positive")
        @DefaultValue("4")
        int threads,

        @Positive(message = "Max stdout bytes must be positive")
        @DefaultValue("1048576")
        int maxStdoutBytes
) {
    /**
     * Standard values, matching the binding defaults.
     */
    public static TranscriptionProperties defaults() {
        return new TranscriptionProperties("tools/whisper.cpp/main", "models/ggml-base.en.bin", 120, "en", 4, 1048576);
    }
}
