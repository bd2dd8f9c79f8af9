package com.phillippitts.sessionrecorder.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the recorder.
 *
 * <p>Example application.properties:
 * <pre>
 * recorder.recordings-directory=recordings
 * recorder.preferred-device=
 * recorder.auto-transcribe=false
 * recorder.post-processing-enabled=false
 * recorder.unload-timeout-ms=5000
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "recorder")
public class RecorderProperties {

    public static final String DEFAULT_RECORDINGS_DIRECTORY = "recordings";

    /** Directory that receives finished recordings. */
    @NotBlank
    private final String recordingsDirectory;

    /** Optional input device name hint; falls back to the system default when null/blank. */
    private final String preferredDevice;

    /** Hand every finished recording to the transcription coordinator. */
    private final boolean autoTranscribe;

    /** Post-process transcripts (affects the transcription options and the completion message). */
    private final boolean postProcessingEnabled;

    /** Upper bound on how long {@code unload()} waits for an active session to settle. */
    @Min(0)
    @Max(60_000)
    private final long unloadTimeoutMs;

    @ConstructorBinding
    public RecorderProperties(String recordingsDirectory,
                              String preferredDevice,
                              Boolean autoTranscribe,
                              Boolean postProcessingEnabled,
                              Long unloadTimeoutMs) {
        this.recordingsDirectory = (recordingsDirectory == null || recordingsDirectory.isBlank())
                ? DEFAULT_RECORDINGS_DIRECTORY
                : recordingsDirectory;
        this.preferredDevice = (preferredDevice == null || preferredDevice.isBlank()) ? null : preferredDevice;
        this.autoTranscribe = autoTranscribe != null && autoTranscribe;
        this.postProcessingEnabled = postProcessingEnabled != null && postProcessingEnabled;
        this.unloadTimeoutMs = unloadTimeoutMs == null ? 5000L : unloadTimeoutMs;
    }

    /**
     * Defaults for tests and manual wiring.
     */
    public static RecorderProperties defaults() {
        return new RecorderProperties(null, null, false, false, null);
    }

    public String getRecordingsDirectory() {
        return recordingsDirectory;
    }

    public String getPreferredDevice() {
        return preferredDevice;
    }

    public boolean isAutoTranscribe() {
        return autoTranscribe;
    }

    public boolean isPostProcessingEnabled() {
        return postProcessingEnabled;
    }

    public long getUnloadTimeoutMs() {
        return unloadTimeoutMs;
    }
}
