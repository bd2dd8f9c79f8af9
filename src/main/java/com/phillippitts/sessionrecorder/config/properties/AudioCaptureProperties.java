package com.phillippitts.sessionrecorder.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for microphone capture.
 *
 * Format is fixed (16 kHz, 16-bit PCM, mono, little-endian); only buffering is tunable.
 */
@Validated
@ConfigurationProperties(prefix = "audio.capture")
public class AudioCaptureProperties {

    /** Size of a read chunk from the TargetDataLine in milliseconds. */
    @Min(10)
    @Max(200)
    private final int chunkMillis;

    /** Maximum capture duration in milliseconds; reaching it ends the session as a forced stop. */
    @Min(100)
    @Max(14_400_000)
    private final int maxDurationMs;

    @ConstructorBinding
    public AudioCaptureProperties(Integer chunkMillis, Integer maxDurationMs) {
        this.chunkMillis = chunkMillis == null ? 40 : chunkMillis;
        this.maxDurationMs = maxDurationMs == null ? 3_600_000 : maxDurationMs;
    }

    public int getChunkMillis() { return chunkMillis; }
    public int getMaxDurationMs() { return maxDurationMs; }
}
