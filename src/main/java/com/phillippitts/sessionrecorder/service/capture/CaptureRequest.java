package com.phillippitts.sessionrecorder.service.capture;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Parameters for one capture session.
 *
 * @param sessionId correlation id, also used in logs
 * @param recordingsDirectory directory the output file is placed in
 * @param preferredDevice optional input device name; {@code null} selects the system default
 */
public record CaptureRequest(UUID sessionId, Path recordingsDirectory, String preferredDevice) {

    public CaptureRequest {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(recordingsDirectory, "recordingsDirectory must not be null");
    }

    public Optional<String> device() {
        return Optional.ofNullable(preferredDevice);
    }
}
