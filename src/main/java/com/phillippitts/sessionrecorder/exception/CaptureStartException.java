package com.phillippitts.sessionrecorder.exception;

/**
 * Thrown when a capture session cannot become active (device unavailable, permission denied,
 * recordings directory missing).
 */
public class CaptureStartException extends SessionRecorderException {

    private final String reason;

    public CaptureStartException(String message) {
        this(message, "CAPTURE_START_FAILED", null);
    }

    public CaptureStartException(String message, String reason, Throwable cause) {
        super(message, cause);
        this.reason = reason == null ? "CAPTURE_START_FAILED" : reason;
    }

    /** Short machine-readable reason, e.g. {@code MIC_UNAVAILABLE}. */
    public String getReason() {
        return reason;
    }
}
