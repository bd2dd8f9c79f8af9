package com.phillippitts.sessionrecorder.exception;

/**
 * Thrown when a finished recording cannot be written to durable storage.
 * The payload remains available in the recorder's in-memory fallback.
 */
public class RecordingPersistenceException extends SessionRecorderException {

    private final String outputPath;

    public RecordingPersistenceException(String message, String outputPath) {
        super(message);
        this.outputPath = outputPath;
    }

    public RecordingPersistenceException(String message, String outputPath, Throwable cause) {
        super(message, cause);
        this.outputPath = outputPath;
    }

    public String getOutputPath() {
        return outputPath;
    }
}
