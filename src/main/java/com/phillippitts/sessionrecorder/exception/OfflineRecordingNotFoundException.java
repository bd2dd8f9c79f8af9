package com.phillippitts.sessionrecorder.exception;

/** Thrown when recovery is requested for a path that has no in-memory recording. */
public class OfflineRecordingNotFoundException extends SessionRecorderException {

    private final String outputPath;

    public OfflineRecordingNotFoundException(String outputPath) {
        super("No in-memory recording for path: " + outputPath);
        this.outputPath = outputPath;
    }

    public String getOutputPath() {
        return outputPath;
    }
}
