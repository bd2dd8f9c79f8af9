package com.phillippitts.sessionrecorder.exception;

/**
 * Thrown when a recording cannot be transcribed.
 * This may occur due to a missing binary, a timeout, or a non-zero process exit.
 */
public class TranscriptionException extends SessionRecorderException {

    private final int exitCode;

    public TranscriptionException(String message) {
        this(message, -1, null);
    }

    public TranscriptionException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public TranscriptionException(String message, int exitCode, Throwable cause) {
        super(message, cause);
        this.exitCode = exitCode;
    }

    /** Process exit code, or -1 when the process never exited normally. */
    public int getExitCode() {
        return exitCode;
    }
}
