package com.phillippitts.sessionrecorder.exception;

/**
 * Base exception for all session-recorder errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class SessionRecorderException extends RuntimeException {

    public SessionRecorderException(String message) {
        super(message);
    }

    public SessionRecorderException(String message, Throwable cause) {
        super(message, cause);
    }

    public SessionRecorderException(Throwable cause) {
        super(cause);
    }
}
