/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.sessionrecorder.exception.SessionRecorderException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.sessionrecorder.exception.CaptureStartException} - Thrown when a
 *       capture session cannot become active</li>
 *   <li>{@link com.phillippitts.sessionrecorder.exception.RecordingPersistenceException} - Thrown when
 *       a finished recording cannot be written to durable storage</li>
 *   <li>{@link com.phillippitts.sessionrecorder.exception.TranscriptionException} - Thrown when a
 *       recording cannot be transcribed</li>
 *   <li>{@link com.phillippitts.sessionrecorder.exception.OfflineRecordingNotFoundException} - Thrown
 *       when recovery targets a path with no in-memory copy</li>
 * </ul>
 *
 * <p>All exceptions are unchecked, support chaining via {@code cause}, and map to HTTP status codes
 * via {@code GlobalExceptionHandler} when they reach the REST boundary. Inside the recorder they are
 * converted to status messages and never propagate to the caller of a toggle.
 *
 * @see com.phillippitts.sessionrecorder.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.sessionrecorder.exception;
