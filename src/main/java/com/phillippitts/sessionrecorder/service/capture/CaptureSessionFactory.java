package com.phillippitts.sessionrecorder.service.capture;

/**
 * Builds capture sessions. The recorder depends on this seam instead of a concrete session so
 * tests can script start/stop/completion timing.
 */
@FunctionalInterface
public interface CaptureSessionFactory {

    /**
     * @param request what to record and where
     * @param listener receives status, stream and completion callbacks for this session only
     * @return a session that has not been started yet
     */
    CaptureSession create(CaptureRequest request, CaptureSessionListener listener);
}
