package com.phillippitts.sessionrecorder.testutil;

import com.phillippitts.sessionrecorder.service.capture.CaptureRequest;
import com.phillippitts.sessionrecorder.service.capture.CaptureSession;
import com.phillippitts.sessionrecorder.service.capture.CaptureSessionFactory;
import com.phillippitts.sessionrecorder.service.capture.CaptureSessionListener;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Factory for {@link FakeCaptureSession}s.
 *
 * <p>By default sessions start immediately and complete with MANUAL when stopped, which models
 * the common case. Tests of the start race turn {@code autoStart} off and resolve by hand.
 */
public class FakeCaptureSessionFactory implements CaptureSessionFactory {

    public final List<FakeCaptureSession> sessions = new CopyOnWriteArrayList<>();

    public boolean autoStart = true;
    public boolean completeOnStop = true;
    public RuntimeException createFailure;
    public Throwable startFailure;

    @Override
    public CaptureSession create(CaptureRequest request, CaptureSessionListener listener) {
        if (createFailure != null) {
            throw createFailure;
        }
        String path = request.recordingsDirectory().resolve("recording-" + (sessions.size() + 1) + ".wav").toString();
        FakeCaptureSession session = new FakeCaptureSession(request, listener, path, completeOnStop);
        sessions.add(session);
        if (startFailure != null) {
            session.failStart(startFailure);
        } else if (autoStart) {
            session.resolveStart();
        }
        return session;
    }

    public FakeCaptureSession last() {
        return sessions.isEmpty() ? null : sessions.get(sessions.size() - 1);
    }
}
