package com.phillippitts.sessionrecorder.service.recorder;

/**
 * Subscriber notified on every recording-state change.
 */
@FunctionalInterface
public interface RecordingStateListener {

    /**
     * @param recording true while capture is actively running
     */
    void onRecordingStateChanged(boolean recording);
}
