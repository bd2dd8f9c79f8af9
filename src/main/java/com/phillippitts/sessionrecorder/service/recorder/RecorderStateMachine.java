package com.phillippitts.sessionrecorder.service.recorder;

import com.phillippitts.sessionrecorder.domain.LifecycleState;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lifecycle state of the recorder plus the stop-intent flag for the stop-while-starting race.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * IDLE      → STARTING  (beginStart)
 * STARTING  → STOPPING  (requestStopDuringStart, records stop intent)
 * STARTING  → RECORDING (markRecording)
 * STOPPING  → RECORDING (markRecording, only while a stop intent is pending)
 * RECORDING → STOPPING  (beginStop)
 * any       → IDLE      (reset, clears stop intent)
 * </pre>
 *
 * <p>Transitions are only driven from the recorder loop. The lock exists so that observers on
 * other threads (REST, metrics) read state and intent consistently.
 */
final class RecorderStateMachine {

    private final Lock lock = new ReentrantLock();
    private LifecycleState state = LifecycleState.IDLE;
    private boolean stopIntent;

    /**
     * @return {@code true} if the recorder moved from IDLE to STARTING
     */
    boolean beginStart() {
        lock.lock();
        try {
            if (state != LifecycleState.IDLE) {
                return false;
            }
            state = LifecycleState.STARTING;
            stopIntent = false;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records that the user asked to stop before start resolved.
     *
     * @return {@code true} if the intent was recorded (state was STARTING)
     */
    boolean requestStopDuringStart() {
        lock.lock();
        try {
            if (state != LifecycleState.STARTING) {
                return false;
            }
            stopIntent = true;
            state = LifecycleState.STOPPING;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Start resolved. Returns and clears the stop intent; the caller must issue the stop when it was set.
     *
     * @return {@code true} if a stop was requested while starting
     * @throws IllegalStateException if no start is in progress
     */
    boolean markRecording() {
        lock.lock();
        try {
            if (state != LifecycleState.STARTING && !(state == LifecycleState.STOPPING && stopIntent)) {
                throw new IllegalStateException("Cannot mark recording from " + state);
            }
            boolean pendingStop = stopIntent;
            stopIntent = false;
            state = LifecycleState.RECORDING;
            return pendingStop;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return {@code true} if the recorder moved from RECORDING to STOPPING
     */
    boolean beginStop() {
        lock.lock();
        try {
            if (state != LifecycleState.RECORDING) {
                return false;
            }
            state = LifecycleState.STOPPING;
            return true;
        } finally {
            lock.unlock();
        }
    }

    void reset() {
        lock.lock();
        try {
            state = LifecycleState.IDLE;
            stopIntent = false;
        } finally {
            lock.unlock();
        }
    }

    LifecycleState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    boolean isStopIntentPending() {
        lock.lock();
        try {
            return stopIntent;
        } finally {
            lock.unlock();
        }
    }
}
