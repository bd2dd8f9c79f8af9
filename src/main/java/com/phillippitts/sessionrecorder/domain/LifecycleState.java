package com.phillippitts.sessionrecorder.domain;

/**
 * Lifecycle of the single recording session owned by the recorder.
 *
 * <pre>
 * IDLE → STARTING (toggle)
 * STARTING → RECORDING (capture start resolved)
 * STARTING → STOPPING (stop requested before start resolved)
 * RECORDING → STOPPING (toggle or stop action)
 * any → IDLE (session completion, error, unload)
 * </pre>
 *
 * <p>Only the recorder performs transitions; collaborators never write this value.
 */
public enum LifecycleState {
    IDLE,
    STARTING,
    RECORDING,
    STOPPING
}
