package com.phillippitts.sessionrecorder.service.recorder;

import com.phillippitts.sessionrecorder.domain.LifecycleState;

/**
 * Point-in-time view of recorder state, used in logs and by the REST layer.
 *
 * @param state lifecycle state
 * @param recording whether capture is actively running
 * @param hasSession whether a capture session handle is held
 * @param sessionActive whether the held session reports itself active
 * @param surfaceVisible whether the presentation surface is open
 * @param listeners number of registered state listeners
 * @param pendingLifecycle whether a session has not settled yet
 * @param offlineRecordings number of recordings held in memory
 */
public record RecorderSnapshot(
        LifecycleState state,
        boolean recording,
        boolean hasSession,
        boolean sessionActive,
        boolean surfaceVisible,
        int listeners,
        boolean pendingLifecycle,
        int offlineRecordings
) {}
