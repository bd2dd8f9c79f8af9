package com.phillippitts.sessionrecorder.service.capture;

/**
 * Read-only view of a live capture stream handed to the presentation surface.
 */
public interface MediaStream {

    /** Name of the input device, or "default". */
    String deviceName();

    /** Root-mean-square level of the most recent chunk, in the range [0, 1]. */
    double level();
}
