package com.phillippitts.sessionrecorder.domain;

/** Why a capture session ended. */
public enum StopReason {

    /** The user asked for the stop (toggle or stop action). */
    MANUAL,

    /**
     * The environment ended capture without a stop request: the input line was closed by the
     * system, the host was hidden, or the maximum capture duration was reached.
     */
    BACKGROUND_HIDDEN,

    /** Capture failed mid-recording; the payload holds whatever was captured before the failure. */
    ERROR
}
