/**
 * Transcription coordinator contract and the process-backed implementation.
 *
 * <p>The recorder hands over a copy of the payload and reacts to the returned future; a failed
 * transcription never affects recorder lifecycle state.
 */
package com.phillippitts.sessionrecorder.service.transcription;
