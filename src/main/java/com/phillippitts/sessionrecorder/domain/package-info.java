/**
 * Immutable domain types shared by the recorder and its collaborators.
 *
 * <ul>
 *   <li>{@link com.phillippitts.sessionrecorder.domain.LifecycleState} - the recorder's single
 *       source of truth for idle/starting/recording/stopping</li>
 *   <li>{@link com.phillippitts.sessionrecorder.domain.RecordingResult} - payload and metadata of a
 *       finished capture session</li>
 *   <li>{@link com.phillippitts.sessionrecorder.domain.StopReason} - why a capture ended</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.sessionrecorder.domain;
