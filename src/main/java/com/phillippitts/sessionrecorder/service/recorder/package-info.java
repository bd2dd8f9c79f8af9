/**
 * The recording session orchestrator.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.sessionrecorder.service.recorder.RecorderService} - process-wide
 *       recorder: toggle queue, lifecycle, completion and error handling, listener fan-out</li>
 *   <li>{@link com.phillippitts.sessionrecorder.service.recorder.RecorderDependencies} - collaborators
 *       the recorder is created with</li>
 * </ul>
 *
 * <p>Design Patterns:
 * <ul>
 *   <li><b>Single-threaded loop:</b> all state is mutated on one executor thread, so the recorder
 *       itself needs no locks beyond those protecting read-only observers</li>
 *   <li><b>Event-Driven:</b> state changes, completions and errors are also published through
 *       Spring's ApplicationEventPublisher</li>
 *   <li><b>Fail-Safe:</b> every recording is kept in memory before persistence is attempted</li>
 * </ul>
 */
package com.phillippitts.sessionrecorder.service.recorder;
