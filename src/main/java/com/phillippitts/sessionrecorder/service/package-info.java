/**
 * Service layer: the recorder and the collaborators it drives (capture, presentation,
 * transcription, storage), plus metrics and error-event logging.
 */
package com.phillippitts.sessionrecorder.service;
