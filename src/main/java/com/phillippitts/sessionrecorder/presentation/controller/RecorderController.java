package com.phillippitts.sessionrecorder.presentation.controller;

import com.phillippitts.sessionrecorder.service.presentation.HeadlessPresentationSurface;
import com.phillippitts.sessionrecorder.service.presentation.PresentationView;
import com.phillippitts.sessionrecorder.service.recorder.RecorderService;
import com.phillippitts.sessionrecorder.service.recorder.RecorderSnapshot;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * HTTP entry points for the recorder: status, toggle, the stop action, and in-memory recovery.
 */
@RestController
@RequestMapping("/recorder")
class RecorderController {

    private static final Logger LOG = LogManager.getLogger(RecorderController.class);

    private final RecorderService recorder;
    private final HeadlessPresentationSurface surface;

    RecorderController(RecorderService recorder, HeadlessPresentationSurface surface) {
        this.recorder = recorder;
        this.surface = surface;
    }

    @GetMapping
    ResponseEntity<RecorderStatus> status() {
        return ResponseEntity.ok(new RecorderStatus(recorder.snapshot(), surface.view()));
    }

    /**
     * Queues a toggle; the response does not wait for it to be processed.
     */
    @PostMapping("/toggle")
    ResponseEntity<Map<String, Object>> toggle() {
        LOG.info("Toggle requested over HTTP");
        recorder.toggleRecording().whenComplete((v, ex) -> {
            if (ex != null) {
                LOG.warn("Toggle request failed: {}", ex.toString());
            }
        });
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("accepted", true));
    }

    @PostMapping("/stop")
    ResponseEntity<Map<String, Object>> stop() {
        boolean triggered = surface.requestStop();
        HttpStatus status = triggered ? HttpStatus.ACCEPTED : HttpStatus.CONFLICT;
        return ResponseEntity.status(status).body(Map.of("stopRequested", triggered));
    }

    @GetMapping("/offline")
    ResponseEntity<List<String>> offline() {
        return ResponseEntity.ok(recorder.offlineRecordingPaths());
    }

    @PostMapping("/offline/recover")
    ResponseEntity<Map<String, Object>> recover(@RequestParam("path") String path) {
        Path written = recorder.recoverOfflineRecording(path);
        return ResponseEntity.ok(Map.of("recovered", path, "writtenTo", written.toString()));
    }

    /**
     * Combined recorder and surface state.
     */
    record RecorderStatus(RecorderSnapshot recorder, PresentationView surface) {}
}
