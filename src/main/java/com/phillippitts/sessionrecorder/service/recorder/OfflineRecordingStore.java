package com.phillippitts.sessionrecorder.service.recorder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory fallback for recordings whose persistence has not been confirmed.
 *
 * <p>Every completed recording is cached here before persistence is attempted. Entries are only
 * removed by an explicit recovery; nothing survives a restart.
 */
final class OfflineRecordingStore {

    private final Map<String, byte[]> recordings = new LinkedHashMap<>();

    synchronized void put(String outputPath, byte[] payload) {
        Objects.requireNonNull(outputPath, "outputPath must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        recordings.put(outputPath, payload.clone());
    }

    synchronized boolean contains(String outputPath) {
        return outputPath != null && recordings.containsKey(outputPath);
    }

    synchronized Optional<byte[]> get(String outputPath) {
        byte[] payload = recordings.get(outputPath);
        return payload == null ? Optional.empty() : Optional.of(payload.clone());
    }

    synchronized boolean remove(String outputPath) {
        return recordings.remove(outputPath) != null;
    }

    /** Paths in insertion order. */
    synchronized List<String> paths() {
        return new ArrayList<>(recordings.keySet());
    }

    synchronized int size() {
        return recordings.size();
    }
}
