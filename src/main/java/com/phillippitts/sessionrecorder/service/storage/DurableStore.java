package com.phillippitts.sessionrecorder.service.storage;

import java.nio.file.Path;

/**
 * Persists finished recordings and owns the directory layout they are written into.
 */
public interface DurableStore {

    /**
     * Creates {@code directory} (and parents) if it does not exist yet.
     *
     * @throws com.phillippitts.sessionrecorder.exception.RecordingPersistenceException if it cannot be created
     */
    void ensureDirectory(Path directory);

    /**
     * Writes {@code payload} to {@code outputPath}, replacing any previous content.
     *
     * @return the path actually written
     * @throws com.phillippitts.sessionrecorder.exception.RecordingPersistenceException on I/O failure
     */
    Path persist(String outputPath, byte[] payload);
}
