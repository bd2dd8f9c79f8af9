package com.phillippitts.sessionrecorder.service.storage;

import com.phillippitts.sessionrecorder.exception.RecordingPersistenceException;
import com.phillippitts.sessionrecorder.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * Local file-system store. Writes go to a temp file in the target directory first and are moved
 * into place, so a crash mid-write never leaves a truncated recording under the final name.
 */
@Component
public class FileSystemDurableStore implements DurableStore {

    private static final Logger LOG = LogManager.getLogger(FileSystemDurableStore.class);

    @Override
    public void ensureDirectory(Path directory) {
        Objects.requireNonNull(directory, "directory must not be null");
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new RecordingPersistenceException(
                    "Failed to create recordings directory: " + directory, directory.toString(), e);
        }
    }

    @Override
    public Path persist(String outputPath, byte[] payload) {
        Objects.requireNonNull(outputPath, "outputPath must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        Path target = Path.of(outputPath).toAbsolutePath();
        Path dir = target.getParent();
        ensureDirectory(dir);

        Path tmp = null;
        try {
            tmp = Files.createTempFile(dir, ".recording-", ".part");
            Files.write(tmp, payload);
            move(tmp, target);
            LOG.info("Persisted recording {} ({} bytes)", LogSanitizer.fileName(outputPath), payload.length);
            return target;
        } catch (IOException e) {
            deleteTemp(tmp);
            throw new RecordingPersistenceException(
                    "Failed to persist recording " + LogSanitizer.fileName(outputPath) + ": " + e.getMessage(),
                    outputPath, e);
        }
    }

    private static void move(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move not supported for {}, falling back to plain move", target.getFileName());
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteTemp(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOG.warn("Failed to delete temp file {}: {}", tmp, e.getMessage());
        }
    }
}
