package com.phillippitts.sessionrecorder.service.transcription;

import com.phillippitts.sessionrecorder.config.properties.TranscriptionProperties;
import com.phillippitts.sessionrecorder.exception.TranscriptionException;
import com.phillippitts.sessionrecorder.service.audio.WavWriter;
import com.phillippitts.sessionrecorder.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.regex.Pattern;

/**
 * Transcribes recordings by running a whisper.cpp-compatible binary on the transcription executor.
 *
 * <p>The payload is written to a temp WAV file, handed to the binary, and deleted afterwards.
 * With post-processing enabled, bracketed markers such as {@code [BLANK_AUDIO]} are dropped and
 * whitespace is collapsed.
 */
@Component
public class ProcessTranscriptionCoordinator implements TranscriptionCoordinator {

    private static final Logger LOG = LogManager.getLogger(ProcessTranscriptionCoordinator.class);

    private static final Pattern MARKER = Pattern.compile("\\[[A-Z_ ]+\\]|\\[\\d{2}:\\d{2}[^\\]]*\\]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final TranscriptionProcessRunner runner;
    private final Executor executor;

    @Autowired
    public ProcessTranscriptionCoordinator(TranscriptionProperties props,
                                           @Qualifier("transcriptionExecutor") Executor executor) {
        this(new TranscriptionProcessRunner(ProcessLauncher.system(), props), executor);
    }

    ProcessTranscriptionCoordinator(TranscriptionProcessRunner runner, Executor executor) {
        this.runner = Objects.requireNonNull(runner);
        this.executor = Objects.requireNonNull(executor);
    }

    @Override
    public CompletableFuture<String> start(byte[] payload, String outputPath, TranscriptionOptions options) {
        Objects.requireNonNull(payload, "payload must not be null");
        TranscriptionOptions opts = options == null ? TranscriptionOptions.defaults() : options;
        byte[] copy = payload.clone();
        String name = LogSanitizer.fileName(outputPath);
        return CompletableFuture.supplyAsync(() -> transcribe(copy, name, opts), executor);
    }

    private String transcribe(byte[] payload, String name, TranscriptionOptions opts) {
        if (!WavWriter.isWav(payload)) {
            throw new TranscriptionException("Recording " + name + " is not a WAV payload");
        }
        Path wav = null;
        try {
            wav = Files.createTempFile("recording-", ".wav");
            WavWriter.write(payload, wav);
            opts.onStatus().accept("Transcribing " + name + "...");
            long start = System.nanoTime();
            String raw = runner.run(wav);
            String text = opts.postProcessing() ? postProcess(raw) : raw.trim();
            if (opts.postProcessing()) {
                opts.onStatus().accept("Post-processing transcript...");
            }
            LOG.info("Transcribed {} in {}ms (chars={})", name, (System.nanoTime() - start) / 1_000_000L,
                    text.length());
            LOG.debug("Preview: '{}'", LogSanitizer.truncate(text, 120));
            return text;
        } catch (IOException | UncheckedIOException e) {
            throw new TranscriptionException("Failed to stage recording " + name, e);
        } finally {
            deleteQuietly(wav);
        }
    }

    static String postProcess(String raw) {
        if (raw == null) {
            return "";
        }
        String stripped = MARKER.matcher(raw).replaceAll(" ");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Failed to delete temp WAV {}: {}", path, e.getMessage());
        }
    }
}
