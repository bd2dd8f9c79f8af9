package com.phillippitts.sessionrecorder.service.transcription;

import com.phillippitts.sessionrecorder.config.properties.TranscriptionProperties;
import com.phillippitts.sessionrecorder.exception.TranscriptionException;
import com.phillippitts.sessionrecorder.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs the external transcription binary for one WAV file.
 *
 * <p>Responsibilities:
 * - Build a deterministic CLI from {@link TranscriptionProperties}
 * - Capture stdout (transcript) and stderr (diagnostics) concurrently
 * - Enforce a timeout and terminate runaway processes
 *
 * <p>All state lives on the stack of {@link #run(Path)}, so one runner serves concurrent calls.
 */
final class TranscriptionProcessRunner {

    private static final Logger LOG = LogManager.getLogger(TranscriptionProcessRunner.class);

    static final int STDERR_MAX_BYTES = 64 * 1024;
    static final int ERROR_SNIPPET_MAX_CHARS = 500;

    private final ProcessLauncher launcher;
    private final TranscriptionProperties cfg;

    /**
     * Holds process execution state including process reference and stream gobblers.
     */
    private record ProcessExecution(
            Process process,
            Thread outGobbler,
            Thread errGobbler,
            StringBuilder stdout,
            StringBuilder stderr
    ) {}

    TranscriptionProcessRunner(ProcessLauncher launcher, TranscriptionProperties cfg) {
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
    }

    /**
     * Executes the binary for the given WAV file and returns its stdout.
     *
     * <p>CLI contract:
     *   <pre>
     *   ${binary} -m ${model} -f ${wav} -l ${language} -otxt -of stdout -t ${threads}
     *   </pre>
     *
     * @throws TranscriptionException on timeout, non-zero exit, or I/O error
     */
    String run(Path wavPath) {
        Objects.requireNonNull(wavPath, "wavPath");
        List<String> command = buildCommand(wavPath);
        ProcessExecution exec = null;
        try {
            exec = startProcessWithGobblers(command, wavPath);
            boolean finished = exec.process().waitFor(cfg.timeoutSeconds(), TimeUnit.SECONDS);
            if (!finished) {
                throw error("Timeout after " + cfg.timeoutSeconds() + "s", -1, exec.stderr(), null);
            }
            joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);

            int exitCode = exec.process().exitValue();
            if (exitCode != 0) {
                throw error("Non-zero exit: " + exitCode, exitCode, exec.stderr(), null);
            }
            String output = exec.stdout().toString();
            LOG.debug("Transcription stdout size={} chars", output.length());
            return output;
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw error("I/O failure: " + e.getMessage(), -1, null, e);
        } finally {
            if (exec != null && exec.process().isAlive()) {
                destroyProcess(exec.process());
            }
        }
    }

    List<String> buildCommand(Path wavPath) {
        List<String> cmd = new ArrayList<>();
        cmd.add(resolvePath(cfg.binaryPath()).toString());
        cmd.add("-m");
        cmd.add(resolvePath(cfg.modelPath()).toString());
        cmd.add("-f");
        cmd.add(wavPath.toAbsolutePath().toString());
        cmd.add("-l");
        cmd.add(cfg.language());
        cmd.add("-otxt");
        cmd.add("-of");
        cmd.add("stdout");
        cmd.add("-t");
        cmd.add(String.valueOf(cfg.threads()));
        return cmd;
    }

    private ProcessExecution startProcessWithGobblers(List<String> command, Path wavPath) throws IOException {
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Process process = launcher.launch(command, wavPath.toAbsolutePath().getParent());

        // Start gobblers before waiting to avoid deadlock
        Thread out = startGobbler(process.getInputStream(), stdout, "transcription-out", cfg.maxStdoutBytes());
        Thread err = startGobbler(process.getErrorStream(), stderr, "transcription-err", STDERR_MAX_BYTES);
        return new ProcessExecution(process, out, err, stdout, stderr);
    }

    private static Path resolvePath(String pathString) {
        Path path = Path.of(pathString);
        if (path.isAbsolute()) {
            return path;
        }
        return Path.of(".").toAbsolutePath().normalize().resolve(path).normalize();
    }

    private static Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
        Thread thread = new Thread(new StreamGobbler(inputStream, sink, name, maxBytes), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines into a StringBuilder until capacity is reached, then keeps draining the
     * stream without accumulating so the child process never blocks on a full pipe.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxBytes;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxBytes = maxBytes;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() >= maxBytes) {
                            if (!capReached) {
                                LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                                capReached = true;
                            }
                            continue;
                        }
                        if (!sink.isEmpty()) {
                            sink.append('\n');
                        }
                        int available = maxBytes - sink.length();
                        sink.append(line, 0, Math.min(line.length(), Math.max(0, available)));
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying process");
        }
    }

    private TranscriptionException error(String msg, int exitCode, StringBuilder stderr, Throwable cause) {
        String snippet = "";
        if (stderr != null) {
            synchronized (stderr) {
                snippet = stderr.substring(0, Math.min(ERROR_SNIPPET_MAX_CHARS, stderr.length()));
            }
        }
        if (!snippet.isBlank()) {
            LOG.warn("Transcription process failed: {} (stderr: {})", msg, snippet);
        }
        return new TranscriptionException(msg, exitCode, cause);
    }
}
