package com.phillippitts.sessionrecorder.service.transcription;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Launches the external transcription command. Tests substitute a launcher that hands back
 * a scripted {@link Process}.
 */
@FunctionalInterface
interface ProcessLauncher {

    /**
     * @param command executable followed by its arguments
     * @param recordingDir directory holding the staged recording; used as the working directory
     *                     when non-null
     */
    Process launch(List<String> command, Path recordingDir) throws IOException;

    /** Launcher backed by {@link ProcessBuilder}; stdout and stderr stay separate. */
    static ProcessLauncher system() {
        return (command, recordingDir) -> {
            ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(false);
            if (recordingDir != null) {
                builder.directory(recordingDir.toFile());
            }
            return builder.start();
        };
    }
}
