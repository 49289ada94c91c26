package com.whereq.vigil.executor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Starts external processes for the scan engine and the tool probes
 */
public interface ProcessLauncher {
    /**
     * Start a process whose standard error is written to {@code stderrFile}
     *
     * @param command program and arguments, no shell interpretation
     * @param stderrFile file receiving standard error
     * @return the started process
     * @throws IOException if the program cannot be started
     */
    Process launch(List<String> command, Path stderrFile) throws IOException;

    /**
     * Start a process with standard error merged into standard output
     *
     * @param command program and arguments, no shell interpretation
     * @return the started process
     * @throws IOException if the program cannot be started
     */
    Process launch(List<String> command) throws IOException;
}
