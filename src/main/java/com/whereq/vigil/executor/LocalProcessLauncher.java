package com.whereq.vigil.executor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Launches processes on the local host with {@link ProcessBuilder}.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Component
public class LocalProcessLauncher implements ProcessLauncher {

    @Override
    public Process launch(List<String> command, Path stderrFile) throws IOException {
        log.debug("Executing command: {}", String.join(" ", command));

        ProcessBuilder processBuilder = new ProcessBuilder(command);
        processBuilder.redirectError(ProcessBuilder.Redirect.to(stderrFile.toFile()));
        return processBuilder.start();
    }

    @Override
    public Process launch(List<String> command) throws IOException {
        log.debug("Executing command: {}", String.join(" ", command));

        ProcessBuilder processBuilder = new ProcessBuilder(command);
        processBuilder.redirectErrorStream(true);
        return processBuilder.start();
    }
}
