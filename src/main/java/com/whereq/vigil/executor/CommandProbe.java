package com.whereq.vigil.executor;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs short side-effect-free commands (version query, privilege check) and captures their output.
 * Output is drained on a reader thread so the timeout holds even if the command never closes stdout.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandProbe {

    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    /**
     * How long to wait for the rest of the output once the command has exited
     */
    static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(2);

    private final ProcessLauncher processLauncher;

    private final ExecutorService outputReaders = Executors.newCachedThreadPool(readerThreadFactory());

    /**
     * Exit code and combined output of a finished probe
     */
    public record Result(int exitCode, String output) {
        public boolean succeeded() {
            return exitCode == 0;
        }
    }

    /**
     * Run a probe command
     *
     * @param command program and arguments
     * @return the result, or empty if the command could not run or did not finish in time
     */
    public Optional<Result> run(List<String> command) {
        return run(command, DEFAULT_TIMEOUT);
    }

    public Optional<Result> run(List<String> command, Duration timeout) {
        Process process;
        try {
            process = processLauncher.launch(command);
        } catch (IOException e) {
            log.debug("Probe {} could not start: {}", command.get(0), e.getMessage());
            return Optional.empty();
        }

        Future<String> output = outputReaders.submit(() -> readAll(process));
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Probe {} did not finish within {}, killing it", command.get(0), timeout);
                process.destroyForcibly();
                output.cancel(true);
                return Optional.empty();
            }
            return Optional.of(new Result(process.exitValue(),
                output.get(DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)));

        } catch (ExecutionException e) {
            log.warn("Probe {} output could not be read: {}", command.get(0), e.getCause().getMessage());
            return Optional.empty();
        } catch (TimeoutException e) {
            log.warn("Probe {} exited but kept its output open", command.get(0));
            output.cancel(true);
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            output.cancel(true);
            return Optional.empty();
        }
    }

    @PreDestroy
    public void shutdown() {
        outputReaders.shutdownNow();
    }

    private static String readAll(Process process) throws IOException {
        try (InputStream stdout = process.getInputStream()) {
            return new String(stdout.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static CustomizableThreadFactory readerThreadFactory() {
        CustomizableThreadFactory factory = new CustomizableThreadFactory("vigil-probe-");
        factory.setDaemon(true);
        return factory;
    }
}
