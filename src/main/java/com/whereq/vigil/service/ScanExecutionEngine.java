package com.whereq.vigil.service;

import com.whereq.vigil.config.VigilProperties;
import com.whereq.vigil.exception.InvalidTargetException;
import com.whereq.vigil.executor.ProcessLauncher;
import com.whereq.vigil.executor.ScannerBinaryLocator;
import com.whereq.vigil.model.ScanEvent;
import com.whereq.vigil.model.ScanEventListener;
import com.whereq.vigil.model.ScanJob;
import com.whereq.vigil.model.ScanJobSnapshot;
import com.whereq.vigil.model.ScanStatus;
import com.whereq.vigil.model.report.ScanResult;
import com.whereq.vigil.parser.NmapReportParser;
import com.whereq.vigil.validation.ArgumentSanitizer;
import com.whereq.vigil.validation.TargetValidator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs nmap scan jobs on a bounded worker pool.
 * <p>
 * Submissions return immediately; at most {@code vigil.scanner.max-concurrent-scans}
 * jobs execute at once and the rest wait in the pool queue until a worker frees.
 * The job registry is guarded by a single lock and only copies leave it.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class ScanExecutionEngine {

    static final Pattern PROGRESS_PATTERN = Pattern.compile("About (\\d+\\.\\d+)% done");

    static final String PERMISSION_MESSAGE =
        "This scan type requires administrator privileges. Please run the application as administrator.";

    private static final List<String> PRIVILEGE_DIAGNOSTICS =
        List.of("requires root privileges", "requires privileged access");

    private static final List<String> PRIVILEGED_FLAGS = List.of("-O", "--osscan-guess", "-sS", "-A");

    private final VigilProperties.ScannerConfig config;
    private final ProcessLauncher processLauncher;
    private final ScannerBinaryLocator binaryLocator;
    private final NmapReportParser reportParser;
    private final Clock clock;

    private final Map<String, ScanJob> jobs = new LinkedHashMap<>();
    private final ReentrantLock registryLock = new ReentrantLock();

    private final ExecutorService workers;
    private final ScheduledExecutorService terminator;

    private final Counter completedCounter;
    private final Counter failedCounter;
    private final Counter cancelledCounter;
    private final Counter permissionDeniedCounter;
    private final Timer executionTimer;

    public ScanExecutionEngine(VigilProperties properties,
                               ProcessLauncher processLauncher,
                               ScannerBinaryLocator binaryLocator,
                               NmapReportParser reportParser,
                               Clock clock,
                               MeterRegistry meterRegistry) {
        this.config = properties.getScanner();
        this.processLauncher = processLauncher;
        this.binaryLocator = binaryLocator;
        this.reportParser = reportParser;
        this.clock = clock;

        int maxConcurrent = Math.max(1, config.getMaxConcurrentScans());

        CustomizableThreadFactory workerFactory = new CustomizableThreadFactory("vigil-scan-");
        workerFactory.setDaemon(true);
        this.workers = Executors.newFixedThreadPool(maxConcurrent, workerFactory);

        CustomizableThreadFactory terminatorFactory = new CustomizableThreadFactory("vigil-scan-kill-");
        terminatorFactory.setDaemon(true);
        this.terminator = Executors.newSingleThreadScheduledExecutor(terminatorFactory);

        // Register metrics
        completedCounter = Counter.builder("vigil.scans.completed")
            .description("Number of scans that completed successfully")
            .register(meterRegistry);

        failedCounter = Counter.builder("vigil.scans.failed")
            .description("Number of scans that failed")
            .register(meterRegistry);

        cancelledCounter = Counter.builder("vigil.scans.cancelled")
            .description("Number of scans cancelled by an operator")
            .register(meterRegistry);

        permissionDeniedCounter = Counter.builder("vigil.scans.permission_denied")
            .description("Number of scans refused for lack of privileges")
            .register(meterRegistry);

        executionTimer = Timer.builder("vigil.scans.execution.time")
            .description("Scan execution time")
            .register(meterRegistry);

        Gauge.builder("vigil.scans.active", this::activeCount)
            .description("Number of scans holding a worker slot")
            .register(meterRegistry);

        Gauge.builder("vigil.scans.queued", this::queuedCount)
            .description("Number of scans waiting for a worker slot")
            .register(meterRegistry);

        log.info("ScanExecutionEngine initialized: max concurrent scans={}", maxConcurrent);
    }

    /**
     * Submit a scan for asynchronous execution
     *
     * @param target scan target, validated before anything is allocated
     * @param arguments free-form nmap options, sanitized
     * @param listener receives progress and exactly one terminal event; may be null
     * @return job identifier
     * @throws InvalidTargetException if the target is not acceptable
     */
    public String submit(String target, String arguments, ScanEventListener listener) {
        if (!TargetValidator.isValid(target)) {
            throw new InvalidTargetException(target);
        }

        String safeArguments = ArgumentSanitizer.sanitize(arguments == null ? "" : arguments);
        ScanEventListener sink = listener != null ? listener : ScanEventListener.NONE;
        String jobId = UUID.randomUUID().toString();

        ScanJob job = ScanJob.builder()
            .jobId(jobId)
            .target(target)
            .arguments(safeArguments)
            .createdAt(clock.instant())
            .status(ScanStatus.RUNNING)
            .progress(0)
            .needsAdmin(needsAdminPrivileges(safeArguments))
            .build();

        registryLock.lock();
        try {
            jobs.put(jobId, job);
        } finally {
            registryLock.unlock();
        }

        try {
            workers.execute(() -> runJob(jobId, target, safeArguments, sink));
        } catch (RejectedExecutionException e) {
            registryLock.lock();
            try {
                jobs.remove(jobId);
            } finally {
                registryLock.unlock();
            }
            throw new IllegalStateException("Scan engine is shut down, cannot accept scan for " + target, e);
        }

        log.info("Scan {} submitted: target={}, arguments='{}'", jobId, target, safeArguments);
        return jobId;
    }

    /**
     * Get a copy of a job record
     *
     * @param jobId job identifier
     * @return snapshot, or empty if the job is unknown
     */
    public Optional<ScanJobSnapshot> status(String jobId) {
        registryLock.lock();
        try {
            ScanJob job = jobs.get(jobId);
            return job == null ? Optional.empty() : Optional.of(job.snapshot());
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * @return true while the job is still held in the registry
     */
    public boolean isRegistered(String jobId) {
        registryLock.lock();
        try {
            return jobs.containsKey(jobId);
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * Snapshot of every registered job, in submission order
     */
    public Map<String, ScanJobSnapshot> allStatuses() {
        registryLock.lock();
        try {
            Map<String, ScanJobSnapshot> copy = new LinkedHashMap<>();
            jobs.forEach((id, job) -> copy.put(id, job.snapshot()));
            return Collections.unmodifiableMap(copy);
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * Cancel a running job.
     * The process is asked to terminate and is killed if it outlives the grace period.
     * A job still waiting for a worker slot is cancelled without ever being launched.
     *
     * @param jobId job identifier
     * @return true if the cancellation was accepted
     */
    public boolean cancel(String jobId) {
        Process process;

        registryLock.lock();
        try {
            ScanJob job = jobs.get(jobId);
            if (job == null || job.getStatus() != ScanStatus.RUNNING) {
                return false;
            }
            job.setStatus(ScanStatus.CANCELLED);
            job.setErrorMessage("Scan cancelled");
            process = job.getProcess();
        } finally {
            registryLock.unlock();
        }

        if (process != null) {
            requestTermination(jobId, process);
        }

        cancelledCounter.increment();
        log.info("Scan {} cancelled", jobId);
        return true;
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down scan engine");

        List<Process> running = new ArrayList<>();
        registryLock.lock();
        try {
            for (ScanJob job : jobs.values()) {
                if (job.getStatus() == ScanStatus.RUNNING && job.getProcess() != null) {
                    running.add(job.getProcess());
                }
            }
        } finally {
            registryLock.unlock();
        }

        running.forEach(Process::destroy);
        workers.shutdownNow();
        terminator.shutdownNow();
    }

    static boolean needsAdminPrivileges(String arguments) {
        return PRIVILEGED_FLAGS.stream().anyMatch(arguments::contains);
    }

    /**
     * Extract the percent-complete figure from an output line
     */
    static Optional<Double> parseProgress(String line) {
        if (line == null) {
            return Optional.empty();
        }
        Matcher matcher = PROGRESS_PATTERN.matcher(line);
        return matcher.find() ? Optional.of(Double.parseDouble(matcher.group(1))) : Optional.empty();
    }

    /**
     * Worker body; runs once a pool thread is free
     */
    private void runJob(String jobId, String target, String arguments, ScanEventListener listener) {
        Timer.Sample sample = Timer.start();
        Path reportFile = null;
        Path stderrFile = null;
        ScanEvent terminal;

        try {
            if (!markStarted(jobId)) {
                log.info("Scan {} was cancelled before it started", jobId);
                terminal = new ScanEvent.Cancelled("Scan cancelled before it started");
            } else {
                reportFile = createTempFile(".xml");
                stderrFile = createTempFile(".err");

                List<String> command = buildCommand(arguments, reportFile, target);
                log.info("Starting scan {}: {}", jobId, String.join(" ", command));

                Process process = processLauncher.launch(command, stderrFile);
                if (attachProcess(jobId, process)) {
                    // cancelled between slot grant and launch
                    requestTermination(jobId, process);
                }

                monitorProgress(jobId, process, listener);

                int returnCode = process.waitFor();
                String diagnostics = readQuietly(stderrFile);
                terminal = finish(jobId, returnCode, diagnostics, reportFile);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Scan {} interrupted", jobId);
            terminal = markFailed(jobId, "Scan was interrupted before it finished");
        } catch (Exception e) {
            log.error("Scan {} could not be executed", jobId, e);
            terminal = markFailed(jobId, "Scan could not be executed: " + e.getMessage());
        } finally {
            deleteQuietly(reportFile);
            deleteQuietly(stderrFile);
            sample.stop(executionTimer);
        }

        countOutcome(terminal);
        evictFinishedJobs(jobId);
        publish(listener, jobId, terminal);
    }

    /**
     * Drop the oldest finished jobs beyond {@code vigil.scanner.retained-jobs}
     */
    private void evictFinishedJobs(String justFinished) {
        int limit = Math.max(1, config.getRetainedJobs());

        registryLock.lock();
        try {
            long finished = jobs.values().stream().filter(job -> job.getEndedAt() != null).count();
            Iterator<Map.Entry<String, ScanJob>> entries = jobs.entrySet().iterator();
            while (finished > limit && entries.hasNext()) {
                Map.Entry<String, ScanJob> entry = entries.next();
                if (entry.getValue().getEndedAt() != null && !entry.getKey().equals(justFinished)) {
                    entries.remove();
                    finished--;
                    log.debug("Scan {} evicted from the job registry", entry.getKey());
                }
            }
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * @return false if the job was cancelled while it waited for a slot
     */
    private boolean markStarted(String jobId) {
        registryLock.lock();
        try {
            ScanJob job = jobs.get(jobId);
            if (job == null || job.getStatus() != ScanStatus.RUNNING) {
                if (job != null) {
                    job.setEndedAt(clock.instant());
                    job.setProgress(ScanEvent.FAILURE);
                }
                return false;
            }
            job.setStartedAt(clock.instant());
            return true;
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * @return true if the job was cancelled before the process handle was attached
     */
    private boolean attachProcess(String jobId, Process process) {
        registryLock.lock();
        try {
            ScanJob job = jobs.get(jobId);
            job.setProcess(process);
            return job.getStatus() == ScanStatus.CANCELLED;
        } finally {
            registryLock.unlock();
        }
    }

    private void monitorProgress(String jobId, Process process, ScanEventListener listener) throws IOException {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.trace("Scan {} output: {}", jobId, line);

                Optional<Double> progress = parseProgress(line);
                if (progress.isEmpty()) {
                    continue;
                }

                double percent = Math.max(0.0, Math.min(100.0, progress.get()));
                boolean running;
                registryLock.lock();
                try {
                    ScanJob job = jobs.get(jobId);
                    running = job.getStatus() == ScanStatus.RUNNING;
                    if (running) {
                        job.setProgress(percent);
                    }
                } finally {
                    registryLock.unlock();
                }

                if (running) {
                    log.debug("Scan {} progress: {}%", jobId, percent);
                    publish(listener, jobId, new ScanEvent.Progress(percent));
                }
            }
        }
    }

    /**
     * Classify the exit and record the outcome
     */
    private ScanEvent finish(String jobId, int returnCode, String diagnostics, Path reportFile) {
        String output = null;
        String readError = null;
        try {
            output = Files.readString(reportFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            readError = "Error reading scan results: " + e.getMessage();
        }

        ScanResult result = null;
        ScanStatus status;
        String errorMessage = null;
        ScanEvent event;

        if (returnCode != 0) {
            if (isPrivilegeFailure(diagnostics)) {
                status = ScanStatus.PERMISSION_DENIED;
                errorMessage = PERMISSION_MESSAGE;
                event = new ScanEvent.PermissionDenied(errorMessage);
            } else {
                status = ScanStatus.FAILED;
                errorMessage = "Scan failed with error code " + returnCode + ": " + diagnostics.trim();
                event = new ScanEvent.Failed(errorMessage);
            }
        } else if (readError != null) {
            status = ScanStatus.FAILED;
            errorMessage = readError;
            event = new ScanEvent.Failed(errorMessage);
        } else {
            result = reportParser.parse(output);
            if (result.hasError()) {
                status = ScanStatus.FAILED;
                errorMessage = "Error parsing scan results: " + result.getError();
                event = new ScanEvent.Failed(errorMessage);
            } else {
                status = ScanStatus.COMPLETED;
                event = new ScanEvent.Completed(result);
            }
        }

        registryLock.lock();
        try {
            ScanJob job = jobs.get(jobId);
            job.setEndedAt(clock.instant());
            job.setReturnCode(returnCode);

            if (job.getStatus() == ScanStatus.CANCELLED) {
                // report of a cancelled scan is never used
                job.setProgress(ScanEvent.FAILURE);
                return new ScanEvent.Cancelled(job.getErrorMessage());
            }

            // raw report only kept when there is no typed result to show for it
            job.setOutput(status == ScanStatus.COMPLETED ? null : output);
            job.setStatus(status);
            job.setResult(result);
            job.setErrorMessage(errorMessage);
            job.setProgress(event.progress());
        } finally {
            registryLock.unlock();
        }

        log.info("Scan {} finished: status={}, returnCode={}", jobId, status.getValue(), returnCode);
        if (errorMessage != null) {
            log.warn("Scan {} error: {}", jobId, errorMessage);
        }
        return event;
    }

    private ScanEvent markFailed(String jobId, String message) {
        registryLock.lock();
        try {
            ScanJob job = jobs.get(jobId);
            job.setEndedAt(clock.instant());
            job.setProgress(ScanEvent.FAILURE);
            if (job.getStatus() == ScanStatus.CANCELLED) {
                return new ScanEvent.Cancelled(job.getErrorMessage());
            }
            job.setStatus(ScanStatus.FAILED);
            job.setErrorMessage(message);
            return new ScanEvent.Failed(message);
        } finally {
            registryLock.unlock();
        }
    }

    private void requestTermination(String jobId, Process process) {
        process.destroy();

        Duration grace = config.getCancelGracePeriod();
        long graceMillis = grace == null ? 0 : Math.max(0, grace.toMillis());
        try {
            terminator.schedule(() -> {
                if (process.isAlive()) {
                    log.warn("Scan {} ignored termination request for {}ms, killing it", jobId, graceMillis);
                    process.destroyForcibly();
                }
            }, graceMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Scan {} termination escalation unavailable during shutdown, killing now", jobId);
            process.destroyForcibly();
        }
    }

    private List<String> buildCommand(String arguments, Path reportFile, String target) {
        List<String> command = new ArrayList<>();
        command.add(binaryLocator.locate());
        command.addAll(ArgumentSanitizer.tokenize(arguments));

        String statsEvery = config.getStatsEvery();
        if (statsEvery != null && !statsEvery.isBlank()) {
            command.add("--stats-every");
            command.add(statsEvery);
        }

        command.add("-oX");
        command.add(reportFile.toAbsolutePath().toString());
        command.add(target);
        return command;
    }

    private Path createTempFile(String suffix) throws IOException {
        String dir = config.getTempDir();
        if (dir == null || dir.isBlank()) {
            return Files.createTempFile("vigil-scan-", suffix);
        }
        Path directory = Path.of(dir);
        Files.createDirectories(directory);
        return Files.createTempFile(directory, "vigil-scan-", suffix);
    }

    private static boolean isPrivilegeFailure(String diagnostics) {
        return PRIVILEGE_DIAGNOSTICS.stream().anyMatch(diagnostics::contains);
    }

    private static String readQuietly(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Could not read scanner diagnostics from {}: {}", file, e.getMessage());
            return "";
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete temporary file {}: {}", file, e.getMessage());
        }
    }

    private void countOutcome(ScanEvent terminal) {
        if (terminal instanceof ScanEvent.Completed) {
            completedCounter.increment();
        } else if (terminal instanceof ScanEvent.PermissionDenied) {
            permissionDeniedCounter.increment();
        } else if (terminal instanceof ScanEvent.Failed) {
            failedCounter.increment();
        }
    }

    private static void publish(ScanEventListener listener, String jobId, ScanEvent event) {
        try {
            listener.onEvent(jobId, event);
        } catch (RuntimeException e) {
            log.warn("Scan listener failed for job {} on {}", jobId, event.getClass().getSimpleName(), e);
        }
    }

    private int activeCount() {
        registryLock.lock();
        try {
            return (int) jobs.values().stream()
                .filter(job -> job.getStatus() == ScanStatus.RUNNING && job.getStartedAt() != null)
                .count();
        } finally {
            registryLock.unlock();
        }
    }

    private int queuedCount() {
        registryLock.lock();
        try {
            return (int) jobs.values().stream()
                .filter(job -> job.getStatus() == ScanStatus.RUNNING && job.getStartedAt() == null)
                .count();
        } finally {
            registryLock.unlock();
        }
    }
}
