package com.whereq.vigil.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.vigil.config.VigilProperties;
import com.whereq.vigil.dto.ScheduleRequest;
import com.whereq.vigil.exception.InvalidTargetException;
import com.whereq.vigil.exception.ScanValidationException;
import com.whereq.vigil.exception.ScheduleNotFoundException;
import com.whereq.vigil.exception.ScheduleStateException;
import com.whereq.vigil.model.SaveOutcome;
import com.whereq.vigil.model.ScanEvent;
import com.whereq.vigil.model.ScheduleStatus;
import com.whereq.vigil.model.ScheduleType;
import com.whereq.vigil.model.ScheduledScan;
import com.whereq.vigil.repository.ScheduledScanRepository;
import com.whereq.vigil.validation.TargetValidator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Background trigger loop for scheduled scans.
 * <p>
 * One dedicated thread wakes every {@code vigil.scheduler.check-interval}, starts the scans
 * that are due through {@link ScanService} and reconciles their outcome into the schedule
 * record. {@code nextRun} is advanced when a scan is triggered, not when it finishes.
 * <p>
 * Schedule records and the schedule-to-job map are only modified under {@code lock};
 * the lock is never held while calling into the scan service.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class ScheduleEvaluator {

    static final String WEBHOOK_KEY = "webhook";

    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(5);

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final ScheduledScanRepository repository;
    private final ScanService scanService;
    private final WebhookNotifier webhookNotifier;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final VigilProperties.SchedulerConfig config;

    private final Map<Long, String> activeScans = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    private final Object lifecycleMonitor = new Object();
    private final CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("vigil-scheduler-");
    private volatile boolean running;
    private Thread loopThread;

    private final Counter triggeredCounter;
    private final Counter errorCounter;

    public ScheduleEvaluator(ScheduledScanRepository repository,
                             ScanService scanService,
                             WebhookNotifier webhookNotifier,
                             ObjectMapper objectMapper,
                             Clock clock,
                             VigilProperties properties,
                             MeterRegistry meterRegistry) {
        this.repository = repository;
        this.scanService = scanService;
        this.webhookNotifier = webhookNotifier;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.config = properties.getScheduler();
        this.threadFactory.setDaemon(true);

        triggeredCounter = Counter.builder("vigil.schedules.triggered")
            .description("Number of scheduled scans started")
            .register(meterRegistry);

        errorCounter = Counter.builder("vigil.schedules.errors")
            .description("Number of failed scheduler ticks and scan starts")
            .register(meterRegistry);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (config.isEnabled()) {
            start();
        } else {
            log.info("Schedule evaluator disabled (vigil.scheduler.enabled=false)");
        }
    }

    /**
     * Start the loop thread; no-op if it is already running
     */
    public void start() {
        synchronized (lifecycleMonitor) {
            if (loopThread != null && loopThread.isAlive()) {
                return;
            }
            running = true;
            loopThread = threadFactory.newThread(this::runLoop);
            loopThread.start();
        }
        log.info("Schedule evaluator started: check interval={}", config.getCheckInterval());
    }

    /**
     * Stop the loop thread and wait briefly for it to exit; no-op if it is not running
     */
    @PreDestroy
    public void stop() {
        Thread thread;
        synchronized (lifecycleMonitor) {
            if (loopThread == null) {
                return;
            }
            running = false;
            thread = loopThread;
            loopThread = null;
        }

        thread.interrupt();
        try {
            thread.join(STOP_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (thread.isAlive()) {
            log.warn("Schedule evaluator thread did not stop within {}", STOP_TIMEOUT);
        } else {
            log.info("Schedule evaluator stopped");
        }
    }

    public boolean isRunning() {
        synchronized (lifecycleMonitor) {
            return loopThread != null && loopThread.isAlive();
        }
    }

    /**
     * Create a scheduled scan
     *
     * @param request schedule definition; kept as the record's metadata
     * @return the stored record
     * @throws InvalidTargetException if the target is not acceptable
     * @throws ScanValidationException if the timing fields are incomplete
     */
    public ScheduledScan schedule(ScheduleRequest request) {
        if (!TargetValidator.isValid(request.getTarget())) {
            throw new InvalidTargetException(request.getTarget());
        }
        if (request.getScheduleType() == null) {
            throw new ScanValidationException("Schedule type is required");
        }

        LocalDateTime now = now();
        ScheduledScan scan = ScheduledScan.builder()
            .target(request.getTarget())
            .profile(request.getProfile())
            .scheduleType(request.getScheduleType())
            .createdAt(now)
            .status(ScheduleStatus.PENDING)
            .metadata(toMetadata(request))
            .build();

        if (request.getScheduleType() == ScheduleType.ONE_TIME) {
            if (request.getScheduledTime() == null) {
                throw new ScanValidationException("One-time schedules need a scheduled time");
            }
            scan.setScheduledTime(request.getScheduledTime());
            scan.setNextRun(request.getScheduledTime());
        } else {
            if (request.getIntervalType() == null) {
                throw new ScanValidationException("Recurring schedules need an interval type (hours, days or weeks)");
            }
            if (request.getIntervalValue() == null || request.getIntervalValue() <= 0) {
                throw new ScanValidationException("Recurring schedules need a positive interval value");
            }
            if (request.getStartTime() == null) {
                throw new ScanValidationException("Recurring schedules need a start time");
            }
            if (request.getEndTime() != null && request.getEndTime().isBefore(request.getStartTime())) {
                throw new ScanValidationException("End time must not be before start time");
            }
            scan.setIntervalType(request.getIntervalType());
            scan.setIntervalValue(request.getIntervalValue());
            scan.setStartTime(request.getStartTime());
            scan.setEndTime(request.getEndTime());
            scan.setNextRun(RecurrenceCalculator.calculateNextRun(scan, now));
        }

        ScheduledScan saved = repository.save(scan);
        log.info("Scheduled scan {} created: target={}, profile={}, type={}, nextRun={}",
            saved.getId(), saved.getTarget(), saved.getProfile(),
            saved.getScheduleType().getValue(), saved.getNextRun());

        if (config.isEnabled()) {
            start();
        }
        return saved;
    }

    /**
     * All scheduled scans, newest first, with their metadata
     */
    public List<ScheduledScan> list() {
        return repository.findAllOrderByCreatedAtDesc();
    }

    public Optional<ScheduledScan> find(long id) {
        return repository.findById(id);
    }

    /**
     * Cancel a scheduled scan and its running job, if any
     *
     * @return the cancelled record
     * @throws ScheduleNotFoundException if the id is unknown
     * @throws ScheduleStateException if the schedule already reached a terminal status
     */
    public ScheduledScan cancelScheduled(long id) {
        ScheduledScan cancelled;
        String jobId;

        lock.lock();
        try {
            ScheduledScan scan = repository.findById(id).orElseThrow(() -> new ScheduleNotFoundException(id));
            if (scan.getStatus().isTerminal()) {
                throw new ScheduleStateException("Scheduled scan already " + scan.getStatus().getValue());
            }
            scan.setStatus(ScheduleStatus.CANCELLED);
            cancelled = repository.save(scan);
            jobId = activeScans.remove(id);
        } finally {
            lock.unlock();
        }

        if (jobId != null) {
            boolean accepted = scanService.cancel(jobId);
            log.info("Scheduled scan {} cancelled, scan {} cancellation accepted={}", id, jobId, accepted);
        } else {
            log.info("Scheduled scan {} cancelled", id);
        }
        return cancelled;
    }

    /**
     * Delete a scheduled scan, cancelling it first if it is running
     *
     * @throws ScheduleNotFoundException if the id is unknown
     */
    public void deleteScheduled(long id) {
        String jobId;

        lock.lock();
        try {
            repository.findById(id).orElseThrow(() -> new ScheduleNotFoundException(id));
            repository.deleteById(id);
            jobId = activeScans.remove(id);
        } finally {
            lock.unlock();
        }

        // A scan still starting is cancelled by trigger once it sees the record is gone
        if (jobId != null) {
            boolean accepted = scanService.cancel(jobId);
            log.info("Scheduled scan {} deleted, scan {} cancellation accepted={}", id, jobId, accepted);
        } else {
            log.info("Scheduled scan {} deleted", id);
        }
    }

    /**
     * Job currently running for a schedule
     */
    public Optional<String> activeJob(long id) {
        lock.lock();
        try {
            return Optional.ofNullable(activeScans.get(id));
        } finally {
            lock.unlock();
        }
    }

    /**
     * One evaluation pass over pending schedules
     */
    public void checkScheduledScans() {
        LocalDateTime now = now();
        List<ScheduledScan> candidates = repository.findByStatusIn(
            List.of(ScheduleStatus.PENDING, ScheduleStatus.RUNNING));

        for (ScheduledScan scan : candidates) {
            if (scan.getStatus() == ScheduleStatus.RUNNING) {
                continue;
            }

            if (scan.getNextRun() == null) {
                bootstrap(scan.getId(), now);
                continue;
            }

            if (!scan.getNextRun().isAfter(now)) {
                trigger(scan.getId(), now);
            }
        }
    }

    private void runLoop() {
        while (running) {
            Duration delay = config.getCheckInterval();
            try {
                checkScheduledScans();
            } catch (RuntimeException e) {
                log.error("Error checking scheduled scans", e);
                errorCounter.increment();
                delay = config.getErrorBackoff();
            }

            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                if (running) {
                    log.warn("Schedule evaluator interrupted while running, exiting loop");
                }
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    /**
     * First sighting of a schedule without a due time: compute it, do not run
     */
    private void bootstrap(long id, LocalDateTime now) {
        lock.lock();
        try {
            Optional<ScheduledScan> current = repository.findById(id);
            if (current.isEmpty() || current.get().getStatus() != ScheduleStatus.PENDING
                    || current.get().getNextRun() != null) {
                return;
            }

            ScheduledScan scan = current.get();
            LocalDateTime nextRun = RecurrenceCalculator.calculateNextRun(scan, now);
            if (nextRun == null) {
                scan.setStatus(ScheduleStatus.COMPLETED);
                log.info("Scheduled scan {} has no further runs, marking completed", id);
            } else {
                scan.setNextRun(nextRun);
                log.debug("Scheduled scan {} next run: {}", id, nextRun);
            }
            repository.save(scan);
        } finally {
            lock.unlock();
        }
    }

    private void trigger(long id, LocalDateTime now) {
        ScheduledScan scan;

        lock.lock();
        try {
            Optional<ScheduledScan> current = repository.findById(id);
            if (current.isEmpty() || current.get().getStatus() != ScheduleStatus.PENDING) {
                return;
            }
            scan = current.get();
            scan.setStatus(ScheduleStatus.RUNNING);
            scan.setLastRun(now);
            scan.setNextRun(RecurrenceCalculator.calculateNextRun(scan, now));
            repository.save(scan);
        } finally {
            lock.unlock();
        }

        String jobId;
        try {
            jobId = scanService.startScan(scan.getTarget(), scan.getProfile(), (scanJobId, event) -> {
                if (event.isTerminal()) {
                    onScanFinished(id, scanJobId, event);
                }
            });
        } catch (RuntimeException e) {
            log.error("Error running scheduled scan {}", id, e);
            errorCounter.increment();
            markError(id);
            return;
        }

        boolean orphaned;
        lock.lock();
        try {
            orphaned = !repository.findById(id).map(s -> s.getStatus() == ScheduleStatus.RUNNING).orElse(false);
            if (!orphaned) {
                activeScans.put(id, jobId);
            }
        } finally {
            lock.unlock();
        }

        // Cancelled or deleted while the scan was starting; nobody else knows the job id
        if (orphaned) {
            boolean accepted = scanService.cancel(jobId);
            log.info("Scheduled scan {} stopped while starting, scan {} cancellation accepted={}", id, jobId, accepted);
            return;
        }

        // The scan may have finished before the association was recorded
        boolean finished = scanService.status(jobId).map(s -> s.getStatus().isTerminal()).orElse(true);
        if (finished) {
            lock.lock();
            try {
                activeScans.remove(id, jobId);
            } finally {
                lock.unlock();
            }
        }

        triggeredCounter.increment();
        log.info("Started scheduled scan {} with scan ID {}, next run: {}", id, jobId, scan.getNextRun());
    }

    /**
     * Completion handler bound to one schedule; runs on the scan worker thread
     */
    void onScanFinished(long id, String jobId, ScanEvent event) {
        boolean success = event instanceof ScanEvent.Completed;

        lock.lock();
        try {
            Optional<ScheduledScan> current = repository.findById(id);
            if (current.isEmpty()) {
                activeScans.remove(id, jobId);
                log.warn("Scheduled scan {} not found, it was deleted while scan {} ran", id, jobId);
                return;
            }
            if (current.get().getStatus() != ScheduleStatus.RUNNING) {
                activeScans.remove(id, jobId);
                log.info("Scheduled scan {} is {}, ignoring outcome of scan {}",
                    id, current.get().getStatus().getValue(), jobId);
                return;
            }
        } finally {
            lock.unlock();
        }

        if (success) {
            SaveOutcome outcome = scanService.saveResult(jobId);
            if (!outcome.ok()) {
                log.error("Error saving result of scheduled scan {}: {}", id, outcome.errorMessage());
            }
        }

        ScheduledScan updated = null;
        lock.lock();
        try {
            activeScans.remove(id, jobId);

            Optional<ScheduledScan> current = repository.findById(id);
            if (current.isEmpty() || current.get().getStatus() != ScheduleStatus.RUNNING) {
                log.info("Scheduled scan {} changed while the result of scan {} was saved, ignoring outcome", id, jobId);
                return;
            }

            ScheduledScan scan = current.get();

            if (!success) {
                scan.setStatus(ScheduleStatus.ERROR);
            } else if (scan.getNextRun() != null) {
                scan.setStatus(ScheduleStatus.PENDING);
            } else {
                scan.setStatus(ScheduleStatus.COMPLETED);
            }
            updated = repository.save(scan);
        } catch (RuntimeException e) {
            log.error("Error recording outcome of scheduled scan {}", id, e);
            errorCounter.increment();
        } finally {
            lock.unlock();
        }

        if (updated == null) {
            return;
        }

        log.info("Scheduled scan {} finished scan {} with status {}", id, jobId, updated.getStatus().getValue());

        Object webhook = updated.getMetadata().get(WEBHOOK_KEY);
        if (webhook instanceof String url && !url.isBlank()) {
            webhookNotifier.notify(url, id, jobId, updated.getStatus()).subscribe();
        }
    }

    private void markError(long id) {
        lock.lock();
        try {
            repository.findById(id)
                .filter(scan -> scan.getStatus() == ScheduleStatus.RUNNING)
                .ifPresent(scan -> {
                    scan.setStatus(ScheduleStatus.ERROR);
                    repository.save(scan);
                });
        } finally {
            lock.unlock();
        }
    }

    private Map<String, Object> toMetadata(ScheduleRequest request) {
        Map<String, Object> metadata = new LinkedHashMap<>(objectMapper.convertValue(request, METADATA_TYPE));
        metadata.values().removeIf(Objects::isNull);
        return metadata;
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
