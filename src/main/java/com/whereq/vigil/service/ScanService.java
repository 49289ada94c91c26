package com.whereq.vigil.service;

import com.whereq.vigil.config.VigilProperties;
import com.whereq.vigil.executor.CommandProbe;
import com.whereq.vigil.executor.ScannerBinaryLocator;
import com.whereq.vigil.model.SaveOutcome;
import com.whereq.vigil.model.ScanEvent;
import com.whereq.vigil.model.ScanEventListener;
import com.whereq.vigil.model.ScanJobSnapshot;
import com.whereq.vigil.model.ScanProfile;
import com.whereq.vigil.model.ScanStatus;
import com.whereq.vigil.model.StoredScanResult;
import com.whereq.vigil.model.ToolInfo;
import com.whereq.vigil.model.report.ScanResult;
import com.whereq.vigil.repository.ScanResultStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Profile-level entry point to the scan engine.
 * <p>
 * Resolves profile names, caches extracted results by job id and forwards them to the
 * result store on request. Also answers whether the scanner is installed and whether
 * the service runs elevated.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScanService {

    static final Pattern VERSION_PATTERN = Pattern.compile("Nmap version (\\S+)");

    private final ScanExecutionEngine engine;
    private final ScanResultStore resultStore;
    private final PrivilegeChecker privilegeChecker;
    private final CommandProbe commandProbe;
    private final ScannerBinaryLocator binaryLocator;
    private final VigilProperties properties;

    private final Map<String, ScanResult> results = new ConcurrentHashMap<>();

    /**
     * Profile display names and their arguments, in menu order
     */
    public Map<String, String> profiles() {
        return ScanProfile.asMap();
    }

    /**
     * Start a scan with a named profile
     *
     * @param target scan target
     * @param profileName profile display name; unknown names use the quick profile
     * @param listener caller's listener, may be null. On completion the result is
     *                 already cached when the listener sees the event.
     * @return job identifier
     * @throws com.whereq.vigil.exception.InvalidTargetException if the target is not acceptable
     */
    public String startScan(String target, String profileName, ScanEventListener listener) {
        String arguments = ScanProfile.argumentsFor(profileName);
        ScanEventListener downstream = listener != null ? listener : ScanEventListener.NONE;

        log.info("Starting scan of {} with profile '{}'", target, profileName);

        return engine.submit(target, arguments, (jobId, event) -> {
            if (event instanceof ScanEvent.Completed completed) {
                results.put(jobId, completed.result());
                // follows the engine's registry eviction
                results.keySet().removeIf(id -> !id.equals(jobId) && !engine.isRegistered(id));
            }
            downstream.onEvent(jobId, event);
        });
    }

    /**
     * Start an operator-initiated scan. Completed results are forwarded to the
     * result store when {@code vigil.scanner.persist-ad-hoc-results} is on.
     */
    public String startAdHocScan(String target, String profileName) {
        if (!properties.getScanner().isPersistAdHocResults()) {
            return startScan(target, profileName, null);
        }

        return startScan(target, profileName, (jobId, event) -> {
            if (event instanceof ScanEvent.Completed) {
                SaveOutcome outcome = saveResult(jobId);
                if (outcome.ok()) {
                    log.info("Result of ad-hoc scan {} stored as {}", jobId, outcome.storedId());
                }
            }
        });
    }

    public Optional<ScanJobSnapshot> status(String jobId) {
        return engine.status(jobId);
    }

    public Map<String, ScanJobSnapshot> allStatuses() {
        return engine.allStatuses();
    }

    /**
     * Cached result of a completed scan
     */
    public Optional<ScanResult> result(String jobId) {
        return Optional.ofNullable(results.get(jobId));
    }

    public boolean cancel(String jobId) {
        return engine.cancel(jobId);
    }

    /**
     * Number of scans currently holding a worker slot
     */
    public long activeScanCount() {
        return engine.allStatuses().values().stream()
            .filter(job -> job.getStatus() == ScanStatus.RUNNING && !job.isAwaitingSlot())
            .count();
    }

    /**
     * Forward a cached result to the result store
     *
     * @param jobId job identifier
     * @return store outcome; a failure if no result is cached for the job
     */
    public SaveOutcome saveResult(String jobId) {
        ScanResult result = results.get(jobId);
        if (result == null) {
            return SaveOutcome.failure("No scan result available for job " + jobId);
        }

        SaveOutcome outcome = resultStore.saveScanResult(jobId, result);
        if (!outcome.ok()) {
            log.warn("Could not store result of scan {}: {}", jobId, outcome.errorMessage());
        }
        return outcome;
    }

    public Optional<StoredScanResult> storedResult(String storedId) {
        return resultStore.findById(storedId);
    }

    /**
     * Saved scan history, most recently saved first
     */
    public List<StoredScanResult> storedResults() {
        return resultStore.findAll();
    }

    public boolean deleteStoredResult(String storedId) {
        return resultStore.deleteById(storedId);
    }

    /**
     * Query the scanner binary for its version
     *
     * @return installation state; version is {@link ToolInfo#UNKNOWN_VERSION} if the
     *         binary runs but prints no recognisable version
     */
    public ToolInfo checkToolInstallation() {
        return commandProbe.run(List.of(binaryLocator.locate(), "--version"))
            .filter(CommandProbe.Result::succeeded)
            .map(result -> {
                Matcher matcher = VERSION_PATTERN.matcher(result.output());
                return new ToolInfo(true, matcher.find() ? matcher.group(1) : ToolInfo.UNKNOWN_VERSION);
            })
            .orElseGet(ToolInfo::missing);
    }

    public boolean hasAdminPrivileges() {
        return privilegeChecker.hasAdminPrivileges();
    }
}
