package com.whereq.vigil.repository;

import com.whereq.vigil.model.SaveOutcome;
import com.whereq.vigil.model.StoredScanResult;
import com.whereq.vigil.model.report.ScanResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local result store. Results are immutable, so they are shared as is.
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "vigil.storage", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryScanResultStore implements ScanResultStore {

    private final Map<String, StoredScanResult> results = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;

    public InMemoryScanResultStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public SaveOutcome saveScanResult(String jobId, ScanResult result) {
        if (result == null) {
            return SaveOutcome.failure("No scan result to save for job " + jobId);
        }

        String storedId = String.valueOf(sequence.incrementAndGet());
        results.put(storedId, new StoredScanResult(storedId, jobId, clock.instant(), result));

        log.info("Stored result of scan {} as {}", jobId, storedId);
        return SaveOutcome.success(storedId);
    }

    @Override
    public Optional<StoredScanResult> findById(String storedId) {
        return Optional.ofNullable(results.get(storedId));
    }

    @Override
    public List<StoredScanResult> findAll() {
        return results.values().stream()
            .sorted(StoredScanResult.NEWEST_FIRST)
            .toList();
    }

    @Override
    public boolean deleteById(String storedId) {
        boolean removed = results.remove(storedId) != null;
        if (removed) {
            log.info("Deleted stored result {}", storedId);
        }
        return removed;
    }
}
