package com.whereq.vigil.repository;

import com.whereq.vigil.model.SaveOutcome;
import com.whereq.vigil.model.StoredScanResult;
import com.whereq.vigil.model.report.ScanResult;

import java.util.List;
import java.util.Optional;

/**
 * Persistence collaborator for completed scan results.
 * Implementations report failures through {@link SaveOutcome} instead of throwing.
 */
public interface ScanResultStore {

    /**
     * Store the result of a finished scan
     *
     * @param jobId  scan job identifier
     * @param result extracted result
     * @return outcome carrying the stored id, or a failure message
     */
    SaveOutcome saveScanResult(String jobId, ScanResult result);

    Optional<StoredScanResult> findById(String storedId);

    /**
     * Saved results, most recently saved first
     */
    List<StoredScanResult> findAll();

    /**
     * @return true if a result was removed
     */
    boolean deleteById(String storedId);
}
