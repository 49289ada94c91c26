package com.whereq.vigil.model;

import com.whereq.vigil.model.report.ScanResult;

import java.time.Instant;
import java.util.Comparator;

/**
 * Scan result as kept by the result store.
 *
 * @param storedId identifier assigned by the store
 * @param jobId    scan job the result came from
 * @param savedAt  when the result was stored
 * @param result   extracted result tree
 */
public record StoredScanResult(String storedId, String jobId, Instant savedAt, ScanResult result) {

    /**
     * Most recently saved first; ids are sequence numbers, so longer ids are newer
     */
    public static final Comparator<StoredScanResult> NEWEST_FIRST = Comparator
        .comparing(StoredScanResult::savedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
        .thenComparing((StoredScanResult stored) -> stored.storedId().length(), Comparator.<Integer>reverseOrder())
        .thenComparing(StoredScanResult::storedId, Comparator.<String>reverseOrder());
}
