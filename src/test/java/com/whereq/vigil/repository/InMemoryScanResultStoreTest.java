package com.whereq.vigil.repository;

import com.whereq.vigil.model.SaveOutcome;
import com.whereq.vigil.model.StoredScanResult;
import com.whereq.vigil.model.report.ScanResult;
import com.whereq.vigil.parser.NmapReportParser;
import com.whereq.vigil.support.Reports;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryScanResultStoreTest {

    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");

    private final InMemoryScanResultStore store = new InMemoryScanResultStore(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void storesResultUnderNewId() {
        ScanResult result = new NmapReportParser().parse(Reports.singleHost());

        SaveOutcome first = store.saveScanResult("job-a", result);
        SaveOutcome second = store.saveScanResult("job-b", result);

        assertThat(first.ok()).isTrue();
        assertThat(first.storedId()).isNotEqualTo(second.storedId());
        StoredScanResult stored = store.findById(first.storedId()).orElseThrow();
        assertThat(stored.jobId()).isEqualTo("job-a");
        assertThat(stored.savedAt()).isEqualTo(NOW);
        assertThat(stored.result()).isSameAs(result);
    }

    @Test
    void missingResultIsAFailure() {
        SaveOutcome outcome = store.saveScanResult("job-a", null);

        assertThat(outcome.ok()).isFalse();
        assertThat(outcome.storedId()).isNull();
        assertThat(outcome.errorMessage()).contains("job-a");
    }

    @Test
    void unknownIdIsEmpty() {
        assertThat(store.findById("404")).isEmpty();
    }

    @Test
    void historyIsNewestFirstAndShrinksOnDelete() {
        ScanResult result = new NmapReportParser().parse(Reports.singleHost());
        String first = store.saveScanResult("job-a", result).storedId();
        String second = store.saveScanResult("job-b", result).storedId();

        assertThat(store.findAll()).extracting(StoredScanResult::jobId).containsExactly("job-b", "job-a");

        assertThat(store.deleteById(second)).isTrue();
        assertThat(store.deleteById(second)).isFalse();
        assertThat(store.findAll()).extracting(StoredScanResult::storedId).containsExactly(first);
    }
}
