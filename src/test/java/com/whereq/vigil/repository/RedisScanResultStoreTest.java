package com.whereq.vigil.repository;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.whereq.vigil.config.VigilProperties;
import com.whereq.vigil.model.SaveOutcome;
import com.whereq.vigil.model.StoredScanResult;
import com.whereq.vigil.model.report.ScanResult;
import com.whereq.vigil.parser.NmapReportParser;
import com.whereq.vigil.support.Reports;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ReactiveSetOperations;
import org.springframework.data.redis.core.ReactiveValueOperations;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisScanResultStoreTest {

    private ReactiveValueOperations<String, String> values;
    private ReactiveSetOperations<String, String> sets;
    private RedisScanResultStore store;

    private final ScanResult result = new NmapReportParser().parse(Reports.singleHost());

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        ReactiveRedisTemplate<String, String> template = mock(ReactiveRedisTemplate.class);
        values = mock(ReactiveValueOperations.class);
        sets = mock(ReactiveSetOperations.class);
        when(template.opsForValue()).thenReturn(values);
        when(template.opsForSet()).thenReturn(sets);

        store = new RedisScanResultStore(template,
            JsonMapper.builder().findAndAddModules().disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS).build(),
            Clock.fixed(Instant.parse("2024-03-10T12:00:00Z"), ZoneOffset.UTC), new VigilProperties());
    }

    private String savedDocument(long sequence) {
        when(values.increment(RedisScanResultStore.SEQUENCE_KEY)).thenReturn(Mono.just(sequence));
        when(values.set(eq("vigil:result:" + sequence), anyString())).thenReturn(Mono.just(true));
        when(sets.add(RedisScanResultStore.INDEX_KEY, String.valueOf(sequence))).thenReturn(Mono.just(1L));
        store.saveScanResult("job-" + sequence, result);

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(values).set(eq("vigil:result:" + sequence), json.capture());
        return json.getValue();
    }

    @Test
    void savesUnderSequenceIdAndIndexesIt() {
        when(values.increment(RedisScanResultStore.SEQUENCE_KEY)).thenReturn(Mono.just(12L));
        when(values.set(eq("vigil:result:12"), anyString())).thenReturn(Mono.just(true));
        when(sets.add(RedisScanResultStore.INDEX_KEY, "12")).thenReturn(Mono.just(1L));

        SaveOutcome outcome = store.saveScanResult("job-1", result);

        assertThat(outcome).isEqualTo(SaveOutcome.success("12"));
        verify(sets).add(RedisScanResultStore.INDEX_KEY, "12");
    }

    @Test
    void unreachableRedisIsAFailedOutcome() {
        when(values.increment(RedisScanResultStore.SEQUENCE_KEY))
            .thenReturn(Mono.error(new RedisConnectionFailureException("Connection refused")));

        SaveOutcome outcome = store.saveScanResult("job-1", result);

        assertThat(outcome.ok()).isFalse();
        assertThat(outcome.errorMessage()).startsWith("Failed to save scan result");
    }

    @Test
    void listingSkipsCorruptAndVanishedDocuments() {
        String first = savedDocument(1);
        String second = savedDocument(2);
        when(sets.members(RedisScanResultStore.INDEX_KEY)).thenReturn(Flux.just("1", "2", "3", "4"));
        when(values.multiGet(List.of("vigil:result:1", "vigil:result:2", "vigil:result:3", "vigil:result:4")))
            .thenReturn(Mono.just(Arrays.asList(first, second, "{not json", null)));

        List<StoredScanResult> all = store.findAll();

        assertThat(all).extracting(StoredScanResult::storedId).containsExactly("2", "1");
        assertThat(all.get(0).jobId()).isEqualTo("job-2");
    }

    @Test
    void deleteRemovesDocumentAndIndexEntry() {
        when(values.delete("vigil:result:5")).thenReturn(Mono.just(true));
        when(sets.remove(RedisScanResultStore.INDEX_KEY, "5")).thenReturn(Mono.just(1L));
        when(values.delete("vigil:result:6")).thenReturn(Mono.just(false));
        when(sets.remove(RedisScanResultStore.INDEX_KEY, "6")).thenReturn(Mono.just(0L));

        assertThat(store.deleteById("5")).isTrue();
        assertThat(store.deleteById("6")).isFalse();
        verify(sets).remove(RedisScanResultStore.INDEX_KEY, "5");
    }
}
