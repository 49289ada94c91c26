package com.whereq.vigil.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.vigil.config.VigilProperties;
import com.whereq.vigil.exception.PersistenceException;
import com.whereq.vigil.model.SaveOutcome;
import com.whereq.vigil.model.StoredScanResult;
import com.whereq.vigil.model.report.ScanResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Result store backed by Redis: JSON documents under {@code vigil:result:<id>},
 * ids indexed in the {@code vigil:result:ids} set.
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "vigil.storage", name = "type", havingValue = "redis")
public class RedisScanResultStore implements ScanResultStore {

    static final String KEY_PREFIX = "vigil:result:";
    static final String SEQUENCE_KEY = "vigil:result:seq";
    static final String INDEX_KEY = "vigil:result:ids";

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration timeout;

    public RedisScanResultStore(ReactiveRedisTemplate<String, String> redisTemplate,
                                ObjectMapper objectMapper,
                                Clock clock,
                                VigilProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.timeout = properties.getStorage().getRedisTimeout();
    }

    @Override
    public SaveOutcome saveScanResult(String jobId, ScanResult result) {
        if (result == null) {
            return SaveOutcome.failure("No scan result to save for job " + jobId);
        }

        try {
            Long sequence = redisTemplate.opsForValue().increment(SEQUENCE_KEY).block(timeout);
            String storedId = String.valueOf(sequence);
            String json = objectMapper.writeValueAsString(
                new StoredScanResult(storedId, jobId, clock.instant(), result));

            redisTemplate.opsForValue().set(KEY_PREFIX + storedId, json)
                .then(redisTemplate.opsForSet().add(INDEX_KEY, storedId))
                .block(timeout);

            log.info("Stored result of scan {} as {}", jobId, storedId);
            return SaveOutcome.success(storedId);

        } catch (JsonProcessingException e) {
            log.error("Failed to serialize result of scan {}", jobId, e);
            return SaveOutcome.failure("Failed to serialize scan result: " + e.getOriginalMessage());
        } catch (RuntimeException e) {
            log.error("Failed to store result of scan {}", jobId, e);
            return SaveOutcome.failure("Failed to save scan result: " + e.getMessage());
        }
    }

    @Override
    public Optional<StoredScanResult> findById(String storedId) {
        try {
            String json = redisTemplate.opsForValue().get(KEY_PREFIX + storedId).block(timeout);
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, StoredScanResult.class));
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Stored result " + storedId + " is corrupt: " + e.getOriginalMessage(), e);
        } catch (RuntimeException e) {
            log.error("Failed to read stored result {}", storedId, e);
            throw new PersistenceException("Failed to read stored result " + storedId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<StoredScanResult> findAll() {
        try {
            List<String> ids = redisTemplate.opsForSet().members(INDEX_KEY).collectList().block(timeout);
            if (ids == null || ids.isEmpty()) {
                return List.of();
            }

            List<String> documents = redisTemplate.opsForValue()
                .multiGet(ids.stream().map(id -> KEY_PREFIX + id).toList())
                .block(timeout);
            if (documents == null) {
                return List.of();
            }

            List<StoredScanResult> results = new ArrayList<>();
            for (int i = 0; i < documents.size(); i++) {
                String json = documents.get(i);
                if (json == null) {
                    continue;
                }
                try {
                    results.add(objectMapper.readValue(json, StoredScanResult.class));
                } catch (JsonProcessingException e) {
                    log.error("Skipping corrupt stored result {}: {}", ids.get(i), e.getOriginalMessage());
                }
            }
            results.sort(StoredScanResult.NEWEST_FIRST);
            return results;

        } catch (RuntimeException e) {
            log.error("Failed to list stored results", e);
            throw new PersistenceException("Failed to list stored results: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean deleteById(String storedId) {
        try {
            Boolean deleted = redisTemplate.opsForValue().delete(KEY_PREFIX + storedId)
                .flatMap(removed -> redisTemplate.opsForSet().remove(INDEX_KEY, storedId).thenReturn(removed))
                .block(timeout);
            if (Boolean.TRUE.equals(deleted)) {
                log.info("Deleted stored result {}", storedId);
                return true;
            }
            return false;
        } catch (RuntimeException e) {
            log.error("Failed to delete stored result {}", storedId, e);
            throw new PersistenceException("Failed to delete stored result " + storedId + ": " + e.getMessage(), e);
        }
    }
}
