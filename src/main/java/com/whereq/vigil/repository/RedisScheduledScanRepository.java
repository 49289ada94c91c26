package com.whereq.vigil.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.vigil.config.VigilProperties;
import com.whereq.vigil.exception.PersistenceException;
import com.whereq.vigil.model.ScheduleStatus;
import com.whereq.vigil.model.ScheduledScan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Schedule store backed by Redis.
 * <p>
 * Each record is a JSON document under {@code vigil:schedule:<id>}; ids come from the
 * {@code vigil:schedule:seq} counter and are indexed in the {@code vigil:schedule:ids} set.
 * Calls block for at most {@code vigil.storage.redis-timeout}.
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "vigil.storage", name = "type", havingValue = "redis")
public class RedisScheduledScanRepository implements ScheduledScanRepository {

    static final String KEY_PREFIX = "vigil:schedule:";
    static final String SEQUENCE_KEY = "vigil:schedule:seq";
    static final String INDEX_KEY = "vigil:schedule:ids";

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public RedisScheduledScanRepository(ReactiveRedisTemplate<String, String> redisTemplate,
                                        ObjectMapper objectMapper,
                                        VigilProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.timeout = properties.getStorage().getRedisTimeout();
    }

    @Override
    public ScheduledScan save(ScheduledScan scan) {
        ScheduledScan stored = scan.copy();
        if (stored.getId() == null) {
            Long id = block(redisTemplate.opsForValue().increment(SEQUENCE_KEY), "allocate schedule id");
            stored.setId(id);
        }

        String id = String.valueOf(stored.getId());
        String json = toJson(stored);
        block(redisTemplate.opsForValue().set(KEY_PREFIX + id, json)
            .then(redisTemplate.opsForSet().add(INDEX_KEY, id)), "save schedule " + id);

        log.debug("Saved scheduled scan {} ({})", id, stored.getStatus().getValue());
        return stored;
    }

    @Override
    public Optional<ScheduledScan> findById(long id) {
        String json = block(redisTemplate.opsForValue().get(KEY_PREFIX + id), "read schedule " + id);
        return Optional.ofNullable(json).map(this::fromJson);
    }

    @Override
    public List<ScheduledScan> findAllOrderByCreatedAtDesc() {
        List<ScheduledScan> all = loadAll();
        all.sort(Comparator
            .comparing(ScheduledScan::getCreatedAt, Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()))
            .thenComparing(ScheduledScan::getId, Comparator.reverseOrder()));
        return all;
    }

    @Override
    public List<ScheduledScan> findByStatusIn(Collection<ScheduleStatus> statuses) {
        return loadAll().stream()
            .filter(scan -> statuses.contains(scan.getStatus()))
            .sorted(Comparator.comparing(ScheduledScan::getId))
            .toList();
    }

    @Override
    public boolean deleteById(long id) {
        String key = String.valueOf(id);
        Long removed = block(redisTemplate.opsForValue().delete(KEY_PREFIX + key)
            .flatMap(deleted -> redisTemplate.opsForSet().remove(INDEX_KEY, key)
                .map(count -> deleted ? 1L : 0L)), "delete schedule " + id);
        return removed != null && removed > 0;
    }

    @Override
    public Optional<Map<String, Object>> getMetadata(long id) {
        return findById(id).map(ScheduledScan::getMetadata);
    }

    @Override
    public boolean setMetadata(long id, Map<String, Object> metadata) {
        Optional<ScheduledScan> current = findById(id);
        if (current.isEmpty()) {
            return false;
        }
        ScheduledScan changed = current.get();
        changed.setMetadata(metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata));
        save(changed);
        return true;
    }

    private List<ScheduledScan> loadAll() {
        List<String> ids = block(redisTemplate.opsForSet().members(INDEX_KEY).collectList(), "list schedules");
        if (ids == null || ids.isEmpty()) {
            return new ArrayList<>();
        }

        List<String> keys = ids.stream().map(id -> KEY_PREFIX + id).toList();
        List<String> documents = block(redisTemplate.opsForValue().multiGet(keys), "read schedules");
        if (documents == null) {
            return new ArrayList<>();
        }

        List<ScheduledScan> result = new ArrayList<>();
        for (int i = 0; i < documents.size(); i++) {
            String json = documents.get(i);
            if (json == null) {
                continue;
            }
            // skipped, the remaining records stay visible
            try {
                result.add(fromJson(json));
            } catch (PersistenceException e) {
                log.error("Skipping corrupt scheduled scan {}: {}", ids.get(i), e.getMessage());
            }
        }
        return result;
    }

    private <T> T block(Mono<T> call, String action) {
        try {
            return call.block(timeout);
        } catch (RuntimeException e) {
            log.error("Redis call failed: {}", action, e);
            throw new PersistenceException("Failed to " + action + ": " + e.getMessage(), e);
        }
    }

    private String toJson(ScheduledScan scan) {
        try {
            return objectMapper.writeValueAsString(scan);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize schedule " + scan.getId(), e);
        }
    }

    private ScheduledScan fromJson(String json) {
        try {
            return objectMapper.readValue(json, ScheduledScan.class);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to deserialize schedule: " + e.getOriginalMessage(), e);
        }
    }
}
