package com.whereq.vigil.repository;

import com.whereq.vigil.model.ScheduleStatus;
import com.whereq.vigil.model.ScheduledScan;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local schedule store, lost on restart.
 */
@Repository
@ConditionalOnProperty(prefix = "vigil.storage", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryScheduledScanRepository implements ScheduledScanRepository {

    private static final Comparator<ScheduledScan> NEWEST_FIRST = Comparator
        .comparing(ScheduledScan::getCreatedAt, Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()))
        .thenComparing(ScheduledScan::getId, Comparator.reverseOrder());

    private final Map<Long, ScheduledScan> schedules = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public ScheduledScan save(ScheduledScan scan) {
        ScheduledScan stored = scan.copy();
        if (stored.getId() == null) {
            stored.setId(sequence.incrementAndGet());
        }
        schedules.put(stored.getId(), stored);
        return stored.copy();
    }

    @Override
    public Optional<ScheduledScan> findById(long id) {
        return Optional.ofNullable(schedules.get(id)).map(ScheduledScan::copy);
    }

    @Override
    public List<ScheduledScan> findAllOrderByCreatedAtDesc() {
        return schedules.values().stream()
            .map(ScheduledScan::copy)
            .sorted(NEWEST_FIRST)
            .toList();
    }

    @Override
    public List<ScheduledScan> findByStatusIn(Collection<ScheduleStatus> statuses) {
        return schedules.values().stream()
            .filter(scan -> statuses.contains(scan.getStatus()))
            .map(ScheduledScan::copy)
            .sorted(Comparator.comparing(ScheduledScan::getId))
            .toList();
    }

    @Override
    public boolean deleteById(long id) {
        return schedules.remove(id) != null;
    }

    @Override
    public Optional<Map<String, Object>> getMetadata(long id) {
        return Optional.ofNullable(schedules.get(id))
            .map(scan -> scan.copy().getMetadata());
    }

    @Override
    public boolean setMetadata(long id, Map<String, Object> metadata) {
        return schedules.computeIfPresent(id, (key, current) -> {
            ScheduledScan changed = current.toBuilder()
                .metadata(metadata == null ? new LinkedHashMap<>() : metadata)
                .build();
            return changed.copy();
        }) != null;
    }
}
