package com.whereq.vigil.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persisted intent to run a profiled scan once or repeatedly.
 * Times are local wall-clock times, as entered by the operator.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledScan {
    /**
     * Identifier assigned by the repository
     */
    private Long id;

    private String target;

    /**
     * Profile display name, resolved when the scan is triggered
     */
    private String profile;

    private ScheduleType scheduleType;

    private LocalDateTime createdAt;

    /**
     * One-time schedules only
     */
    private LocalDateTime scheduledTime;

    /**
     * Recurring schedules only
     */
    private IntervalType intervalType;
    private Integer intervalValue;
    private LocalDateTime startTime;
    private LocalDateTime endTime;

    private LocalDateTime lastRun;

    /**
     * Next due time; null means no further runs
     */
    private LocalDateTime nextRun;

    @Builder.Default
    private ScheduleStatus status = ScheduleStatus.PENDING;

    /**
     * Opaque metadata blob, usually the original request
     */
    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    /**
     * Copy safe to hand to another thread
     */
    public ScheduledScan copy() {
        return toBuilder()
            .metadata(metadata == null ? new HashMap<>() : copyMap(metadata))
            .build();
    }

    private static Map<String, Object> copyMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(String.valueOf(key), copyValue(value)));
        return copy;
    }

    /**
     * Nested maps and lists are copied; other values are treated as immutable
     */
    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return copyMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(element -> copy.add(copyValue(element)));
            return copy;
        }
        return value;
    }
}
