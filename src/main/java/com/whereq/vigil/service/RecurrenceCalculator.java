package com.whereq.vigil.service;

import com.whereq.vigil.model.IntervalType;
import com.whereq.vigil.model.ScheduleType;
import com.whereq.vigil.model.ScheduledScan;

import java.time.LocalDateTime;

/**
 * Computes when a scheduled scan is next due. A null result means no further runs.
 */
public final class RecurrenceCalculator {

    private RecurrenceCalculator() {
    }

    /**
     * @param scan schedule to evaluate
     * @param now current local time
     * @return next due time, or null if the schedule is finished
     */
    public static LocalDateTime calculateNextRun(ScheduledScan scan, LocalDateTime now) {
        if (scan.getScheduleType() == ScheduleType.ONE_TIME) {
            LocalDateTime scheduledTime = scan.getScheduledTime();
            LocalDateTime lastRun = scan.getLastRun();
            if (lastRun != null && scheduledTime != null && !lastRun.isBefore(scheduledTime)) {
                return null;
            }
            return scheduledTime;
        }

        LocalDateTime lastRun = scan.getLastRun();
        LocalDateTime startTime = scan.getStartTime();
        LocalDateTime endTime = scan.getEndTime();

        if (lastRun == null && startTime != null && startTime.isAfter(now)) {
            return startTime;
        }
        if (endTime != null && now.isAfter(endTime)) {
            return null;
        }

        LocalDateTime base = lastRun != null ? lastRun : now;
        IntervalType unit = scan.getIntervalType() != null ? scan.getIntervalType() : IntervalType.DAYS;
        int amount = scan.getIntervalValue() != null ? scan.getIntervalValue() : 1;

        LocalDateTime candidate = unit.addTo(base, amount);
        if (endTime != null && candidate.isAfter(endTime)) {
            return null;
        }
        return candidate;
    }
}
