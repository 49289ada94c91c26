package com.whereq.vigil.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.whereq.vigil.model.report.ScanResult;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time, immutable view of a {@link ScanJob}.
 */
@Value
@Builder
public class ScanJobSnapshot {
    String jobId;
    String target;
    String arguments;
    Instant createdAt;
    Instant startedAt;
    Instant endedAt;
    ScanStatus status;
    double progress;
    @JsonIgnore
    String output;
    ScanResult result;
    String errorMessage;
    Integer returnCode;
    boolean needsAdmin;
    boolean processLaunched;

    /**
     * True while the job is registered but still waiting for a worker slot
     */
    @JsonIgnore
    public boolean isAwaitingSlot() {
        return status == ScanStatus.RUNNING && startedAt == null;
    }
}
