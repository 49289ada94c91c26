package com.whereq.vigil.model;

import com.whereq.vigil.model.report.ScanResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Live record of one scan job, owned by the execution engine.
 * Only ever mutated under the engine's registry lock; callers see {@link ScanJobSnapshot}s.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanJob {
    /**
     * Unique job identifier
     */
    private String jobId;

    /**
     * Validated scan target
     */
    private String target;

    /**
     * Sanitized argument string
     */
    private String arguments;

    private Instant createdAt;

    /**
     * When a worker slot was obtained; null while waiting
     */
    private Instant startedAt;

    private Instant endedAt;

    @Builder.Default
    private ScanStatus status = ScanStatus.RUNNING;

    /**
     * 0-100 while running, terminal sentinel afterwards
     */
    private double progress;

    /**
     * Underlying OS process, null until launched
     */
    private Process process;

    /**
     * Raw XML report text
     */
    private String output;

    private ScanResult result;

    private String errorMessage;

    private Integer returnCode;

    private boolean needsAdmin;

    /**
     * Immutable copy without the process handle
     */
    public ScanJobSnapshot snapshot() {
        return ScanJobSnapshot.builder()
            .jobId(jobId)
            .target(target)
            .arguments(arguments)
            .createdAt(createdAt)
            .startedAt(startedAt)
            .endedAt(endedAt)
            .status(status)
            .progress(progress)
            .output(output)
            .result(result)
            .errorMessage(errorMessage)
            .returnCode(returnCode)
            .needsAdmin(needsAdmin)
            .processLaunched(process != null)
            .build();
    }
}
