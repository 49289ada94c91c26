package com.whereq.vigil.dto;

import com.whereq.vigil.model.ScanStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for scan cancellation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanCancellationResponse {
    /**
     * Job identifier
     */
    private String jobId;

    /**
     * Status after the request
     */
    private ScanStatus status;

    private Instant cancelledAt;

    private String message;
}
