package com.whereq.vigil.dto;

import com.whereq.vigil.model.ScanStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for scan submission
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanSubmitResponse {
    /**
     * Unique job identifier
     */
    private String jobId;

    private String target;

    private String profile;

    private ScanStatus status;

    private Instant submittedAt;

    /**
     * Error message (if submission failed)
     */
    private String errorMessage;

    /**
     * Create error response
     */
    public static ScanSubmitResponse error(String message) {
        return ScanSubmitResponse.builder()
            .status(ScanStatus.FAILED)
            .errorMessage(message)
            .submittedAt(Instant.now())
            .build();
    }
}
