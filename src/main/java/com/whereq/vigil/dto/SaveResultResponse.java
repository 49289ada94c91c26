package com.whereq.vigil.dto;

import com.whereq.vigil.model.SaveOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of forwarding a scan result to the result store
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SaveResultResponse {

    private String jobId;

    private boolean saved;

    private String storedId;

    private String message;

    public static SaveResultResponse of(String jobId, SaveOutcome outcome) {
        return SaveResultResponse.builder()
            .jobId(jobId)
            .saved(outcome.ok())
            .storedId(outcome.storedId())
            .message(outcome.ok() ? "Scan result saved" : outcome.errorMessage())
            .build();
    }
}
