package com.whereq.vigil.dto;

import com.whereq.vigil.model.ScheduleStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response for schedule cancellation and deletion
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleActionResponse {

    private Long scheduleId;

    private boolean success;

    /**
     * Status after the action, null once deleted
     */
    private ScheduleStatus status;

    private String message;
}
