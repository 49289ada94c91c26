package com.whereq.vigil.dto;

import com.whereq.vigil.model.IntervalType;
import com.whereq.vigil.model.ScheduleType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Request to create a scheduled scan.
 * The whole request is kept as the schedule's metadata.
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Scheduled scan request")
public class ScheduleRequest {

    @NotBlank
    @Schema(example = "10.0.0.0/24")
    private String target;

    /**
     * Profile display name, resolved when the scan runs
     */
    @Builder.Default
    @Schema(example = "Quick")
    private String profile = "Quick";

    @NotNull
    @Schema(description = "one_time or recurring", example = "recurring")
    private ScheduleType scheduleType;

    /**
     * Due time of a one-time schedule, local time
     */
    private LocalDateTime scheduledTime;

    /**
     * hours, days or weeks
     */
    @Schema(example = "days")
    private IntervalType intervalType;

    @Positive
    private Integer intervalValue;

    private LocalDateTime startTime;

    /**
     * Optional end of a recurring schedule
     */
    private LocalDateTime endTime;

    /**
     * URL notified when a triggered scan finishes
     */
    @Schema(description = "Completion webhook", example = "https://hooks.example.com/scans")
    private String webhook;

    private String description;
}
