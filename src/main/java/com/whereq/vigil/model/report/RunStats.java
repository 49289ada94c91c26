package com.whereq.vigil.model.report;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Top-level run statistics ({@code runstats} element). Absent values are null.
 */
@Value
@Builder
@Jacksonized
public class RunStats {
    Long finishedTime;
    String finishedTimeStr;
    Double elapsedSeconds;
    String summary;
    Integer hostsUp;
    Integer hostsDown;
    Integer hostsTotal;
}
