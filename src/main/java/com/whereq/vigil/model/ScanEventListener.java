package com.whereq.vigil.model;

/**
 * Observer for per-job scan events.
 */
@FunctionalInterface
public interface ScanEventListener {

    void onEvent(String jobId, ScanEvent event);

    ScanEventListener NONE = (jobId, event) -> { };
}
