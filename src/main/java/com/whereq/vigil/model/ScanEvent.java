package com.whereq.vigil.model;

import com.whereq.vigil.model.report.ScanResult;

/**
 * Typed event published for a scan job.
 * Zero or more {@link Progress} events are followed by exactly one terminal event.
 * {@link #progress()} keeps the numeric sentinel form: 0-100 while running,
 * then 100 (success), -1 (failure or cancellation), -2 (permission denied).
 */
public sealed interface ScanEvent {

    int SUCCESS = 100;
    int FAILURE = -1;
    int PERMISSION_DENIED = -2;

    double progress();

    boolean isTerminal();

    record Progress(double percent) implements ScanEvent {
        @Override
        public double progress() {
            return percent;
        }

        @Override
        public boolean isTerminal() {
            return false;
        }
    }

    record Completed(ScanResult result) implements ScanEvent {
        @Override
        public double progress() {
            return SUCCESS;
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    record Failed(String reason) implements ScanEvent {
        @Override
        public double progress() {
            return FAILURE;
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    record PermissionDenied(String reason) implements ScanEvent {
        @Override
        public double progress() {
            return PERMISSION_DENIED;
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    record Cancelled(String reason) implements ScanEvent {
        @Override
        public double progress() {
            return FAILURE;
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }
}
