package com.sentinel.core.model;

/**
 * Lifecycle of one planned worker as seen by the orchestrator.
 */
public enum WorkerState {
    PENDING,
    RUNNING,
    EXITED,
    SPAWN_FAILED,
    SKIPPED;

    public boolean isFinished() {
        return this == EXITED || this == SPAWN_FAILED || this == SKIPPED;
    }
}
