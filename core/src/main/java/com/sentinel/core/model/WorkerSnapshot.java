package com.sentinel.core.model;

/**
 * Read-only view of one worker entry.
 *
 * @param workerId worker identifier
 * @param role role tag
 * @param phase phase the worker runs in
 * @param state lifecycle state
 * @param completed whether the worker counted towards {@code completedWorkerCount}
 * @param exitCode process exit code, {@code null} while running or when never spawned
 */
public record WorkerSnapshot(
    int workerId,
    String role,
    ScanPhase phase,
    WorkerState state,
    boolean completed,
    Integer exitCode
) {}
