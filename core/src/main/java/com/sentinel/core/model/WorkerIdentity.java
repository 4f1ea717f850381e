package com.sentinel.core.model;

/**
 * Who a stream of protocol lines belongs to. Known by the orchestrator, never taken from the line.
 *
 * @param scanId owning scan
 * @param workerId worker identifier, unique within the scan (0 is reserved for the orchestrator)
 * @param role role tag
 */
public record WorkerIdentity(String scanId, int workerId, String role) {

    public static final int ORCHESTRATOR_ID = 0;
    public static final String ORCHESTRATOR_ROLE = "orchestrator";

    public static WorkerIdentity orchestrator(String scanId) {
        return new WorkerIdentity(scanId, ORCHESTRATOR_ID, ORCHESTRATOR_ROLE);
    }
}
