package com.sentinel.core.scan;

import com.sentinel.core.model.ScanPhase;
import com.sentinel.core.model.WorkerIdentity;
import com.sentinel.core.model.WorkerSpec;

/**
 * A worker of a registered scan: its assigned identity and how to launch it.
 */
public record PlannedWorker(WorkerIdentity identity, WorkerSpec spec) {

    public int workerId() {
        return identity.workerId();
    }

    public ScanPhase phase() {
        return spec.role().getPhase();
    }
}
