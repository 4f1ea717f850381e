package com.sentinel.core.scan;

import com.sentinel.core.model.WorkerSnapshot;
import com.sentinel.core.model.WorkerState;
import com.sentinel.core.worker.WorkerProcessHandle;

/**
 * Mutable roster entry. Guarded by the owning {@link ScanState}'s lock.
 */
final class WorkerEntry {
    final PlannedWorker planned;
    WorkerState state = WorkerState.PENDING;
    boolean completed;
    Integer exitCode;
    WorkerProcessHandle handle;

    WorkerEntry(PlannedWorker planned) {
        this.planned = planned;
    }

    WorkerSnapshot snapshot() {
        return new WorkerSnapshot(planned.workerId(), planned.identity().role(), planned.phase(),
            state, completed, exitCode);
    }
}
