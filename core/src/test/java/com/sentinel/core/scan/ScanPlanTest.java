package com.sentinel.core.scan;

import com.sentinel.core.model.ScanPhase;
import com.sentinel.core.model.WorkerRole;
import com.sentinel.core.model.WorkerSpec;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScanPlanTest {

    @Test
    void testGroupsWorkersByPhase() {
        ScanPlan plan = ScanPlan.of(List.of(
            WorkerSpec.of(WorkerRole.RED_TEAM, "r"),
            WorkerSpec.of(WorkerRole.XSS, "x"),
            WorkerSpec.of(WorkerRole.SPIDER, "s"),
            WorkerSpec.of(WorkerRole.LLM_ANALYSIS, "l"),
            WorkerSpec.of(WorkerRole.CORS, "c")));

        assertEquals(5, plan.size());
        assertEquals(1, plan.workersIn(ScanPhase.MAPPING).size());
        assertEquals(List.of(WorkerRole.XSS, WorkerRole.CORS),
            plan.workersIn(ScanPhase.PARALLEL).stream().map(WorkerSpec::role).toList());
        assertEquals(List.of(WorkerRole.RED_TEAM, WorkerRole.LLM_ANALYSIS),
            plan.workersIn(ScanPhase.RATE_LIMITED).stream().map(WorkerSpec::role).toList());
        assertEquals(WorkerRole.SPIDER, plan.ordered().get(0).role());
    }

    @Test
    void testRejectsSecondMappingWorker() {
        List<WorkerSpec> specs = List.of(WorkerSpec.of(WorkerRole.SPIDER, "a"), WorkerSpec.of(WorkerRole.SPIDER, "b"));

        assertThrows(IllegalArgumentException.class, () -> ScanPlan.of(specs));
    }

    @Test
    void testRejectsEmptyPlan() {
        assertThrows(IllegalArgumentException.class, () -> ScanPlan.of(List.of()));
        assertThrows(IllegalArgumentException.class, () -> ScanPlan.of(null));
    }
}
