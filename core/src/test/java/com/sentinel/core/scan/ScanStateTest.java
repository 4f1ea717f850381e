package com.sentinel.core.scan;

import com.sentinel.core.broadcast.CollectingSink;
import com.sentinel.core.broadcast.SubscriberRegistry;
import com.sentinel.core.model.EventKind;
import com.sentinel.core.model.EventRecord;
import com.sentinel.core.model.ScanSnapshot;
import com.sentinel.core.model.ScanStatus;
import com.sentinel.core.model.WorkerIdentity;
import com.sentinel.core.model.WorkerRole;
import com.sentinel.core.model.WorkerSpec;
import com.sentinel.core.model.WorkerState;
import com.sentinel.core.persist.PersistenceMirror;
import com.sentinel.core.persist.ScanPersistence;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ScanStateTest {

    private final PersistenceMirror persistence = new PersistenceMirror(ScanPersistence.noOp(), 100);

    @AfterEach
    void tearDown() {
        persistence.close();
    }

    private ScanState newState(OrchestratorConfig config, WorkerSpec... specs) {
        return new ScanState("scan-1", "https://target.example", ScanPlan.of(List.of(specs)), config,
            new SubscriberRegistry("scan-1", Runnable::run, config.getSubscriberBacklog()), persistence);
    }

    private ScanState newState(WorkerSpec... specs) {
        return newState(OrchestratorConfig.defaults(), specs);
    }

    private static WorkerIdentity worker(int id, String role) {
        return new WorkerIdentity("scan-1", id, role);
    }

    private static EventRecord log(WorkerIdentity worker, int seq) {
        return EventRecord.synthetic(EventKind.LOG, worker, Map.of("seq", seq));
    }

    private static EventRecord finding(WorkerIdentity worker, String severity) {
        return EventRecord.synthetic(EventKind.FINDING, worker,
            Map.of("vulnerability", Map.of("type", "XSS", "severity", severity)));
    }

    @Test
    void testWorkerIdsFollowPhaseOrder() {
        ScanState state = newState(
            WorkerSpec.of(WorkerRole.LLM_ANALYSIS, "a"),
            WorkerSpec.of(WorkerRole.CORS, "b"),
            WorkerSpec.of(WorkerRole.SPIDER, "c"));

        ScanSnapshot snapshot = state.snapshot();

        assertEquals(3, snapshot.totalWorkerCount());
        assertEquals("spider", snapshot.workers().get(0).role());
        assertEquals("cors", snapshot.workers().get(1).role());
        assertEquals("llm_analysis", snapshot.workers().get(2).role());
        assertEquals(1, snapshot.workers().get(0).workerId());
        assertEquals(ScanStatus.RUNNING, snapshot.status());
    }

    @Test
    void testLateJoinerGetsReplayThenLiveWithoutGapOrDuplicate() {
        ScanState state = newState(WorkerSpec.of(WorkerRole.XSS, "x"));
        WorkerIdentity xss = worker(1, "xss");
        for (int i = 1; i <= 5; i++) {
            state.record(log(xss, i));
        }

        CollectingSink sink = new CollectingSink();
        state.join(sink);
        state.record(log(xss, 6));

        List<EventRecord> received = sink.received();
        assertEquals(6, received.size());
        for (int i = 0; i < 6; i++) {
            assertEquals(i + 1, received.get(i).data().get("seq"));
        }
    }

    @Test
    void testConcurrentJoinsSeeGlobalOrder() throws Exception {
        ScanState state = newState(WorkerSpec.of(WorkerRole.XSS, "x"), WorkerSpec.of(WorkerRole.SQLI, "y"));
        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<CollectingSink> sinks = new ArrayList<>();
        CountDownLatch go = new CountDownLatch(1);
        try {
            for (int w = 1; w <= 2; w++) {
                WorkerIdentity identity = worker(w, w == 1 ? "xss" : "sqli");
                pool.execute(() -> {
                    awaitQuietly(go);
                    for (int i = 0; i < 500; i++) {
                        state.record(log(identity, i));
                    }
                });
            }
            for (int s = 0; s < 10; s++) {
                CollectingSink sink = new CollectingSink();
                sinks.add(sink);
                pool.execute(() -> {
                    awaitQuietly(go);
                    state.join(sink);
                });
            }
            go.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        List<EventRecord> log = state.events();
        assertEquals(1000, log.size());
        for (CollectingSink sink : sinks) {
            assertEquals(log, sink.received());
        }
    }

    @Test
    void testFindingAndCompletionAreExtractedWithTheirEvent() {
        ScanState state = newState(WorkerSpec.of(WorkerRole.XSS, "x"), WorkerSpec.of(WorkerRole.SQLI, "y"));
        WorkerIdentity xss = worker(1, "xss");

        state.record(finding(xss, "HIGH"));
        state.record(EventRecord.synthetic(EventKind.COMPLETE, xss, Map.of()));
        state.record(EventRecord.synthetic(EventKind.COMPLETE, xss, Map.of()));

        ScanSnapshot snapshot = state.snapshot();
        assertEquals(3, snapshot.eventCount());
        assertEquals(1, snapshot.findingCount());
        assertEquals(1, snapshot.completedWorkerCount());
        assertTrue(snapshot.workers().get(0).completed());
    }

    @Test
    void testCompletionCountsOncePerWorkerAcrossCompleteAndExit() {
        ScanState state = newState(WorkerSpec.of(WorkerRole.XSS, "x"), WorkerSpec.of(WorkerRole.SQLI, "y"));

        state.record(EventRecord.synthetic(EventKind.COMPLETE, worker(1, "xss"), Map.of()));
        state.markWorkerFinished(1, WorkerState.EXITED, 0);
        state.markWorkerFinished(2, WorkerState.SPAWN_FAILED, null);

        assertEquals(2, state.snapshot().completedWorkerCount());
        assertTrue(state.complete());
    }

    @Test
    void testCompletedCountIsMonotonicAndBoundedUnderConcurrency() throws Exception {
        int workers = 16;
        WorkerSpec[] specs = new WorkerSpec[workers];
        for (int i = 0; i < workers; i++) {
            specs[i] = WorkerSpec.of(WorkerRole.CUSTOM, "w" + i);
        }
        ScanState state = newState(specs);
        AtomicBoolean running = new AtomicBoolean(true);
        AtomicReference<String> violation = new AtomicReference<>();

        Thread observer = new Thread(() -> {
            int last = 0;
            while (running.get()) {
                ScanSnapshot snapshot = state.snapshot();
                if (snapshot.completedWorkerCount() < last
                        || snapshot.completedWorkerCount() > snapshot.totalWorkerCount()) {
                    violation.set("observed " + snapshot.completedWorkerCount() + " after " + last);
                }
                last = snapshot.completedWorkerCount();
            }
        });
        observer.start();

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            for (int id = 1; id <= workers; id++) {
                int workerId = id;
                pool.execute(() -> {
                    WorkerIdentity identity = worker(workerId, "custom");
                    for (int i = 0; i < 3; i++) {
                        state.record(EventRecord.synthetic(EventKind.COMPLETE, identity, Map.of()));
                    }
                    state.markWorkerFinished(workerId, WorkerState.EXITED, 0);
                });
            }
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        } finally {
            running.set(false);
            observer.join();
            pool.shutdownNow();
        }

        assertNull(violation.get());
        assertEquals(workers, state.snapshot().completedWorkerCount());
    }

    @Test
    void testTerminalStateIsIdempotent() {
        ScanState state = newState(WorkerSpec.of(WorkerRole.XSS, "x"));
        WorkerIdentity xss = worker(1, "xss");
        state.record(finding(xss, "LOW"));
        CollectingSink sink = new CollectingSink();
        state.join(sink);

        assertTrue(state.stop("requested"));
        assertFalse(state.stop("requested"));
        assertFalse(state.complete());

        ScanSnapshot before = state.snapshot();
        assertFalse(state.record(finding(xss, "CRITICAL")));
        assertFalse(state.record(EventRecord.synthetic(EventKind.COMPLETE, xss, Map.of())));
        state.markWorkerFinished(1, WorkerState.EXITED, 0);
        ScanSnapshot after = state.snapshot();

        assertEquals(ScanStatus.STOPPED, after.status());
        assertEquals(before.findingCount(), after.findingCount());
        assertEquals(before.eventCount(), after.eventCount());
        assertEquals(0, after.completedWorkerCount());
        assertNotNull(after.endedAt());
        assertEquals(List.of("vulnerability.found", "scan.stopped"), sink.types());
        assertTrue(sink.isClosed());
    }

    @Test
    void testCompleteRequiresEveryWorkerFinished() {
        ScanState state = newState(WorkerSpec.of(WorkerRole.XSS, "x"));

        assertThrows(IllegalStateException.class, state::complete);

        state.markWorkerFinished(1, WorkerState.EXITED, 1);
        assertTrue(state.complete());
        List<EventRecord> events = state.events();
        EventRecord terminal = events.get(events.size() - 1);
        assertEquals(EventKind.SCAN_COMPLETE, terminal.kind());
        assertEquals(0, terminal.data().get("totalFindings"));
        assertEquals(WorkerIdentity.ORCHESTRATOR_ID, terminal.workerId());
    }

    @Test
    void testUnknownWorkerIsBookkeepingDefect() {
        ScanState state = newState(WorkerSpec.of(WorkerRole.XSS, "x"));

        assertThrows(IllegalStateException.class, () -> state.markWorkerFinished(9, WorkerState.EXITED, 0));
    }

    @Test
    void testOldestScreenshotsAreCompactedFirst() {
        OrchestratorConfig config = OrchestratorConfig.builder()
            .maxRetainedPayloadBytes(30_000)
            .compactionThresholdBytes(5_000)
            .build();
        ScanState state = newState(config, WorkerSpec.of(WorkerRole.SPIDER, "s"));
        WorkerIdentity spider = worker(1, "spider");
        String image = "A".repeat(10_000);

        state.record(new EventRecord("agent.log", 1, "spider", "scan-1", Map.of("message", "B".repeat(10_000)), 1, 10_050));
        for (int i = 0; i < 3; i++) {
            state.record(new EventRecord("agent.screenshot", 1, "spider", "scan-1",
                Map.of("image", image, "step", i), 2 + i, 10_050));
        }
        state.record(finding(spider, "HIGH"));

        List<EventRecord> events = state.events();
        assertEquals(5, events.size());
        assertEquals("[compacted 10000 bytes]", events.get(1).data().get("image"));
        assertEquals(0, events.get(1).data().get("step"));
        assertEquals(image, events.get(3).data().get("image"));
        assertEquals(10_000, ((String) events.get(0).data().get("message")).length());
        assertEquals(1, state.snapshot().findingCount());
        assertTrue(state.getRetainedPayloadBytes() <= 30_000);
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
