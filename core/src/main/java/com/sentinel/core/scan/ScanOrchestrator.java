package com.sentinel.core.scan;

import com.sentinel.core.model.EventKind;
import com.sentinel.core.model.EventRecord;
import com.sentinel.core.model.ScanPhase;
import com.sentinel.core.model.WorkerIdentity;
import com.sentinel.core.model.WorkerState;
import com.sentinel.core.protocol.EventLineCodec;
import com.sentinel.core.protocol.RawLine;
import com.sentinel.core.worker.SpawnException;
import com.sentinel.core.worker.WorkerLauncher;
import com.sentinel.core.worker.WorkerProcessHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Проводит один скан от начала до терминального статуса.
 *
 * <p>Фазы выполняются строго друг за другом:
 * <ol>
 *   <li>MAPPING - не более одного воркера, разведка поверхности атаки</li>
 *   <li>PARALLEL - все воркеры стартуют одновременно, фаза заканчивается с последним из них</li>
 *   <li>RATE_LIMITED - воркеры с общей внешней квотой, по одному</li>
 * </ol>
 *
 * <p>Падение, мусорный вывод или ненулевой код выхода отдельного воркера не проваливают скан:
 * сбой записывается событием, фаза продолжается. Исключения выходят наружу только
 * при нарушении собственного учета оркестратора.
 */
public final class ScanOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(ScanOrchestrator.class);

    static final String REASON_SPAWN_FAILED = "spawn_failed";
    static final String REASON_CRASH = "crash";
    static final String REASON_READ_FAILED = "read_failed";

    private final WorkerLauncher launcher;
    private final EventLineCodec codec;
    private final ExecutorService workerExecutor;

    /**
     * @param launcher запуск процессов воркеров
     * @param codec декодер строк протокола
     * @param workerExecutor пул для воркеров параллельной фазы; должен допускать
     *                       одновременное выполнение всех воркеров фазы
     */
    public ScanOrchestrator(WorkerLauncher launcher, EventLineCodec codec, ExecutorService workerExecutor) {
        this.launcher = launcher;
        this.codec = codec;
        this.workerExecutor = workerExecutor;
    }

    /**
     * Runs every phase of the scan and finalizes its status. Returns once the scan is
     * terminal and every worker started by this call has exited.
     */
    public void runScan(ScanState state) {
        logger.info("Scan {} started against {} with {} worker(s)",
            state.getScanId(), state.getTargetDescriptor(), state.getTotalWorkerCount());

        for (ScanPhase phase : ScanPhase.values()) {
            List<PlannedWorker> workers = state.workersIn(phase);
            if (workers.isEmpty()) {
                continue;
            }
            if (state.isTerminal()) {
                skipAll(state, workers);
                continue;
            }
            logger.info("Scan {} entering {} phase with {} worker(s)", state.getScanId(), phase, workers.size());
            if (phase.isConcurrent()) {
                runConcurrently(state, workers);
            } else {
                runSequentially(state, workers);
            }
        }

        if (!state.complete()) {
            logger.info("Scan {} finished after stop, status {}", state.getScanId(), state.getStatus());
        }
    }

    private void runSequentially(ScanState state, List<PlannedWorker> workers) {
        for (PlannedWorker worker : workers) {
            if (state.isTerminal()) {
                state.markWorkerFinished(worker.workerId(), WorkerState.SKIPPED, null);
                continue;
            }
            runWorker(state, worker);
        }
    }

    private void runConcurrently(ScanState state, List<PlannedWorker> workers) {
        List<Future<?>> futures = new ArrayList<>(workers.size());
        List<AtomicBoolean> claims = new ArrayList<>(workers.size());
        for (PlannedWorker worker : workers) {
            AtomicBoolean claimed = new AtomicBoolean();
            claims.add(claimed);
            futures.add(workerExecutor.submit(() -> {
                if (claimed.compareAndSet(false, true)) {
                    runWorker(state, worker);
                }
            }));
        }
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                throw new IllegalStateException("Worker task of scan " + state.getScanId() + " failed", cause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Scan {} interrupted during the {} phase", state.getScanId(), workers.get(0).phase());
                state.stop("interrupted");
                futures.forEach(f -> f.cancel(true));
                // задачи, которые пул так и не запустил, сами себя не отметят
                for (int i = 0; i < workers.size(); i++) {
                    if (claims.get(i).compareAndSet(false, true)) {
                        state.markWorkerFinished(workers.get(i).workerId(), WorkerState.SKIPPED, null);
                    }
                }
                return;
            }
        }
    }

    private void skipAll(ScanState state, List<PlannedWorker> workers) {
        for (PlannedWorker worker : workers) {
            state.markWorkerFinished(worker.workerId(), WorkerState.SKIPPED, null);
        }
    }

    /**
     * Spawn one worker, drain its stdout into the scan state, wait for its exit.
     */
    void runWorker(ScanState state, PlannedWorker worker) {
        WorkerIdentity identity = worker.identity();
        WorkerProcessHandle handle;
        try {
            handle = launcher.launch(identity, worker.spec(), state.getTargetDescriptor());
        } catch (SpawnException e) {
            logger.warn("Scan {}: worker {} ({}) failed to spawn: {}",
                identity.scanId(), identity.workerId(), identity.role(), e.getMessage());
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("message", e.getMessage());
            data.put("reason", REASON_SPAWN_FAILED);
            data.put("command", String.join(" ", worker.spec().command()));
            state.record(EventRecord.synthetic(EventKind.ERROR, identity, data));
            state.markWorkerFinished(identity.workerId(), WorkerState.SPAWN_FAILED, null);
            return;
        }

        Integer exitCode = null;
        try (handle) {
            if (!state.attachHandle(identity.workerId(), handle)) {
                // stopped between launch and attach, nobody else knows about this process
                handle.kill();
            }
            drain(state, identity, handle);
            exitCode = handle.waitFor();
            if (exitCode != 0 && !handle.isKilled()) {
                recordCrash(state, identity, exitCode, handle.getStderrTail());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Scan {}: interrupted while waiting for worker {}", identity.scanId(), identity.workerId());
        } finally {
            state.markWorkerFinished(identity.workerId(), WorkerState.EXITED, exitCode);
        }
        logger.info("Scan {}: worker {} ({}) exited with code {}",
            identity.scanId(), identity.workerId(), identity.role(), exitCode);
    }

    private void drain(ScanState state, WorkerIdentity identity, WorkerProcessHandle handle) {
        try (Stream<RawLine> lines = handle.streamLines()) {
            lines.filter(line -> !line.isBlank())
                .map(line -> codec.decode(line, identity))
                .forEach(state::record);
        } catch (UncheckedIOException e) {
            logger.warn("Scan {}: reading output of worker {} failed: {}",
                identity.scanId(), identity.workerId(), e.getCause().getMessage());
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("level", "WARN");
            data.put("message", "Output stream failed: " + e.getCause().getMessage());
            data.put("reason", REASON_READ_FAILED);
            state.record(EventRecord.synthetic(EventKind.LOG, identity, data));
        }
    }

    private void recordCrash(ScanState state, WorkerIdentity identity, int exitCode, List<String> stderrTail) {
        logger.warn("Scan {}: worker {} ({}) crashed with exit code {}",
            identity.scanId(), identity.workerId(), identity.role(), exitCode);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("level", "ERROR");
        data.put("message", "Worker exited with code " + exitCode);
        data.put("reason", REASON_CRASH);
        data.put("exitCode", exitCode);
        data.put("stderrTail", stderrTail);
        state.record(EventRecord.synthetic(EventKind.LOG, identity, data));
    }
}
