package com.sentinel.core.scan;

import com.sentinel.core.broadcast.EventSink;
import com.sentinel.core.broadcast.Subscriber;
import com.sentinel.core.broadcast.SubscriberRegistry;
import com.sentinel.core.model.EventKind;
import com.sentinel.core.model.EventRecord;
import com.sentinel.core.model.Finding;
import com.sentinel.core.model.ScanPhase;
import com.sentinel.core.model.ScanSnapshot;
import com.sentinel.core.model.ScanStatus;
import com.sentinel.core.model.WorkerIdentity;
import com.sentinel.core.model.WorkerSnapshot;
import com.sentinel.core.model.WorkerSpec;
import com.sentinel.core.model.WorkerState;
import com.sentinel.core.persist.PersistenceMirror;
import com.sentinel.core.worker.WorkerProcessHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Состояние одного скана: реестр воркеров, журнал событий, находки, счетчики и статус.
 *
 * <p>Все изменения проходят через одну блокировку. Под ней же:
 * <ul>
 *   <li>событие добавляется в журнал</li>
 *   <li>из него извлекается находка</li>
 *   <li>продвигается счетчик завершенных воркеров</li>
 *   <li>событие ставится в очереди подписчиков и в зеркало хранения (без ожидания)</li>
 * </ul>
 * Поэтому читатель никогда не увидит находку без события, а подписчик, подключившийся
 * через {@link #join(EventSink)}, получает журнал без пропусков и повторов.
 *
 * <p>После перехода в STOPPED или COMPLETED вывод воркеров больше не меняет ни журнал,
 * ни находки, ни счетчики, ни статус.
 */
public final class ScanState {
    private static final Logger logger = LoggerFactory.getLogger(ScanState.class);

    private final String scanId;
    private final String targetDescriptor;
    private final Instant startedAt = Instant.now();
    private final WorkerIdentity orchestratorIdentity;
    private final OrchestratorConfig config;
    private final SubscriberRegistry subscribers;
    private final PersistenceMirror persistence;
    private final CountDownLatch terminated = new CountDownLatch(1);

    private final Object lock = new Object();
    private final Map<Integer, WorkerEntry> workers = new LinkedHashMap<>();
    private final List<EventRecord> events = new ArrayList<>();
    private final List<Finding> findings = new ArrayList<>();
    private ScanStatus status = ScanStatus.RUNNING;
    private int completedWorkerCount;
    private Instant endedAt;

    private long retainedPayloadBytes;
    private int screenshotCursor;
    private int compactionCursor;
    private boolean retentionWarned;

    /**
     * Создает состояние и заполняет реестр воркеров по плану.
     * Идентификаторы воркеров выдаются с 1 в порядке выполнения фаз.
     */
    public ScanState(String scanId, String targetDescriptor, ScanPlan plan, OrchestratorConfig config,
                     SubscriberRegistry subscribers, PersistenceMirror persistence) {
        this.scanId = scanId;
        this.targetDescriptor = targetDescriptor;
        this.config = config;
        this.subscribers = subscribers;
        this.persistence = persistence;
        this.orchestratorIdentity = WorkerIdentity.orchestrator(scanId);

        int nextId = 1;
        for (WorkerSpec spec : plan.ordered()) {
            WorkerIdentity identity = new WorkerIdentity(scanId, nextId, spec.role().getTag());
            workers.put(nextId, new WorkerEntry(new PlannedWorker(identity, spec)));
            nextId++;
        }
    }

    public String getScanId() {
        return scanId;
    }

    public String getTargetDescriptor() {
        return targetDescriptor;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public int getTotalWorkerCount() {
        return workers.size();
    }

    public ScanStatus getStatus() {
        synchronized (lock) {
            return status;
        }
    }

    public boolean isTerminal() {
        return getStatus().isTerminal();
    }

    /**
     * Workers of one phase in execution order.
     */
    public List<PlannedWorker> workersIn(ScanPhase phase) {
        List<PlannedWorker> result = new ArrayList<>();
        for (WorkerEntry entry : workers.values()) {
            if (entry.planned.phase() == phase) {
                result.add(entry.planned);
            }
        }
        return result;
    }

    /**
     * Appends one event, extracts its finding, advances completion and broadcasts it.
     *
     * @return {@code false} if the scan is already terminal and the event was discarded
     */
    public boolean record(EventRecord event) {
        synchronized (lock) {
            if (status.isTerminal()) {
                logger.debug("Scan {} is {}, discarding {} from worker {}", scanId, status, event.type(), event.workerId());
                return false;
            }
            appendLocked(event);
            EventKind kind = event.kind();
            if (kind == EventKind.FINDING) {
                Finding.fromEvent(event).ifPresent(finding -> {
                    findings.add(finding);
                    persistence.finding(scanId, finding);
                });
            } else if (kind == EventKind.COMPLETE) {
                WorkerEntry entry = workers.get(event.workerId());
                if (entry != null) {
                    markCompletedLocked(entry);
                }
            }
            return true;
        }
    }

    /**
     * Привязывает запущенный процесс к записи воркера.
     *
     * @return {@code false} если скан уже остановлен; вызывающий должен сам убить процесс
     */
    public boolean attachHandle(int workerId, WorkerProcessHandle handle) {
        synchronized (lock) {
            WorkerEntry entry = entry(workerId);
            entry.handle = handle;
            entry.state = WorkerState.RUNNING;
            return !status.isTerminal();
        }
    }

    /**
     * Records the end of a worker: exited, failed to spawn or skipped after a stop.
     * A worker that has not reported completion yet counts as completed now,
     * unless the scan is already terminal.
     */
    public void markWorkerFinished(int workerId, WorkerState finalState, Integer exitCode) {
        if (!finalState.isFinished()) {
            throw new IllegalArgumentException("Not a final worker state: " + finalState);
        }
        synchronized (lock) {
            WorkerEntry entry = entry(workerId);
            entry.state = finalState;
            entry.exitCode = exitCode;
            entry.handle = null;
            if (!status.isTerminal()) {
                markCompletedLocked(entry);
            }
        }
    }

    /**
     * Переводит скан в STOPPED, если он еще идет. Рассылает событие остановки,
     * закрывает каналы подписчиков после доставки и посылает kill всем живым процессам,
     * не дожидаясь их завершения.
     *
     * @return {@code true} если этот вызов выполнил переход
     */
    public boolean stop(String reason) {
        List<WorkerProcessHandle> handles = new ArrayList<>();
        synchronized (lock) {
            if (status.isTerminal()) {
                return false;
            }
            status = ScanStatus.STOPPED;
            endedAt = Instant.now();
            for (WorkerEntry entry : workers.values()) {
                if (entry.handle != null) {
                    handles.add(entry.handle);
                }
            }
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("message", "Scan stopped");
            data.put("reason", reason);
            data.put("totalFindings", findings.size());
            data.put("completedWorkers", completedWorkerCount);
            data.put("totalWorkers", workers.size());
            appendLocked(EventRecord.synthetic(EventKind.SCAN_STOPPED, orchestratorIdentity, data));
            finishLocked();
        }
        logger.info("Scan {} stopped ({}), killing {} running worker(s)", scanId, reason, handles.size());
        for (WorkerProcessHandle handle : handles) {
            handle.kill();
        }
        return true;
    }

    /**
     * Переводит скан в COMPLETED, если его не опередила остановка.
     *
     * @return {@code true} если этот вызов выполнил переход
     * @throws IllegalStateException если какой-либо воркер еще не завершился
     */
    public boolean complete() {
        synchronized (lock) {
            if (status.isTerminal()) {
                return false;
            }
            for (WorkerEntry entry : workers.values()) {
                if (!entry.state.isFinished()) {
                    throw new IllegalStateException("Scan " + scanId + " cannot complete, worker "
                        + entry.planned.workerId() + " is " + entry.state);
                }
            }
            status = ScanStatus.COMPLETED;
            endedAt = Instant.now();
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("totalFindings", findings.size());
            data.put("completedWorkers", completedWorkerCount);
            data.put("totalWorkers", workers.size());
            appendLocked(EventRecord.synthetic(EventKind.SCAN_COMPLETE, orchestratorIdentity, data));
            finishLocked();
        }
        logger.info("Scan {} completed with {} finding(s)", scanId, findings.size());
        return true;
    }

    /**
     * Подключает наблюдателя: снимок журнала и регистрация на живую доставку
     * выполняются атомарно относительно {@link #record(EventRecord)}.
     */
    public Subscriber join(EventSink sink) {
        synchronized (lock) {
            return subscribers.register(sink, new ArrayList<>(events));
        }
    }

    public void leave(Subscriber subscriber) {
        subscribers.leave(subscriber);
    }

    /**
     * Copy of the retained event log in append order.
     */
    public List<EventRecord> events() {
        synchronized (lock) {
            return new ArrayList<>(events);
        }
    }

    public ScanSnapshot snapshot() {
        synchronized (lock) {
            return snapshotLocked();
        }
    }

    /**
     * Blocks until the scan reaches a terminal status.
     *
     * @return {@code true} if terminal, {@code false} on timeout
     */
    public boolean awaitTerminal(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    long getRetainedPayloadBytes() {
        synchronized (lock) {
            return retainedPayloadBytes;
        }
    }

    private WorkerEntry entry(int workerId) {
        WorkerEntry entry = workers.get(workerId);
        if (entry == null) {
            throw new IllegalStateException("Scan " + scanId + " has no worker " + workerId);
        }
        return entry;
    }

    private void markCompletedLocked(WorkerEntry entry) {
        if (entry.completed) {
            return;
        }
        if (completedWorkerCount >= workers.size()) {
            throw new IllegalStateException("Scan " + scanId + " completion count would exceed "
                + workers.size());
        }
        entry.completed = true;
        completedWorkerCount++;
    }

    private void appendLocked(EventRecord event) {
        events.add(event);
        retainedPayloadBytes += event.sizeBytes();
        subscribers.publish(event);
        persistence.event(event);
        if (retainedPayloadBytes > config.getMaxRetainedPayloadBytes()) {
            compactLocked();
        }
    }

    private void finishLocked() {
        subscribers.closeAll();
        persistence.status(snapshotLocked());
        terminated.countDown();
    }

    /**
     * Сжимает самые старые крупные события, пока объем журнала не уложится в лимит:
     * сначала скриншоты, затем любые другие крупные события.
     */
    private void compactLocked() {
        long limit = config.getMaxRetainedPayloadBytes();
        int threshold = config.getCompactionThresholdBytes();
        while (retainedPayloadBytes > limit && screenshotCursor < events.size()) {
            int index = screenshotCursor++;
            EventRecord event = events.get(index);
            if (event.kind() == EventKind.SCREENSHOT && event.sizeBytes() > threshold) {
                compactAt(index);
            }
        }
        while (retainedPayloadBytes > limit && compactionCursor < events.size()) {
            int index = compactionCursor++;
            if (events.get(index).sizeBytes() > threshold) {
                compactAt(index);
            }
        }
        if (retainedPayloadBytes > limit && !retentionWarned) {
            retentionWarned = true;
            logger.warn("Scan {} retains {} payload bytes above the {} byte limit, nothing left to compact",
                scanId, retainedPayloadBytes, limit);
        }
    }

    private void compactAt(int index) {
        EventRecord original = events.get(index);
        EventRecord compacted = PayloadCompactor.compact(original);
        if (compacted != original) {
            events.set(index, compacted);
            retainedPayloadBytes -= original.sizeBytes() - compacted.sizeBytes();
            logger.debug("Scan {} compacted event #{} ({}) from {} to {} bytes",
                scanId, index, original.type(), original.sizeBytes(), compacted.sizeBytes());
        }
    }

    private ScanSnapshot snapshotLocked() {
        List<WorkerSnapshot> roster = new ArrayList<>(workers.size());
        for (WorkerEntry entry : workers.values()) {
            roster.add(entry.snapshot());
        }
        return new ScanSnapshot(scanId, targetDescriptor, status, completedWorkerCount, workers.size(),
            events.size(), findings, roster, startedAt, endedAt);
    }
}
