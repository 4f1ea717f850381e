package com.sentinel.core.scan;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinel.core.broadcast.EventSink;
import com.sentinel.core.broadcast.Subscriber;
import com.sentinel.core.broadcast.SubscriberRegistry;
import com.sentinel.core.model.EventRecord;
import com.sentinel.core.model.ScanSnapshot;
import com.sentinel.core.model.WorkerSpec;
import com.sentinel.core.persist.PersistenceMirror;
import com.sentinel.core.persist.ScanPersistence;
import com.sentinel.core.protocol.EventLineCodec;
import com.sentinel.core.worker.ProcessWorkerLauncher;
import com.sentinel.core.worker.WorkerLauncher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Точка управления сканами для HTTP и CLI слоев.
 *
 * <p>Методы - тонкие обращения к {@link ScanRegistry} и {@link ScanOrchestrator},
 * собственной логики оркестрации здесь нет. Каждый скан выполняется отдельной задачей
 * в фоновом пуле.
 */
public final class ScanManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ScanManager.class);

    private final OrchestratorConfig config;
    private final ScanRegistry registry = new ScanRegistry();
    private final ScanOrchestrator orchestrator;
    private final PersistenceMirror persistence;
    private final ExecutorService scanExecutor;
    private final ExecutorService workerExecutor;
    private final ExecutorService deliveryExecutor;
    private volatile boolean shutdown;

    public ScanManager(OrchestratorConfig config, WorkerLauncher launcher, ScanPersistence persistence) {
        this.config = config;
        this.persistence = new PersistenceMirror(persistence, config.getPersistenceQueueCapacity(),
            config.getPersistenceQueueBytes());
        this.scanExecutor = Executors.newCachedThreadPool(daemonThreads("scan"));
        this.workerExecutor = Executors.newCachedThreadPool(daemonThreads("scan-worker"));
        this.deliveryExecutor = Executors.newCachedThreadPool(daemonThreads("scan-delivery"));
        this.orchestrator = new ScanOrchestrator(launcher,
            new EventLineCodec(new ObjectMapper(), config.getMaxLineBytes()), workerExecutor);
    }

    public ScanManager(OrchestratorConfig config, ScanPersistence persistence) {
        this(config, new ProcessWorkerLauncher(config.getMaxLineBytes(), config.getStderrTailLines(),
            config.getWorkingDirectory()), persistence);
    }

    public ScanManager(OrchestratorConfig config) {
        this(config, ScanPersistence.noOp());
    }

    /**
     * Регистрирует скан и запускает его в фоне.
     *
     * @param targetDescriptor цель сканирования
     * @param specs воркеры скана
     * @return идентификатор скана
     * @throws IllegalArgumentException если цель пуста или план воркеров некорректен
     * @throws IllegalStateException если менеджер уже остановлен
     */
    public String startScan(String targetDescriptor, List<WorkerSpec> specs) {
        if (targetDescriptor == null || targetDescriptor.isBlank()) {
            throw new IllegalArgumentException("Target cannot be empty");
        }
        if (shutdown) {
            throw new IllegalStateException("Scan manager is shut down");
        }
        ScanPlan plan = ScanPlan.of(specs);
        String scanId = UUID.randomUUID().toString();
        SubscriberRegistry subscribers = new SubscriberRegistry(scanId, deliveryExecutor,
            config.getSubscriberBacklog(), config.getSubscriberBacklogBytes());
        ScanState state = registry.register(
            new ScanState(scanId, targetDescriptor, plan, config, subscribers, persistence));

        scanExecutor.execute(() -> runSafely(state));
        logger.info("Scan {} registered for {} with {} worker(s)", scanId, targetDescriptor, plan.size());
        return scanId;
    }

    private void runSafely(ScanState state) {
        try {
            orchestrator.runScan(state);
        } catch (RuntimeException e) {
            logger.error("Scan {} aborted by an internal error", state.getScanId(), e);
            state.stop("internal_error");
        }
    }

    public Optional<ScanSnapshot> getScanState(String scanId) {
        return registry.get(scanId).map(ScanState::snapshot);
    }

    public List<ScanSnapshot> listScans() {
        return registry.getAll().stream()
            .map(ScanState::snapshot)
            .toList();
    }

    /**
     * Останавливает скан, не дожидаясь завершения процессов.
     *
     * @return {@code false} если скан неизвестен; повторная остановка или остановка
     *         завершенного скана подтверждается без изменений
     */
    public boolean stopScan(String scanId) {
        Optional<ScanState> state = registry.get(scanId);
        state.ifPresent(s -> s.stop("requested"));
        return state.isPresent();
    }

    public Optional<Subscriber> join(String scanId, EventSink sink) {
        return registry.get(scanId).map(state -> state.join(sink));
    }

    public void leave(Subscriber subscriber) {
        registry.get(subscriber.getScanId()).ifPresent(state -> state.leave(subscriber));
    }

    public Optional<List<EventRecord>> events(String scanId) {
        return registry.get(scanId).map(ScanState::events);
    }

    public boolean evict(String scanId) {
        return registry.evict(scanId);
    }

    /**
     * Ждет терминального статуса скана.
     *
     * @return снимок на момент выхода (статус RUNNING означает истечение таймаута), пусто если скан неизвестен
     */
    public Optional<ScanSnapshot> awaitScan(String scanId, Duration timeout) throws InterruptedException {
        Optional<ScanState> state = registry.get(scanId);
        if (state.isEmpty()) {
            return Optional.empty();
        }
        state.get().awaitTerminal(timeout);
        return Optional.of(state.get().snapshot());
    }

    /**
     * Останавливает все идущие сканы и завершает пулы потоков с ограниченным ожиданием.
     */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        List<ScanState> running = registry.getRunning();
        if (!running.isEmpty()) {
            logger.info("Stopping {} running scan(s)", running.size());
        }
        for (ScanState state : running) {
            state.stop("shutdown");
        }

        long timeoutMs = config.getShutdownTimeout().toMillis();
        scanExecutor.shutdown();
        workerExecutor.shutdown();
        try {
            if (!scanExecutor.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                scanExecutor.shutdownNow();
            }
            if (!workerExecutor.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                workerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            scanExecutor.shutdownNow();
            workerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        deliveryExecutor.shutdown();
        persistence.close();
        logger.info("Scan manager shut down");
    }

    @Override
    public void close() {
        shutdown();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
