package com.sentinel.core.persist;

import com.sentinel.core.model.EventRecord;
import com.sentinel.core.model.Finding;
import com.sentinel.core.model.ScanSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Asynchronous writer in front of a {@link ScanPersistence}.
 *
 * <p>Writes run on a single background thread in submission order. The queue is bounded both
 * by the number of writes and by the raw line bytes of queued events; a write beyond either
 * bound is dropped and logged. Failures of the underlying store are logged and never
 * reach the caller.
 */
public final class PersistenceMirror implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PersistenceMirror.class);

    private final ScanPersistence persistence;
    private final ThreadPoolExecutor executor;
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong pendingBytes = new AtomicLong();
    private final long maxPendingBytes;

    public PersistenceMirror(ScanPersistence persistence, int queueCapacity) {
        this(persistence, queueCapacity, Long.MAX_VALUE);
    }

    /**
     * @param queueCapacity максимум ожидающих записей
     * @param maxPendingBytes максимум байт исходных строк у ожидающих событий; одно событие
     *                        в пустой очереди принимается при любом размере
     */
    public PersistenceMirror(ScanPersistence persistence, int queueCapacity, long maxPendingBytes) {
        this.persistence = persistence;
        this.maxPendingBytes = maxPendingBytes;
        this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(queueCapacity), r -> {
                Thread thread = new Thread(r, "scan-persistence");
                thread.setDaemon(true);
                return thread;
            }, new ThreadPoolExecutor.AbortPolicy());
    }

    public void event(EventRecord event) {
        long size = event.sizeBytes();
        long pending = pendingBytes.addAndGet(size);
        if (pending > maxPendingBytes && pending > size) {
            pendingBytes.addAndGet(-size);
            dropped.incrementAndGet();
            logger.warn("Persistence queue holds {} bytes, dropping event {}", pending - size, event.type());
            return;
        }
        submit("event " + event.type(), () -> persistence.appendEvent(event), size);
    }

    public void finding(String scanId, Finding finding) {
        submit("finding " + finding.getId(), () -> persistence.appendFinding(scanId, finding), 0);
    }

    public void status(ScanSnapshot snapshot) {
        submit("status of " + snapshot.scanId(), () -> persistence.writeStatus(snapshot), 0);
    }

    long getPendingBytes() {
        return pendingBytes.get();
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public long getFailedCount() {
        return failed.get();
    }

    private void submit(String description, PersistenceWrite write, long reservedBytes) {
        try {
            executor.execute(() -> {
                try {
                    write.run();
                } catch (Exception e) {
                    failed.incrementAndGet();
                    logger.warn("Persisting {} failed: {}", description, e.getMessage());
                } finally {
                    pendingBytes.addAndGet(-reservedBytes);
                }
            });
        } catch (RejectedExecutionException e) {
            pendingBytes.addAndGet(-reservedBytes);
            dropped.incrementAndGet();
            logger.warn("Persistence queue is full or closed, dropping {}", description);
        }
    }

    /**
     * Waits for queued writes to finish.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Persistence writer did not finish in time, {} write(s) abandoned",
                    executor.shutdownNow().size());
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @FunctionalInterface
    private interface PersistenceWrite {
        void run() throws Exception;
    }
}
