package com.sentinel.core.broadcast;

import com.sentinel.core.model.EventRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * One live observer of a scan.
 *
 * <p>Publishing never blocks: events are queued and delivered to the {@link EventSink}
 * by at most one task at a time on the delivery executor, so per-subscriber order equals
 * enqueue order. Replay events do not count against the live backlog limits; a subscriber
 * whose undelivered live backlog exceeds either the event limit or the byte limit is dropped.
 * A single live event is always accepted into an empty backlog, whatever its size.
 */
public final class Subscriber {
    private static final Logger logger = LoggerFactory.getLogger(Subscriber.class);

    private final String id = UUID.randomUUID().toString();
    private final String scanId;
    private final EventSink sink;
    private final Executor deliveryExecutor;
    private final int backlogLimit;
    private final long backlogBytesLimit;
    private final Consumer<Subscriber> onFailure;

    private final Queue<Envelope> queue = new ConcurrentLinkedQueue<>();
    private final AtomicInteger liveBacklog = new AtomicInteger();
    private final AtomicLong liveBacklogBytes = new AtomicLong();
    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicBoolean failed = new AtomicBoolean();
    private final AtomicBoolean sinkClosed = new AtomicBoolean();
    private volatile boolean accepting = true;

    Subscriber(String scanId, EventSink sink, Executor deliveryExecutor, int backlogLimit,
               long backlogBytesLimit, Consumer<Subscriber> onFailure) {
        this.scanId = scanId;
        this.sink = sink;
        this.deliveryExecutor = deliveryExecutor;
        this.backlogLimit = backlogLimit;
        this.backlogBytesLimit = backlogBytesLimit;
        this.onFailure = onFailure;
    }

    public String getId() {
        return id;
    }

    public String getScanId() {
        return scanId;
    }

    public boolean isActive() {
        return accepting && !failed.get();
    }

    void enqueueReplay(List<EventRecord> replay) {
        for (EventRecord event : replay) {
            queue.add(new Envelope(event, false, false));
        }
        scheduleDrain();
    }

    /**
     * Queue a live event.
     *
     * @return {@code false} if the subscriber is closed or was dropped for exceeding its backlog
     */
    boolean offer(EventRecord event) {
        if (!isActive()) {
            return false;
        }
        int pending = liveBacklog.incrementAndGet();
        long pendingBytes = liveBacklogBytes.addAndGet(event.sizeBytes());
        if (pending > backlogLimit) {
            release(event);
            fail("live backlog exceeded " + backlogLimit + " events", null);
            return false;
        }
        if (pendingBytes > backlogBytesLimit && pending > 1) {
            release(event);
            fail("live backlog exceeded " + backlogBytesLimit + " bytes", null);
            return false;
        }
        queue.add(new Envelope(event, true, false));
        scheduleDrain();
        return true;
    }

    /**
     * Deliver everything queued so far, then close the sink. Later offers are ignored.
     */
    void closeAfterDrain() {
        if (!accepting) {
            return;
        }
        accepting = false;
        queue.add(Envelope.CLOSE);
        scheduleDrain();
    }

    /**
     * Stop delivery immediately and close the sink without draining.
     */
    void cancel() {
        accepting = false;
        queue.clear();
        closeSink();
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            deliveryExecutor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            fail("delivery executor rejected the subscriber", e);
        }
    }

    private void drain() {
        try {
            Envelope envelope;
            while (!failed.get() && (envelope = queue.poll()) != null) {
                if (envelope.close()) {
                    closeSink();
                    return;
                }
                if (envelope.live()) {
                    release(envelope.event());
                }
                try {
                    sink.send(envelope.event());
                } catch (Exception e) {
                    fail("delivery failed", e);
                    return;
                }
            }
        } finally {
            draining.set(false);
        }
        // an offer may have slipped in between the last poll and the reset above
        if (!queue.isEmpty() && !failed.get() && !sinkClosed.get()) {
            scheduleDrain();
        }
    }

    private void release(EventRecord event) {
        liveBacklog.decrementAndGet();
        liveBacklogBytes.addAndGet(-event.sizeBytes());
    }

    long getLiveBacklogBytes() {
        return liveBacklogBytes.get();
    }

    private void fail(String reason, Exception cause) {
        if (!failed.compareAndSet(false, true)) {
            return;
        }
        accepting = false;
        if (cause != null) {
            logger.warn("Dropping subscriber {} of scan {}: {} ({})", id, scanId, reason, cause.getMessage());
        } else {
            logger.warn("Dropping subscriber {} of scan {}: {}", id, scanId, reason);
        }
        queue.clear();
        onFailure.accept(this);
        closeSink();
    }

    private void closeSink() {
        if (!sinkClosed.compareAndSet(false, true)) {
            return;
        }
        try {
            sink.close();
        } catch (RuntimeException e) {
            logger.debug("Closing sink of subscriber {} failed: {}", id, e.getMessage());
        }
    }

    private record Envelope(EventRecord event, boolean live, boolean close) {
        static final Envelope CLOSE = new Envelope(null, false, true);
    }
}
