package com.sentinel.core.broadcast;

import com.sentinel.core.model.EventKind;
import com.sentinel.core.model.EventRecord;
import com.sentinel.core.model.WorkerIdentity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class SubscriberRegistryTest {

    private static final WorkerIdentity WORKER = new WorkerIdentity("scan-1", 1, "cors");

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static EventRecord event(int seq) {
        return EventRecord.synthetic(EventKind.LOG, WORKER, Map.of("seq", seq));
    }

    @Test
    void testReplayThenLiveInOrder() throws Exception {
        SubscriberRegistry registry = new SubscriberRegistry("scan-1", executor, 100);
        CollectingSink sink = new CollectingSink();

        registry.register(sink, List.of(event(1), event(2)));
        for (int i = 3; i <= 50; i++) {
            registry.publish(event(i));
        }
        registry.closeAll();

        assertTrue(sink.awaitClosed(Duration.ofSeconds(5)));
        List<EventRecord> received = sink.received();
        assertEquals(50, received.size());
        for (int i = 0; i < 50; i++) {
            assertEquals(i + 1, received.get(i).data().get("seq"));
        }
    }

    @Test
    void testFailingSubscriberIsDroppedOthersUnaffected() throws Exception {
        SubscriberRegistry registry = new SubscriberRegistry("scan-1", Runnable::run, 100);
        CollectingSink healthy = new CollectingSink();
        CollectingSink broken = new CollectingSink();
        registry.register(healthy, List.of());
        registry.register(broken, List.of());

        registry.publish(event(1));
        broken.failFromNowOn();
        registry.publish(event(2));
        registry.publish(event(3));

        assertEquals(1, registry.size());
        assertTrue(broken.isClosed());
        assertEquals(1, broken.received().size());
        assertEquals(3, healthy.received().size());
    }

    @Test
    void testSlowSubscriberDoesNotBlockPublisherAndIsDroppedOnOverflow() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch blocked = new CountDownLatch(1);
        EventSink slow = new EventSink() {
            @Override
            public void send(EventRecord event) throws IOException {
                blocked.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }

            @Override
            public void close() {
            }
        };
        SubscriberRegistry registry = new SubscriberRegistry("scan-1", executor, 5);
        CollectingSink fast = new CollectingSink();
        registry.register(slow, List.of());
        registry.register(fast, List.of());

        registry.publish(event(0));
        assertTrue(blocked.await(5, TimeUnit.SECONDS));

        long started = System.nanoTime();
        for (int i = 1; i <= 20; i++) {
            registry.publish(event(i));
        }
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        release.countDown();

        assertTrue(elapsedMs < 2000, "publish must not wait for a slow subscriber");
        assertEquals(1, registry.size());
        registry.closeAll();
        assertTrue(fast.awaitClosed(Duration.ofSeconds(5)));
        assertEquals(21, fast.received().size());
    }

    @Test
    void testJoinAfterCloseReceivesReplayThenClosed() throws Exception {
        SubscriberRegistry registry = new SubscriberRegistry("scan-1", Runnable::run, 10);
        registry.closeAll();
        CollectingSink late = new CollectingSink();

        registry.register(late, List.of(event(1), event(2)));

        assertEquals(2, late.received().size());
        assertTrue(late.isClosed());
        assertEquals(0, registry.size());
    }

    @Test
    void testLeaveStopsDelivery() {
        SubscriberRegistry registry = new SubscriberRegistry("scan-1", Runnable::run, 10);
        CollectingSink sink = new CollectingSink();
        Subscriber subscriber = registry.register(sink, List.of());

        registry.publish(event(1));
        registry.leave(subscriber);
        registry.publish(event(2));

        assertEquals(1, sink.received().size());
        assertTrue(sink.isClosed());
        assertFalse(subscriber.isActive());
    }

    @Test
    void testSubscriberHoldingTooManyBytesIsDropped() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch blocked = new CountDownLatch(1);
        AtomicBoolean slowClosed = new AtomicBoolean();
        EventSink slow = new EventSink() {
            @Override
            public void send(EventRecord event) {
                blocked.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }

            @Override
            public void close() {
                slowClosed.set(true);
            }
        };
        SubscriberRegistry registry = new SubscriberRegistry("scan-1", executor, 100, 1000);
        CollectingSink fast = new CollectingSink();
        registry.register(slow, List.of());
        registry.register(fast, List.of());

        registry.publish(screenshot(400));
        assertTrue(blocked.await(5, TimeUnit.SECONDS));
        registry.publish(screenshot(400));
        registry.publish(screenshot(400));
        assertEquals(2, registry.size());

        registry.publish(screenshot(400));
        release.countDown();

        assertEquals(1, registry.size());
        assertTrue(slowClosed.get());
        registry.closeAll();
        assertTrue(fast.awaitClosed(Duration.ofSeconds(5)));
        assertEquals(4, fast.received().size());
    }

    @Test
    void testOversizedEventIsAcceptedIntoEmptyBacklog() {
        SubscriberRegistry registry = new SubscriberRegistry("scan-1", Runnable::run, 100, 1000);
        CollectingSink sink = new CollectingSink();
        Subscriber subscriber = registry.register(sink, List.of());

        registry.publish(screenshot(5000));
        registry.publish(screenshot(5000));

        assertTrue(subscriber.isActive());
        assertEquals(2, sink.received().size());
        assertEquals(0, subscriber.getLiveBacklogBytes());
    }

    private static EventRecord screenshot(long sizeBytes) {
        return new EventRecord("agent.screenshot", 1, "cors", "scan-1", Map.of("image", "AAAA"), 1.0, sizeBytes);
    }
}
