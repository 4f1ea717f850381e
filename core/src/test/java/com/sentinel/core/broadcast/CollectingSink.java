package com.sentinel.core.broadcast;

import com.sentinel.core.model.EventRecord;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Test sink that records every delivered event.
 */
public class CollectingSink implements EventSink {
    private final List<EventRecord> received = new CopyOnWriteArrayList<>();
    private final CountDownLatch closed = new CountDownLatch(1);
    private volatile boolean failing;

    @Override
    public void send(EventRecord event) throws IOException {
        if (failing) {
            throw new IOException("connection reset");
        }
        received.add(event);
    }

    @Override
    public void close() {
        closed.countDown();
    }

    public void failFromNowOn() {
        failing = true;
    }

    public List<EventRecord> received() {
        return new ArrayList<>(received);
    }

    public List<String> types() {
        List<String> types = new ArrayList<>();
        for (EventRecord event : received) {
            types.add(event.type());
        }
        return types;
    }

    public boolean isClosed() {
        return closed.getCount() == 0;
    }

    public boolean awaitClosed(Duration timeout) throws InterruptedException {
        return closed.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
