package com.sentinel.core.persist;

import com.sentinel.core.model.EventKind;
import com.sentinel.core.model.EventRecord;
import com.sentinel.core.model.WorkerIdentity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PersistenceMirrorTest {

    private static final WorkerIdentity WORKER = new WorkerIdentity("scan-3", 1, "xss");

    @Mock
    private ScanPersistence persistence;

    private static EventRecord event(int seq) {
        return EventRecord.synthetic(EventKind.LOG, WORKER, Map.of("seq", seq));
    }

    @Test
    void testFailuresAreLoggedNotPropagated() throws Exception {
        doThrow(new IOException("disk full")).when(persistence).appendEvent(any());

        PersistenceMirror mirror = new PersistenceMirror(persistence, 10);
        assertDoesNotThrow(() -> mirror.event(event(1)));
        assertDoesNotThrow(() -> mirror.event(event(2)));
        mirror.close();

        verify(persistence, times(2)).appendEvent(any());
        assertEquals(2, mirror.getFailedCount());
    }

    @Test
    void testOverflowIsDroppedWithoutBlocking() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        doAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        }).when(persistence).appendEvent(any());

        PersistenceMirror mirror = new PersistenceMirror(persistence, 2);
        mirror.event(event(1));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        for (int i = 2; i <= 10; i++) {
            mirror.event(event(i));
        }
        release.countDown();
        mirror.close();

        assertEquals(7, mirror.getDroppedCount());
        verify(persistence, times(3)).appendEvent(any());
    }

    @Test
    void testLargeEventsAreBoundedByBytes() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch started = new CountDownLatch(1);
        doAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        }).when(persistence).appendEvent(any());

        PersistenceMirror mirror = new PersistenceMirror(persistence, 100, 1000);
        mirror.event(screenshot(600));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        for (int i = 0; i < 5; i++) {
            mirror.event(screenshot(600));
        }
        // small events still fit next to the one in flight
        mirror.event(screenshot(100));
        assertEquals(700, mirror.getPendingBytes());

        release.countDown();
        mirror.close();

        assertEquals(5, mirror.getDroppedCount());
        assertEquals(0, mirror.getPendingBytes());
        verify(persistence, times(2)).appendEvent(any());
    }

    private static EventRecord screenshot(long sizeBytes) {
        return new EventRecord("agent.screenshot", 1, "xss", "scan-3", Map.of("image", "AAAA"), 1.0, sizeBytes);
    }
}
