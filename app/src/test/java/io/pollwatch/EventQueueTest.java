package io.pollwatch;

import static org.junit.jupiter.api.Assertions.*;

import io.pollwatch.event.FileSystemEvent;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class EventQueueTest {
    private static final WatchedPath WATCH = new WatchedPath(Path.of("/watched"), Duration.ofSeconds(1));

    private static QueueEntry entry(String name) {
        return new QueueEntry(WATCH, new FileSystemEvent.FileCreated(WATCH.path().resolve(name)));
    }

    private static final class DropRecorder implements WatchErrorListener {
        final List<QueueEntry> dropped = new ArrayList<>();

        @Override
        public synchronized void onEventDropped(QueueEntry entry) {
            dropped.add(entry);
        }
    }

    @Test
    void testEntriesComeOutInInsertionOrder() throws InterruptedException {
        var queue = EventQueue.unbounded();
        var a = entry("a");
        var b = entry("b");
        var c = entry("c");

        assertTrue(queue.put(a));
        assertTrue(queue.put(b));
        assertTrue(queue.put(c));

        assertEquals(3, queue.size());
        assertSame(a, queue.poll(Duration.ofMillis(10)));
        assertSame(b, queue.pollNow());
        assertSame(c, queue.pollNow());
        assertNull(queue.pollNow());
        assertNull(queue.poll(Duration.ofMillis(10)));
    }

    @Test
    void testDropNewestDiscardsIncoming() {
        var recorder = new DropRecorder();
        var queue = new EventQueue(2, BackpressurePolicy.DROP_NEWEST, recorder);
        var a = entry("a");
        var b = entry("b");
        var c = entry("c");

        assertTrue(queue.put(a));
        assertTrue(queue.put(b));
        assertFalse(queue.put(c));

        assertEquals(1, queue.droppedCount());
        assertEquals(List.of(c), recorder.dropped);
        assertSame(a, queue.pollNow());
        assertSame(b, queue.pollNow());
    }

    @Test
    void testDropOldestEvictsHead() {
        var recorder = new DropRecorder();
        var queue = new EventQueue(2, BackpressurePolicy.DROP_OLDEST, recorder);
        var a = entry("a");
        var b = entry("b");
        var c = entry("c");

        assertTrue(queue.put(a));
        assertTrue(queue.put(b));
        assertTrue(queue.put(c));

        assertEquals(1, queue.droppedCount());
        assertEquals(List.of(a), recorder.dropped);
        assertSame(b, queue.pollNow());
        assertSame(c, queue.pollNow());
    }

    @Test
    void testBlockWaitsForSpace() throws InterruptedException {
        var queue = new EventQueue(1, BackpressurePolicy.BLOCK, WatchErrorListener.none());
        queue.put(entry("a"));
        var accepted = new AtomicBoolean(false);
        var done = new CountDownLatch(1);

        var producer = new Thread(() -> {
            accepted.set(queue.put(entry("b")));
            done.countDown();
        });
        producer.start();

        assertFalse(done.await(200, TimeUnit.MILLISECONDS), "producer should block on a full queue");
        assertNotNull(queue.pollNow());
        assertTrue(done.await(5, TimeUnit.SECONDS), "producer should resume once there is room");
        assertTrue(accepted.get());
        assertEquals(0, queue.droppedCount());
    }

    @Test
    void testCloseReleasesBlockedProducer() throws InterruptedException {
        var recorder = new DropRecorder();
        var queue = new EventQueue(1, BackpressurePolicy.BLOCK, recorder);
        queue.put(entry("a"));
        var accepted = new AtomicBoolean(true);
        var done = new CountDownLatch(1);

        var producer = new Thread(() -> {
            accepted.set(queue.put(entry("b")));
            done.countDown();
        });
        producer.start();
        assertFalse(done.await(100, TimeUnit.MILLISECONDS));

        queue.close();

        assertTrue(done.await(5, TimeUnit.SECONDS), "close should release the blocked producer");
        assertFalse(accepted.get());
        assertEquals(1, queue.droppedCount());
        assertEquals(1, recorder.dropped.size());
    }

    @Test
    void testClosedQueueRejectsButStillDrains() {
        var queue = EventQueue.unbounded();
        var a = entry("a");
        queue.put(a);

        queue.close();
        queue.close();

        assertTrue(queue.isClosed());
        assertFalse(queue.put(entry("b")));
        assertEquals(1, queue.droppedCount());
        assertSame(a, queue.pollNow());
        assertNull(queue.pollNow());
    }

    @Test
    void testFailingDropListenerDoesNotBreakQueue() {
        var queue = new EventQueue(1, BackpressurePolicy.DROP_NEWEST, new WatchErrorListener() {
            @Override
            public void onEventDropped(QueueEntry entry) {
                throw new AssertionError("listener bug");
            }
        });
        queue.put(entry("a"));

        assertFalse(queue.put(entry("b")));
        assertEquals(1, queue.droppedCount());
    }

    @Test
    void testReportsConfiguration() {
        var queue = new EventQueue(3, BackpressurePolicy.DROP_OLDEST, WatchErrorListener.none());

        assertEquals(3, queue.capacity());
        assertEquals(BackpressurePolicy.DROP_OLDEST, queue.policy());
        assertEquals(0, EventQueue.unbounded().capacity());
        assertEquals(BackpressurePolicy.BLOCK, EventQueue.unbounded().policy());
    }

    @Test
    void testNegativeCapacityRejected() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new EventQueue(-1, BackpressurePolicy.BLOCK, WatchErrorListener.none()));
    }
}
