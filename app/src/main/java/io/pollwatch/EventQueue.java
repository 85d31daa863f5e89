package io.pollwatch;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * The single channel between all producers and the dispatcher. Safe for concurrent {@link #put} from
 * any number of producers; {@link #poll} is meant for one consumer. Entries come out in insertion
 * order.
 *
 * <p>A queue with a positive capacity applies its {@link BackpressurePolicy} when full. Once
 * {@link #close() closed} it rejects new entries, but entries already queued can still be drained.
 */
public final class EventQueue {
    private static final Logger logger = LogManager.getLogger(EventQueue.class);

    /** Blocked producers re-check {@link #closed} at least this often. */
    private static final long BLOCK_SLICE_MS = 50;

    private final BlockingQueue<QueueEntry> queue;
    private final int capacity;
    private final BackpressurePolicy policy;
    private final WatchErrorListener errors;
    private final AtomicLong dropped = new AtomicLong();

    private volatile boolean closed = false;

    /**
     * @param capacity maximum number of queued entries, 0 for unbounded
     * @param policy applied when a bounded queue is full
     * @param errors notified of every dropped entry
     */
    public EventQueue(int capacity, BackpressurePolicy policy, WatchErrorListener errors) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0, got " + capacity);
        }
        this.capacity = capacity;
        this.policy = policy;
        this.errors = GuardedErrorListener.wrap(errors);
        this.queue = capacity == 0 ? new LinkedBlockingQueue<>() : new LinkedBlockingQueue<>(capacity);
    }

    public static EventQueue unbounded() {
        return new EventQueue(0, BackpressurePolicy.BLOCK, WatchErrorListener.none());
    }

    /**
     * Enqueues {@code entry} according to the backpressure policy.
     *
     * @return true if the entry was queued, false if it was dropped
     */
    public boolean put(QueueEntry entry) {
        if (closed) {
            drop(entry, "queue is closed");
            return false;
        }
        return switch (policy) {
            case BLOCK -> putBlocking(entry);
            case DROP_NEWEST -> putDroppingNewest(entry);
            case DROP_OLDEST -> putDroppingOldest(entry);
        };
    }

    private boolean putBlocking(QueueEntry entry) {
        try {
            while (!closed) {
                if (queue.offer(entry, BLOCK_SLICE_MS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            drop(entry, "producer interrupted while waiting for space");
            return false;
        }
        drop(entry, "queue closed while waiting for space");
        return false;
    }

    private boolean putDroppingNewest(QueueEntry entry) {
        if (queue.offer(entry)) {
            return true;
        }
        drop(entry, "queue full");
        return false;
    }

    private boolean putDroppingOldest(QueueEntry entry) {
        while (!queue.offer(entry)) {
            var evicted = queue.poll();
            if (evicted != null) {
                drop(evicted, "evicted by newer event");
            }
        }
        return true;
    }

    private void drop(QueueEntry entry, String reason) {
        long total = dropped.incrementAndGet();
        // Warn once; a saturated queue would otherwise flood the log.
        if (total == 1) {
            logger.warn("Dropping {} for {} ({}); further drops are logged at debug", entry.event(), entry.watch(), reason);
        } else {
            logger.debug("Dropping {} for {} ({}); {} dropped so far", entry.event(), entry.watch(), reason, total);
        }
        errors.onEventDropped(entry);
    }

    /**
     * Waits up to {@code timeout} for the next entry.
     *
     * @return the next entry, or null if none arrived in time
     */
    public @Nullable QueueEntry poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /** Returns the next entry without waiting, or null if the queue is empty. */
    public @Nullable QueueEntry pollNow() {
        return queue.poll();
    }

    /** Stops accepting entries and releases producers blocked on a full queue. Idempotent. */
    public void close() {
        if (!closed) {
            closed = true;
            logger.debug("Event queue closed with {} pending entries", queue.size());
        }
    }

    public boolean isClosed() {
        return closed;
    }

    public int size() {
        return queue.size();
    }

    public long droppedCount() {
        return dropped.get();
    }

    /** Configured capacity, 0 for unbounded. */
    public int capacity() {
        return capacity;
    }

    public BackpressurePolicy policy() {
        return policy;
    }
}
