package io.pollwatch;

import io.pollwatch.event.FileSystemEvent;
import io.pollwatch.snapshot.DiffResult;
import io.pollwatch.snapshot.MovedEntry;
import io.pollwatch.snapshot.Snapshot;
import io.pollwatch.snapshot.SnapshotDiffer;
import io.pollwatch.snapshot.SnapshotProvider;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Polls one watched path on its own thread and turns the difference between consecutive snapshots
 * into events on the shared {@link EventQueue}.
 *
 * <p>The first poll happens one interval after {@link #start()} and only records a baseline. Every
 * later poll diffs the previous snapshot against a fresh one and emits, in this order: deleted,
 * modified, created and moved files, then deleted, modified, created and moved directories.
 *
 * <p>{@link #stop()} is cooperative: a poll in progress completes and its events are still emitted,
 * but no new poll starts. The wait between polls returns as soon as stop is requested.
 */
public final class EventProducer {
    private static final Logger logger = LogManager.getLogger(EventProducer.class);

    private final WatchedPath watch;
    private final SnapshotProvider snapshotProvider;
    private final SnapshotDiffer differ;
    private final EventQueue queue;
    private final WatchErrorListener errors;

    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final AtomicBoolean started = new AtomicBoolean(false);

    // Serializes polls. Held for the snapshot and diff, released before emitting.
    private final ReentrantLock snapshotLock = new ReentrantLock();

    // Written only under snapshotLock; volatile so the getters below never wait for a walk in progress.
    @Nullable
    private volatile Snapshot previous;

    private volatile int consecutiveFailures = 0;

    @Nullable
    private volatile Thread thread;

    public EventProducer(
            WatchedPath watch,
            SnapshotProvider snapshotProvider,
            SnapshotDiffer differ,
            EventQueue queue,
            WatchErrorListener errors) {
        this.watch = watch;
        this.snapshotProvider = snapshotProvider;
        this.differ = differ;
        this.queue = queue;
        this.errors = GuardedErrorListener.wrap(errors);
    }

    /** Starts the polling thread. Calling it again, or after {@link #stop()}, does nothing. */
    public void start() {
        if (isStopRequested()) {
            logger.debug("Not starting producer for {}: already stopped", watch);
            return;
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        var t = new Thread(this::pollLoop, "PollingEventProducer(" + watch.path() + ")");
        t.setDaemon(true);
        thread = t;
        t.start();
    }

    /** Requests the polling thread to finish after its current poll, if any. Idempotent. */
    public void stop() {
        if (stopSignal.getCount() > 0) {
            stopSignal.countDown();
            logger.debug("Stop requested for producer of {}", watch);
        }
    }

    /**
     * Waits for the polling thread to terminate.
     *
     * @return true if the thread is gone (or was never started)
     */
    public boolean join(Duration timeout) throws InterruptedException {
        var t = thread;
        if (t == null) {
            return true;
        }
        t.join(Math.max(1, timeout.toMillis()));
        return !t.isAlive();
    }

    private void pollLoop() {
        logger.debug("Polling {} every {} ms", watch, watch.intervalMillis());
        try {
            while (!stopSignal.await(watch.intervalMillis(), TimeUnit.MILLISECONDS)) {
                pollOnce();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Producer for {} interrupted", watch);
        }
        logger.debug("Producer for {} finished", watch);
    }

    /**
     * Runs a single poll cycle. Package-private so tests can drive polls without timing.
     *
     * @return the number of events queued
     */
    int pollOnce() {
        DiffResult diff;
        snapshotLock.lock();
        try {
            Snapshot current;
            try {
                current = snapshotProvider.snapshot(watch.path());
            } catch (IOException | RuntimeException e) {
                recordFailure(e);
                return 0;
            }

            var last = previous;
            if (last == null) {
                previous = current;
                recordSuccess();
                logger.debug("Baseline for {} has {} entries as of {}", watch, current.size(), current.capturedAt());
                return 0;
            }

            try {
                diff = differ.diff(last, current);
            } catch (RuntimeException e) {
                // The previous snapshot is kept so the next poll reports these changes.
                recordFailure(e);
                return 0;
            }
            previous = current;
            recordSuccess();
        } finally {
            snapshotLock.unlock();
        }

        if (diff.isEmpty()) {
            return 0;
        }
        return emit(diff);
    }

    private int emit(DiffResult diff) {
        var events = eventsOf(diff);
        logger.debug("{} change(s) under {}", events.size(), watch);
        int queued = 0;
        for (var event : events) {
            logger.trace("Emitting {} for {}", event, watch);
            if (queue.put(new QueueEntry(watch, event))) {
                queued++;
            }
        }
        return queued;
    }

    /** Flattens a diff into events in emission order. */
    static List<FileSystemEvent> eventsOf(DiffResult diff) {
        var events = new ArrayList<FileSystemEvent>(diff.size());
        diff.filesDeleted().forEach(p -> events.add(new FileSystemEvent.FileDeleted(p)));
        diff.filesModified().forEach(p -> events.add(new FileSystemEvent.FileModified(p)));
        diff.filesCreated().forEach(p -> events.add(new FileSystemEvent.FileCreated(p)));
        for (MovedEntry move : diff.filesMoved()) {
            events.add(new FileSystemEvent.FileMoved(move.from(), move.to()));
        }
        diff.dirsDeleted().forEach(p -> events.add(new FileSystemEvent.DirDeleted(p)));
        diff.dirsModified().forEach(p -> events.add(new FileSystemEvent.DirModified(p)));
        diff.dirsCreated().forEach(p -> events.add(new FileSystemEvent.DirCreated(p)));
        for (MovedEntry move : diff.dirsMoved()) {
            events.add(new FileSystemEvent.DirMoved(move.from(), move.to()));
        }
        return events;
    }

    private void recordFailure(Exception e) {
        assert snapshotLock.isHeldByCurrentThread();
        int failures = consecutiveFailures + 1;
        consecutiveFailures = failures;
        if (failures == 1) {
            logger.warn("Cannot snapshot {}: {}; retrying every {} ms", watch, describe(e), watch.intervalMillis());
        } else {
            logger.debug("Snapshot of {} still failing ({} in a row): {}", watch, failures, describe(e));
        }
        errors.onAcquisitionFailure(watch, e, failures);
    }

    private void recordSuccess() {
        assert snapshotLock.isHeldByCurrentThread();
        if (consecutiveFailures > 0) {
            int failedPolls = consecutiveFailures;
            consecutiveFailures = 0;
            logger.info("Snapshot of {} recovered after {} failed poll(s)", watch, failedPolls);
            errors.onAcquisitionRecovered(watch, failedPolls);
        }
    }

    private static String describe(Exception e) {
        return e.getClass().getSimpleName() + (e.getMessage() == null ? "" : ": " + e.getMessage());
    }

    public WatchedPath watch() {
        return watch;
    }

    public boolean isStarted() {
        return started.get();
    }

    public boolean isStopRequested() {
        return stopSignal.getCount() == 0;
    }

    /** True while the polling thread is running. */
    public boolean isAlive() {
        var t = thread;
        return t != null && t.isAlive();
    }

    /** Length of the current failure streak; 0 when the last poll succeeded. */
    public int consecutiveFailures() {
        return consecutiveFailures;
    }

    /** True once a baseline snapshot has been taken. */
    public boolean hasBaseline() {
        return previous != null;
    }
}
