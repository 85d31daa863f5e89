package io.pollwatch;

import io.pollwatch.event.FileSystemEvent;

/**
 * Error channel of a {@link PollingObserver}. Every failure is also logged; a listener is for callers
 * that need to react programmatically, for example to remove a watch whose root keeps failing.
 *
 * <p>Callbacks run on producer or dispatcher threads and must not block. Exceptions thrown by a
 * listener are logged and otherwise ignored.
 */
public interface WatchErrorListener {

    /**
     * A snapshot of {@code watch} could not be taken. The producer keeps its last good snapshot and
     * retries on the next interval.
     *
     * @param consecutiveFailures length of the current failure streak, starting at 1
     */
    default void onAcquisitionFailure(WatchedPath watch, Exception failure, int consecutiveFailures) {}

    /** A snapshot succeeded after {@code failedPolls} consecutive failures. */
    default void onAcquisitionRecovered(WatchedPath watch, int failedPolls) {}

    /** The handler bound to {@code watch} threw while processing {@code event}. */
    default void onHandlerFailure(WatchedPath watch, FileSystemEvent event, Throwable failure) {}

    /** {@code entry} was discarded by the queue's backpressure policy or because the queue was closed. */
    default void onEventDropped(QueueEntry entry) {}

    static WatchErrorListener none() {
        return new WatchErrorListener() {};
    }
}
