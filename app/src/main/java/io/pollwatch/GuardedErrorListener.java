package io.pollwatch;

import io.pollwatch.event.FileSystemEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Wraps a caller-supplied listener so its failures cannot escape into producers or the dispatcher. */
final class GuardedErrorListener implements WatchErrorListener {
    private static final Logger logger = LogManager.getLogger(GuardedErrorListener.class);

    private final WatchErrorListener delegate;

    private GuardedErrorListener(WatchErrorListener delegate) {
        this.delegate = delegate;
    }

    static WatchErrorListener wrap(WatchErrorListener listener) {
        return listener instanceof GuardedErrorListener ? listener : new GuardedErrorListener(listener);
    }

    @Override
    public void onAcquisitionFailure(WatchedPath watch, Exception failure, int consecutiveFailures) {
        guarded(
                () -> delegate.onAcquisitionFailure(watch, failure, consecutiveFailures),
                "acquisition failure",
                watch);
    }

    @Override
    public void onAcquisitionRecovered(WatchedPath watch, int failedPolls) {
        guarded(() -> delegate.onAcquisitionRecovered(watch, failedPolls), "recovery", watch);
    }

    @Override
    public void onHandlerFailure(WatchedPath watch, FileSystemEvent event, Throwable failure) {
        guarded(() -> delegate.onHandlerFailure(watch, event, failure), "handler failure", watch);
    }

    @Override
    public void onEventDropped(QueueEntry entry) {
        guarded(() -> delegate.onEventDropped(entry), "dropped event", entry.watch());
    }

    private static void guarded(Runnable callback, String what, WatchedPath watch) {
        try {
            callback.run();
        } catch (Throwable t) {
            if (t instanceof VirtualMachineError vmError) {
                throw vmError;
            }
            logger.warn("Error listener failed handling {} for {}", what, watch, t);
        }
    }
}
