package io.pollwatch;

import io.pollwatch.event.EventHandler;
import io.pollwatch.snapshot.DirectorySnapshotProvider;
import io.pollwatch.snapshot.MetadataSnapshotDiffer;
import io.pollwatch.snapshot.SnapshotDiffer;
import io.pollwatch.snapshot.SnapshotProvider;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Nullable;

/**
 * Watches any number of directory trees by polling and delivers their events to per-path handlers.
 *
 * <p>Each watched path gets its own {@link EventProducer} thread. All producers feed one
 * {@link EventQueue}, and a single dispatch loop ({@link #run()}) hands every event to the handler of
 * the rule that produced it. Handlers therefore never run concurrently with each other.
 *
 * <p>Lifecycle: {@code CREATED -> RUNNING -> STOPPING -> STOPPED}. Rules may be added before or while
 * running; producers of rules added while running start immediately. {@link #stop()} stops every
 * producer, lets in-flight polls finish (bounded by {@link ObserverConfig#shutdownTimeout()}),
 * delivers what they queued and then ends the dispatch loop. No thread interrupt is involved.
 *
 * <pre>{@code
 * try (var observer = new PollingObserver()) {
 *     observer.addRule(Path.of("/data"), event -> System.out.println(event));
 *     observer.start();
 *     ...
 * }
 * }</pre>
 */
public final class PollingObserver implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(PollingObserver.class);

    private final ObserverConfig config;
    private final WatchErrorListener errors;
    private final EventQueue queue;
    private final RuleTable rules;

    private final AtomicReference<ObserverState> state = new AtomicReference<>(ObserverState.CREATED);
    private final CountDownLatch terminated = new CountDownLatch(1);

    @Nullable
    private volatile Thread dispatcherThread;

    public PollingObserver() {
        this(ObserverConfig.defaults());
    }

    public PollingObserver(ObserverConfig config) {
        this(config, new DirectorySnapshotProvider(), new MetadataSnapshotDiffer(), WatchErrorListener.none());
    }

    public PollingObserver(
            ObserverConfig config,
            SnapshotProvider snapshotProvider,
            SnapshotDiffer differ,
            WatchErrorListener errorListener) {
        this.config = config;
        this.errors = GuardedErrorListener.wrap(errorListener);
        this.queue = new EventQueue(config.queueCapacity(), config.backpressure(), errors);
        this.rules = new RuleTable(queue, snapshotProvider, differ, errors);
    }

    /** Watches {@code path} at the configured default interval. */
    public boolean addRule(Path path, EventHandler handler) {
        return addRule(path, config.defaultInterval(), handler);
    }

    /**
     * Watches {@code path}, polling every {@code interval}. The path is canonicalized first, so
     * different spellings of the same directory map to one rule. A path that does not exist yet is
     * accepted; its producer reports failures until it appears.
     *
     * @return true if a new rule was added, false if the path was already watched
     * @throws IllegalStateException if the observer is stopping or stopped
     */
    public boolean addRule(Path path, Duration interval, EventHandler handler) {
        var current = state.get();
        if (current == ObserverState.STOPPING || current == ObserverState.STOPPED) {
            throw new IllegalStateException("Cannot add a rule to a " + current + " observer");
        }
        var watch = WatchedPath.of(path, interval);
        var rule = rules.addRule(watch, handler);
        if (rule == null) {
            logger.debug("{} is already watched", watch);
            return false;
        }
        logger.info("Watching {} every {} ms", watch, watch.intervalMillis());
        return true;
    }

    /**
     * Stops watching {@code path}. Its producer stops polling within one interval, and events already
     * queued for it are discarded. Accepted in every state; no-op if the path is not watched.
     *
     * @return true if a rule was removed
     */
    public boolean removeRule(Path path) {
        var removed = rules.removeRule(WatchedPath.canonicalize(path));
        if (removed == null) {
            logger.debug("{} is not watched", path);
            return false;
        }
        logger.info("Stopped watching {}", removed.watch());
        return true;
    }

    /**
     * Like {@link #run()}, but dispatches on a new daemon thread and returns immediately.
     *
     * @throws IllegalStateException if the observer has already been started or stopped
     */
    public void start() {
        transitionToRunning();
        var t = new Thread(this::dispatchLoop, "PollingObserver-dispatcher");
        t.setDaemon(true);
        dispatcherThread = t;
        t.start();
    }

    /**
     * Starts every registered producer and dispatches events on the calling thread until
     * {@link #stop()} has been called and all pending events were delivered.
     *
     * @throws IllegalStateException if the observer has already been run or stopped
     */
    @Blocking
    public void run() {
        transitionToRunning();
        dispatcherThread = Thread.currentThread();
        dispatchLoop();
    }

    private void transitionToRunning() {
        if (!state.compareAndSet(ObserverState.CREATED, ObserverState.RUNNING)) {
            throw new IllegalStateException("Observer already " + state.get());
        }
    }

    private void dispatchLoop() {
        logger.info(
                "Polling observer started with {} watched path(s), queue capacity {} ({})",
                rules.size(),
                queue.capacity() == 0 ? "unbounded" : queue.capacity(),
                queue.policy());
        rules.activate();
        try {
            while (state.get() == ObserverState.RUNNING) {
                var entry = queue.poll(config.dispatchWait());
                if (entry != null) {
                    dispatch(entry);
                }
            }
            drainAfterStop();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Dispatcher interrupted; stopping without draining {} pending event(s)", queue.size());
        } finally {
            // No producer may outlive the dispatcher, however the loop ended.
            rules.shutDown();
            queue.close();
            state.set(ObserverState.STOPPED);
            terminated.countDown();
            logger.info("Polling observer stopped");
        }
    }

    /**
     * Keeps dispatching while producers finish their last poll, then closes the queue and delivers
     * whatever is left.
     */
    private void drainAfterStop() throws InterruptedException {
        long deadline = System.nanoTime() + config.shutdownTimeout().toNanos();
        while (rules.anyProducerAlive() && System.nanoTime() < deadline) {
            var entry = queue.poll(config.dispatchWait());
            if (entry != null) {
                dispatch(entry);
            }
        }
        if (rules.anyProducerAlive()) {
            logger.warn(
                    "Abandoning producers still polling after {} ms; their remaining events are dropped",
                    config.shutdownTimeout().toMillis());
        }
        queue.close();
        int drained = 0;
        QueueEntry entry;
        while ((entry = queue.pollNow()) != null) {
            dispatch(entry);
            drained++;
        }
        logger.debug("Delivered {} pending event(s) during shutdown", drained);
    }

    private void dispatch(QueueEntry entry) {
        var rule = rules.get(entry.watch().path());
        // Identity check: a rule removed and re-added for the same path must not see the old producer's events.
        if (rule == null || rule.watch() != entry.watch()) {
            logger.debug("Discarding {} for {}: rule was removed", entry.event(), entry.watch());
            return;
        }
        try {
            rule.handler().dispatch(entry.event());
        } catch (Throwable t) {
            if (t instanceof VirtualMachineError vmError) {
                throw vmError;
            }
            logger.error("Handler for {} failed on {}", entry.watch(), entry.event(), t);
            errors.onHandlerFailure(entry.watch(), entry.event(), t);
        }
    }

    /**
     * Requests shutdown and returns immediately. Producers are told to stop; the dispatch loop ends
     * once their in-flight polls are delivered. Use {@link #awaitTermination} or {@link #close()} to
     * wait for it. Idempotent.
     */
    public void stop() {
        if (state.compareAndSet(ObserverState.CREATED, ObserverState.STOPPED)) {
            rules.shutDown();
            queue.close();
            terminated.countDown();
            logger.info("Polling observer stopped before it was started");
            return;
        }
        if (state.compareAndSet(ObserverState.RUNNING, ObserverState.STOPPING)) {
            logger.info("Stopping polling observer ({} queued event(s))", queue.size());
            rules.shutDown();
        }
    }

    /**
     * Waits for the dispatch loop to finish.
     *
     * @return true if the observer reached {@link ObserverState#STOPPED} in time
     */
    @Blocking
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /** {@link #stop()} and wait for the dispatch loop to finish. */
    @Override
    public void close() {
        stop();
        if (dispatcherThread == Thread.currentThread()) {
            // Called from a handler; the loop exits after this dispatch returns.
            return;
        }
        var timeout = config.shutdownTimeout().plus(config.dispatchWait().multipliedBy(2));
        try {
            if (!awaitTermination(timeout)) {
                logger.warn("Polling observer did not stop within {} ms", timeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for polling observer to stop");
        }
    }

    public ObserverState state() {
        return state.get();
    }

    public ObserverConfig config() {
        return config;
    }

    /** Canonical paths currently watched. */
    public Set<Path> watchedPaths() {
        return rules.paths();
    }

    public boolean isWatching(Path path) {
        return rules.get(WatchedPath.canonicalize(path)) != null;
    }

    public @Nullable Rule rule(Path path) {
        return rules.get(WatchedPath.canonicalize(path));
    }

    public int queuedEvents() {
        return queue.size();
    }

    public long droppedEvents() {
        return queue.droppedCount();
    }
}
