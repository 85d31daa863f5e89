package io.pollwatch;

import io.pollwatch.event.EventHandler;
import io.pollwatch.snapshot.SnapshotDiffer;
import io.pollwatch.snapshot.SnapshotProvider;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Authoritative mapping from canonical watched path to its {@link Rule}.
 *
 * <p>Lock granularity: {@code structureLock} serializes structural changes (add, remove, activate,
 * shut down) and nothing else. Lookups used by the dispatcher read the concurrent map without it, so a
 * handler may add or remove rules from inside {@code dispatch} without deadlocking. Each producer
 * guards its own snapshot; there is no lock spanning several producers.
 *
 * <p>Adding a rule never starts a producer while the table is inactive. Once the observer
 * {@link #activate() activates} the table, producers of new rules start as they are added.
 */
public final class RuleTable {
    private static final Logger logger = LogManager.getLogger(RuleTable.class);

    private final EventQueue queue;
    private final SnapshotProvider snapshotProvider;
    private final SnapshotDiffer differ;
    private final WatchErrorListener errors;

    private final ReentrantLock structureLock = new ReentrantLock();
    private final Map<Path, Rule> rules = new ConcurrentHashMap<>();

    // guarded by structureLock
    private boolean active = false;
    private boolean shutDown = false;

    public RuleTable(
            EventQueue queue, SnapshotProvider snapshotProvider, SnapshotDiffer differ, WatchErrorListener errors) {
        this.queue = queue;
        this.snapshotProvider = snapshotProvider;
        this.differ = differ;
        this.errors = errors;
    }

    /**
     * Registers {@code watch} with {@code handler}. No-op if the path is already registered.
     *
     * @return the new rule, or null if the path was already watched
     * @throws IllegalStateException if the table has been shut down
     */
    public @Nullable Rule addRule(WatchedPath watch, EventHandler handler) {
        structureLock.lock();
        try {
            if (shutDown) {
                throw new IllegalStateException("Cannot watch " + watch + ": rule table is shut down");
            }
            if (rules.containsKey(watch.path())) {
                return null;
            }
            var producer = new EventProducer(watch, snapshotProvider, differ, queue, errors);
            var rule = new Rule(watch, handler, producer);
            rules.put(watch.path(), rule);
            if (active) {
                producer.start();
            }
            logger.debug("Added rule for {} ({} total)", watch, rules.size());
            return rule;
        } finally {
            structureLock.unlock();
        }
    }

    /**
     * Stops the producer of {@code path} and forgets the rule. No-op for unknown paths.
     *
     * @param path canonical path, as held by {@link WatchedPath#path()}
     * @return the removed rule, or null if none was registered
     */
    public @Nullable Rule removeRule(Path path) {
        structureLock.lock();
        try {
            var rule = rules.remove(path);
            if (rule == null) {
                return null;
            }
            rule.producer().stop();
            logger.debug("Removed rule for {} ({} left)", path, rules.size());
            return rule;
        } finally {
            structureLock.unlock();
        }
    }

    /** Starts every registered producer; producers of rules added later start immediately. */
    public void activate() {
        structureLock.lock();
        try {
            if (shutDown || active) {
                return;
            }
            active = true;
            rules.values().forEach(rule -> rule.producer().start());
        } finally {
            structureLock.unlock();
        }
    }

    /**
     * Stops every producer and refuses further additions. Rules stay registered so events that are
     * already queued can still be delivered.
     */
    public void shutDown() {
        structureLock.lock();
        try {
            if (shutDown) {
                return;
            }
            shutDown = true;
            active = false;
            rules.values().forEach(rule -> rule.producer().stop());
        } finally {
            structureLock.unlock();
        }
    }

    /** Lock-free lookup for the dispatcher. */
    public @Nullable Rule get(Path path) {
        return rules.get(path);
    }

    public Set<Path> paths() {
        return Set.copyOf(rules.keySet());
    }

    public List<Rule> rules() {
        return List.copyOf(rules.values());
    }

    public int size() {
        return rules.size();
    }

    /** True while any registered producer's thread is still running. */
    public boolean anyProducerAlive() {
        return rules.values().stream().anyMatch(Rule::isLive);
    }

    public boolean isActive() {
        structureLock.lock();
        try {
            return active;
        } finally {
            structureLock.unlock();
        }
    }
}
