package io.pollwatch;

import io.pollwatch.event.EventHandler;

/** Binds a watched path to its handler and the producer polling it. */
public record Rule(WatchedPath watch, EventHandler handler, EventProducer producer) {

    /** True while the producer's polling thread is running. */
    public boolean isLive() {
        return producer.isAlive();
    }

    /** True while snapshots of the watched path keep failing. The producer goes on retrying. */
    public boolean isDegraded() {
        return producer.consecutiveFailures() > 0;
    }
}
