package io.pollwatch;

import java.util.Locale;

/** What an {@link EventQueue} does when producers outpace the dispatcher and the queue is full. */
public enum BackpressurePolicy {

    /**
     * Producers wait until the dispatcher makes room. No event is lost, but a slow handler slows down
     * polling of every watched path. Waiting producers are released when the queue is closed.
     */
    BLOCK,

    /**
     * The oldest queued event is evicted to make room for the new one. Producers never wait; handlers
     * see the most recent changes.
     */
    DROP_OLDEST,

    /** The incoming event is discarded. Producers never wait; handlers see the earliest changes. */
    DROP_NEWEST;

    public static BackpressurePolicy parse(String value) {
        return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
