package io.pollwatch;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * A canonical directory root together with its polling interval.
 *
 * <p>Identity is the canonical path only: two watches on the same canonical path are the same watch,
 * whatever their intervals. Canonicalisation happens once, in {@link #of}.
 */
public record WatchedPath(Path path, Duration interval) {

    /** Producers wait in whole milliseconds between polls. */
    public static final Duration MIN_INTERVAL = Duration.ofMillis(1);

    public WatchedPath {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(interval, "interval");
        requireValidInterval(interval, "Polling interval");
    }

    static void requireValidInterval(Duration interval, String name) {
        if (interval.compareTo(MIN_INTERVAL) < 0) {
            throw new IllegalArgumentException(
                    name + " must be at least " + MIN_INTERVAL.toMillis() + " ms, got " + interval);
        }
    }

    public static WatchedPath of(Path path, Duration interval) {
        return new WatchedPath(canonicalize(path), interval);
    }

    /**
     * Absolute, normalized and, when the path exists, symlink-resolved form of {@code path}. A path
     * that does not exist yet keeps its normalized form so it can be watched until it appears.
     */
    public static Path canonicalize(Path path) {
        var normalized = path.toAbsolutePath().normalize();
        try {
            return normalized.toRealPath();
        } catch (IOException ignored) {
            return normalized;
        }
    }

    public long intervalMillis() {
        return interval.toMillis();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof WatchedPath other && path.equals(other.path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public String toString() {
        return path.toString();
    }
}
