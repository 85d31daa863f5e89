package io.pollwatch.snapshot;

import java.io.IOException;
import java.nio.file.Path;

/** Captures the current state of a watched tree. */
@FunctionalInterface
public interface SnapshotProvider {

    /**
     * Takes a snapshot of everything below {@code root}. Implementations are synchronous and may block
     * for as long as the walk takes.
     *
     * @throws IOException if the root cannot be read (missing, permission denied, ...)
     */
    Snapshot snapshot(Path root) throws IOException;
}
