package io.pollwatch.snapshot;

/** Computes the categorised delta between two snapshots of the same root. Must be a pure function. */
@FunctionalInterface
public interface SnapshotDiffer {
    DiffResult diff(Snapshot previous, Snapshot current);
}
