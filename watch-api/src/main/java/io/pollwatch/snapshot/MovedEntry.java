package io.pollwatch.snapshot;

import java.nio.file.Path;

/** An entry that kept its identity but changed location between two snapshots. */
public record MovedEntry(Path from, Path to) {}
