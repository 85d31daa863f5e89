package io.pollwatch.snapshot;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Point-in-time inventory of every entry below one watched root. The root itself is not part of the
 * inventory. Entry paths are absolute, resolved against {@link #root()}.
 */
public record Snapshot(Path root, Map<Path, EntryMetadata> entries, Instant capturedAt) {

    public Snapshot {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(capturedAt, "capturedAt");
        entries = Map.copyOf(entries);
    }

    public static Snapshot empty(Path root) {
        return new Snapshot(root, Map.of(), Instant.now());
    }

    public @Nullable EntryMetadata get(Path path) {
        return entries.get(path);
    }

    public boolean contains(Path path) {
        return entries.containsKey(path);
    }

    public Set<Path> paths() {
        return entries.keySet();
    }

    public int size() {
        return entries.size();
    }
}
