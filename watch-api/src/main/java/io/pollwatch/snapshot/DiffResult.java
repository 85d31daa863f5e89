package io.pollwatch.snapshot;

import java.nio.file.Path;
import java.util.List;

/**
 * Categorised difference between two snapshots of the same root. The eight categories are disjoint:
 * a path appears in at most one of them (for moves, on either side of at most one pair).
 */
public record DiffResult(
        List<Path> filesCreated,
        List<Path> filesModified,
        List<Path> filesDeleted,
        List<MovedEntry> filesMoved,
        List<Path> dirsCreated,
        List<Path> dirsModified,
        List<Path> dirsDeleted,
        List<MovedEntry> dirsMoved) {

    public static final DiffResult EMPTY =
            new DiffResult(List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), List.of());

    public DiffResult {
        filesCreated = List.copyOf(filesCreated);
        filesModified = List.copyOf(filesModified);
        filesDeleted = List.copyOf(filesDeleted);
        filesMoved = List.copyOf(filesMoved);
        dirsCreated = List.copyOf(dirsCreated);
        dirsModified = List.copyOf(dirsModified);
        dirsDeleted = List.copyOf(dirsDeleted);
        dirsMoved = List.copyOf(dirsMoved);
    }

    /** Total number of entries across all categories. */
    public int size() {
        return filesCreated.size()
                + filesModified.size()
                + filesDeleted.size()
                + filesMoved.size()
                + dirsCreated.size()
                + dirsModified.size()
                + dirsDeleted.size()
                + dirsMoved.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }
}
