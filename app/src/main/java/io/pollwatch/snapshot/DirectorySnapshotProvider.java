package io.pollwatch.snapshot;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.FileVisitor;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Snapshots a directory tree by walking it with {@link Files#walkFileTree}. Symbolic links below the
 * root are recorded as entries but not followed.
 *
 * <p>Only the root has to be readable: entries that vanish or cannot be read while the walk is in
 * progress are skipped and will show up (or not) in the next snapshot. A root that is a regular file
 * has nothing below it and yields an empty inventory.
 */
public class DirectorySnapshotProvider implements SnapshotProvider {
    private static final Logger logger = LogManager.getLogger(DirectorySnapshotProvider.class);

    private final int maxDepth;

    /** Walks the whole tree. */
    public DirectorySnapshotProvider() {
        this(Integer.MAX_VALUE);
    }

    /**
     * @param maxDepth how many levels below the root to record; 1 means direct children only
     */
    public DirectorySnapshotProvider(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be >= 1, got " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    @Override
    public Snapshot snapshot(Path root) throws IOException {
        var capturedAt = Instant.now();
        var rootAttributes = Files.readAttributes(root, BasicFileAttributes.class);
        if (!rootAttributes.isDirectory()) {
            return Snapshot.empty(root);
        }

        var entries = new HashMap<Path, EntryMetadata>();
        Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class), maxDepth, new Collector(root, entries));
        logger.trace("Snapshot of {} has {} entries", root, entries.size());
        return new Snapshot(root, entries, capturedAt);
    }

    /** Levels below the root that are recorded; {@link Integer#MAX_VALUE} when unlimited. */
    public int maxDepth() {
        return maxDepth;
    }

    static EntryMetadata metadataOf(BasicFileAttributes attributes) {
        return new EntryMetadata(
                attributes.isDirectory(), attributes.lastModifiedTime(), attributes.size(), attributes.fileKey());
    }

    private static final class Collector implements FileVisitor<Path> {
        private final Path root;
        private final Map<Path, EntryMetadata> entries;

        Collector(Path root, Map<Path, EntryMetadata> entries) {
            this.root = root;
            this.entries = entries;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (!dir.equals(root)) {
                entries.put(dir, metadataOf(attrs));
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            // Also reached for directories at maxDepth, which are recorded without descending.
            entries.put(file, metadataOf(attrs));
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
            if (file.equals(root)) {
                throw exc;
            }
            logger.debug("Skipping unreadable entry {}: {}", file, exc.toString());
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, @Nullable IOException exc) throws IOException {
            if (exc != null) {
                if (dir.equals(root)) {
                    throw exc;
                }
                logger.debug("Listing of {} was incomplete: {}", dir, exc.toString());
            }
            return FileVisitResult.CONTINUE;
        }
    }
}
