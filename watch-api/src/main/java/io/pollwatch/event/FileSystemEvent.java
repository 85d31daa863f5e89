package io.pollwatch.event;

import java.nio.file.Path;
import org.jetbrains.annotations.Nullable;

/**
 * A single change detected between two consecutive snapshots of a watched tree.
 *
 * <p>Every variant carries the affected path. Moves additionally carry the destination; for a move
 * {@link #path()} is the old location.
 */
public sealed interface FileSystemEvent {
    EventKind kind();

    Path path();

    /** Destination of a move, or null for every other kind. */
    default @Nullable Path destPath() {
        return null;
    }

    default boolean isDirectory() {
        return kind().isDirectory();
    }

    record FileCreated(Path path) implements FileSystemEvent {
        @Override
        public EventKind kind() {
            return EventKind.FILE_CREATED;
        }
    }

    record FileModified(Path path) implements FileSystemEvent {
        @Override
        public EventKind kind() {
            return EventKind.FILE_MODIFIED;
        }
    }

    record FileDeleted(Path path) implements FileSystemEvent {
        @Override
        public EventKind kind() {
            return EventKind.FILE_DELETED;
        }
    }

    record FileMoved(Path path, Path destPath) implements FileSystemEvent {
        @Override
        public EventKind kind() {
            return EventKind.FILE_MOVED;
        }
    }

    record DirCreated(Path path) implements FileSystemEvent {
        @Override
        public EventKind kind() {
            return EventKind.DIR_CREATED;
        }
    }

    record DirModified(Path path) implements FileSystemEvent {
        @Override
        public EventKind kind() {
            return EventKind.DIR_MODIFIED;
        }
    }

    record DirDeleted(Path path) implements FileSystemEvent {
        @Override
        public EventKind kind() {
            return EventKind.DIR_DELETED;
        }
    }

    record DirMoved(Path path, Path destPath) implements FileSystemEvent {
        @Override
        public EventKind kind() {
            return EventKind.DIR_MOVED;
        }
    }
}
