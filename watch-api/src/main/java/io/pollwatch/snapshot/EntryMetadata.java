package io.pollwatch.snapshot;

import java.nio.file.attribute.FileTime;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Per-entry metadata captured by a {@link Snapshot}.
 *
 * @param directory whether the entry is a directory
 * @param lastModified last modification time as reported by the file system
 * @param size size in bytes (file systems report an implementation-specific value for directories)
 * @param fileKey file system identity (an inode on POSIX systems), or null where unsupported
 */
public record EntryMetadata(boolean directory, FileTime lastModified, long size, @Nullable Object fileKey) {

    public EntryMetadata {
        Objects.requireNonNull(lastModified, "lastModified");
    }

    /** True when both entries expose an identity and it is the same underlying file. */
    public boolean sameIdentity(EntryMetadata other) {
        return fileKey != null && fileKey.equals(other.fileKey);
    }

    /** True when the identity is known on both sides and differs. */
    public boolean differentIdentity(EntryMetadata other) {
        return fileKey != null && other.fileKey != null && !fileKey.equals(other.fileKey);
    }
}
