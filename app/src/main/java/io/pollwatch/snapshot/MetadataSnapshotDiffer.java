package io.pollwatch.snapshot;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Diffs two snapshots using entry metadata only; file contents are never read.
 *
 * <ul>
 *   <li>A path present only in the newer snapshot is created, only in the older one deleted.
 *   <li>A path whose entry changed kind (file to directory or back), or whose identity changed, is
 *       deleted and created again.
 *   <li>Otherwise it is modified when its modification time or size changed.
 *   <li>A deleted and a created entry of the same kind that share an identity are reported as a single
 *       move instead. Without identities (file systems that expose no file key) moves show up as a
 *       delete plus a create.
 * </ul>
 *
 * Each category is sorted by path.
 */
public class MetadataSnapshotDiffer implements SnapshotDiffer {

    @Override
    public DiffResult diff(Snapshot previous, Snapshot current) {
        if (!previous.root().equals(current.root())) {
            throw new IllegalArgumentException(
                    "Cannot diff snapshots of different roots: " + previous.root() + " and " + current.root());
        }

        // Sorted so that move pairing and every category are deterministic.
        var deleted = new TreeMap<Path, EntryMetadata>();
        var created = new TreeMap<Path, EntryMetadata>();
        var filesModified = new ArrayList<Path>();
        var dirsModified = new ArrayList<Path>();

        for (var entry : previous.entries().entrySet()) {
            var path = entry.getKey();
            var before = entry.getValue();
            var after = current.get(path);
            if (after == null) {
                deleted.put(path, before);
            } else if (before.directory() != after.directory() || before.differentIdentity(after)) {
                deleted.put(path, before);
                created.put(path, after);
            } else if (!before.lastModified().equals(after.lastModified()) || before.size() != after.size()) {
                (after.directory() ? dirsModified : filesModified).add(path);
            }
        }
        for (var entry : current.entries().entrySet()) {
            if (!previous.contains(entry.getKey())) {
                created.put(entry.getKey(), entry.getValue());
            }
        }

        var filesMoved = new ArrayList<MovedEntry>();
        var dirsMoved = new ArrayList<MovedEntry>();
        pairMoves(deleted, created, filesMoved, dirsMoved);

        var filesCreated = new ArrayList<Path>();
        var dirsCreated = new ArrayList<Path>();
        created.forEach((path, meta) -> (meta.directory() ? dirsCreated : filesCreated).add(path));
        var filesDeleted = new ArrayList<Path>();
        var dirsDeleted = new ArrayList<Path>();
        deleted.forEach((path, meta) -> (meta.directory() ? dirsDeleted : filesDeleted).add(path));

        filesModified.sort(Comparator.naturalOrder());
        dirsModified.sort(Comparator.naturalOrder());
        filesMoved.sort(Comparator.comparing(MovedEntry::from));
        dirsMoved.sort(Comparator.comparing(MovedEntry::from));

        return new DiffResult(
                filesCreated, filesModified, filesDeleted, filesMoved, dirsCreated, dirsModified, dirsDeleted, dirsMoved);
    }

    /** Moves matching deleted/created pairs out of both maps and into the move lists. */
    private static void pairMoves(
            Map<Path, EntryMetadata> deleted,
            Map<Path, EntryMetadata> created,
            List<MovedEntry> filesMoved,
            List<MovedEntry> dirsMoved) {
        var createdByIdentity = new HashMap<Identity, Path>();
        created.forEach((path, meta) -> {
            if (meta.fileKey() != null) {
                createdByIdentity.putIfAbsent(new Identity(meta.directory(), meta.fileKey()), path);
            }
        });
        if (createdByIdentity.isEmpty()) {
            return;
        }

        var it = deleted.entrySet().iterator();
        while (it.hasNext()) {
            var entry = it.next();
            var meta = entry.getValue();
            if (meta.fileKey() == null) {
                continue;
            }
            var target = createdByIdentity.remove(new Identity(meta.directory(), meta.fileKey()));
            if (target == null) {
                continue;
            }
            it.remove();
            created.remove(target);
            (meta.directory() ? dirsMoved : filesMoved).add(new MovedEntry(entry.getKey(), target));
        }
    }

    private record Identity(boolean directory, Object fileKey) {}
}
