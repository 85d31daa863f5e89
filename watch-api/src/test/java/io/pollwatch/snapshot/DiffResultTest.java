package io.pollwatch.snapshot;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import org.junit.jupiter.api.Test;

class DiffResultTest {

    @Test
    void testEmptyConstantHasNoEntries() {
        assertTrue(DiffResult.EMPTY.isEmpty());
        assertEquals(0, DiffResult.EMPTY.size());
    }

    @Test
    void testSizeCountsEveryCategory() {
        var p = Path.of("/r/p");
        var move = new MovedEntry(Path.of("/r/a"), Path.of("/r/b"));
        var diff = new DiffResult(
                List.of(p), List.of(p), List.of(p), List.of(move), List.of(p), List.of(p), List.of(p), List.of(move));
        assertEquals(8, diff.size());
        assertFalse(diff.isEmpty());
    }

    @Test
    void testCategoriesAreDefensivelyCopied() {
        var created = new ArrayList<Path>();
        created.add(Path.of("/r/a"));
        var diff = new DiffResult(
                created, List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), List.of());
        created.add(Path.of("/r/b"));

        assertEquals(List.of(Path.of("/r/a")), diff.filesCreated());
        assertThrows(UnsupportedOperationException.class, () -> diff.filesCreated().add(Path.of("/r/c")));
    }

    @Test
    void testSnapshotEntriesAreImmutable() {
        var entries = new HashMap<Path, EntryMetadata>();
        var path = Path.of("/r/a");
        entries.put(path, new EntryMetadata(false, FileTime.fromMillis(1), 3, "inode-1"));
        var snapshot = new Snapshot(Path.of("/r"), entries, Instant.now());
        entries.clear();

        assertTrue(snapshot.contains(path));
        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.entries().remove(path));
    }

    @Test
    void testIdentityComparisonNeedsKeysOnBothSides() {
        var withKey = new EntryMetadata(false, FileTime.fromMillis(1), 0, "inode-1");
        var otherKey = new EntryMetadata(false, FileTime.fromMillis(1), 0, "inode-2");
        var noKey = new EntryMetadata(false, FileTime.fromMillis(1), 0, null);

        assertTrue(withKey.sameIdentity(withKey));
        assertFalse(withKey.sameIdentity(otherKey));
        assertTrue(withKey.differentIdentity(otherKey));
        assertFalse(withKey.differentIdentity(noKey));
        assertFalse(noKey.sameIdentity(noKey));
    }
}
