package io.pollwatch;

import static org.junit.jupiter.api.Assertions.*;

import io.pollwatch.snapshot.MetadataSnapshotDiffer;
import io.pollwatch.testutil.ScriptedSnapshotProvider;
import io.pollwatch.testutil.SnapshotBuilder;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class RuleTableTest {
    private static final Duration INTERVAL = Duration.ofSeconds(30);

    private final RuleTable table = new RuleTable(
            EventQueue.unbounded(),
            new ScriptedSnapshotProvider(SnapshotBuilder.of(Path.of("/a")).build()),
            new MetadataSnapshotDiffer(),
            WatchErrorListener.none());

    @AfterEach
    void tearDown() {
        table.shutDown();
    }

    @Test
    void testAddIsIdempotentPerPath() {
        var first = table.addRule(new WatchedPath(Path.of("/a"), INTERVAL), event -> {});
        var second = table.addRule(new WatchedPath(Path.of("/a"), Duration.ofSeconds(1)), event -> {});

        assertNotNull(first);
        assertNull(second);
        assertEquals(1, table.size());
        assertSame(first, table.get(Path.of("/a")));
        assertEquals(INTERVAL, first.watch().interval(), "the first registration wins");
    }

    @Test
    void testProducersStartOnlyWhenActive() {
        var early = table.addRule(new WatchedPath(Path.of("/a"), INTERVAL), event -> {});
        assertNotNull(early);
        assertFalse(early.producer().isStarted());

        table.activate();
        assertTrue(table.isActive());
        assertTrue(early.producer().isStarted());

        var late = table.addRule(new WatchedPath(Path.of("/b"), INTERVAL), event -> {});
        assertNotNull(late);
        assertTrue(late.producer().isStarted(), "rules added while active start immediately");
        assertTrue(table.anyProducerAlive());
    }

    @Test
    void testRemoveStopsProducer() throws InterruptedException {
        table.activate();
        var rule = table.addRule(new WatchedPath(Path.of("/a"), INTERVAL), event -> {});
        assertNotNull(rule);

        var removed = table.removeRule(Path.of("/a"));

        assertSame(rule, removed);
        assertNull(table.get(Path.of("/a")));
        assertTrue(rule.producer().isStopRequested());
        assertTrue(rule.producer().join(Duration.ofSeconds(5)));
        assertFalse(rule.isLive());
        assertNull(table.removeRule(Path.of("/a")), "removing twice is a no-op");
    }

    @Test
    void testShutDownStopsProducersAndRejectsAdds() throws InterruptedException {
        table.activate();
        var a = table.addRule(new WatchedPath(Path.of("/a"), INTERVAL), event -> {});
        var b = table.addRule(new WatchedPath(Path.of("/b"), INTERVAL), event -> {});
        assertNotNull(a);
        assertNotNull(b);

        table.shutDown();

        assertFalse(table.isActive());
        assertEquals(Set.of(Path.of("/a"), Path.of("/b")), table.paths(), "rules stay for pending deliveries");
        assertTrue(a.producer().join(Duration.ofSeconds(5)));
        assertTrue(b.producer().join(Duration.ofSeconds(5)));
        assertFalse(table.anyProducerAlive());
        assertThrows(
                IllegalStateException.class,
                () -> table.addRule(new WatchedPath(Path.of("/c"), INTERVAL), event -> {}));
    }

    @Test
    void testActivateAfterShutDownStartsNothing() {
        var rule = table.addRule(new WatchedPath(Path.of("/a"), INTERVAL), event -> {});
        assertNotNull(rule);

        table.shutDown();
        table.activate();

        assertFalse(table.isActive());
        assertFalse(rule.producer().isStarted());
    }
}
