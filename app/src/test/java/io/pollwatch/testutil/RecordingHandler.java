package io.pollwatch.testutil;

import io.pollwatch.event.EventHandler;
import io.pollwatch.event.EventKind;
import io.pollwatch.event.FileSystemEvent;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/** Collects every event it receives and lets tests wait for specific ones. */
public class RecordingHandler implements EventHandler {
    private final List<FileSystemEvent> events = new ArrayList<>();
    private final List<Thread> threads = new ArrayList<>();

    @Override
    public synchronized void dispatch(FileSystemEvent event) {
        events.add(event);
        threads.add(Thread.currentThread());
        notifyAll();
    }

    public synchronized List<FileSystemEvent> events() {
        return List.copyOf(events);
    }

    public synchronized List<Thread> dispatchThreads() {
        return List.copyOf(threads);
    }

    public synchronized List<FileSystemEvent> eventsFor(Path path) {
        return events.stream()
                .filter(e -> e.path().equals(path) || path.equals(e.destPath()))
                .toList();
    }

    /** Waits until an event matching {@code condition} arrives; returns false on timeout. */
    public synchronized boolean await(Predicate<FileSystemEvent> condition, Duration timeout)
            throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (events.stream().noneMatch(condition)) {
            long remainingMs = (deadline - System.nanoTime()) / 1_000_000;
            if (remainingMs <= 0) {
                return false;
            }
            wait(remainingMs);
        }
        return true;
    }

    public boolean await(EventKind kind, Path path, Duration timeout) throws InterruptedException {
        return await(e -> e.kind() == kind && e.path().equals(path), timeout);
    }
}
