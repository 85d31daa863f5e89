package io.pollwatch;

import io.pollwatch.event.FileSystemEvent;

/** An event tagged with the watch that produced it, so the dispatcher can resolve the owning rule. */
public record QueueEntry(WatchedPath watch, FileSystemEvent event) {}
