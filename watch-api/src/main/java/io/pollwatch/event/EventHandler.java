package io.pollwatch.event;

/**
 * Receives the events of one watched path.
 *
 * <p>Handlers are invoked synchronously on the observer's single dispatch thread, so a slow handler
 * delays delivery for every other watched path. Exceptions thrown here are caught and reported by the
 * observer; they never stop delivery.
 */
@FunctionalInterface
public interface EventHandler {
    void dispatch(FileSystemEvent event);
}
