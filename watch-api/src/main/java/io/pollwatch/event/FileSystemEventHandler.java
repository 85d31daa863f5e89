package io.pollwatch.event;

/**
 * Convenience handler that routes each event to a per-action callback. {@link #onAnyEvent} runs
 * first for every event, then exactly one of the specific callbacks.
 */
public interface FileSystemEventHandler extends EventHandler {

    @Override
    default void dispatch(FileSystemEvent event) {
        onAnyEvent(event);
        switch (event.kind()) {
            case FILE_CREATED, DIR_CREATED -> onCreated(event);
            case FILE_MODIFIED, DIR_MODIFIED -> onModified(event);
            case FILE_DELETED, DIR_DELETED -> onDeleted(event);
            case FILE_MOVED, DIR_MOVED -> onMoved(event);
        }
    }

    default void onAnyEvent(FileSystemEvent event) {}

    default void onCreated(FileSystemEvent event) {}

    default void onModified(FileSystemEvent event) {}

    default void onDeleted(FileSystemEvent event) {}

    default void onMoved(FileSystemEvent event) {}
}
