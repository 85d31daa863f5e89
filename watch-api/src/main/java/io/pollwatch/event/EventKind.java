package io.pollwatch.event;

/** The eight categories a polling diff can report, split by entry type. */
public enum EventKind {
    FILE_CREATED(false),
    FILE_MODIFIED(false),
    FILE_DELETED(false),
    FILE_MOVED(false),
    DIR_CREATED(true),
    DIR_MODIFIED(true),
    DIR_DELETED(true),
    DIR_MOVED(true);

    private final boolean directory;

    EventKind(boolean directory) {
        this.directory = directory;
    }

    public boolean isDirectory() {
        return directory;
    }

    public boolean isMove() {
        return this == FILE_MOVED || this == DIR_MOVED;
    }
}
