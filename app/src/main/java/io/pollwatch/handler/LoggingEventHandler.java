package io.pollwatch.handler;

import io.pollwatch.event.FileSystemEvent;
import io.pollwatch.event.FileSystemEventHandler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Logs every event it receives at info level. */
public class LoggingEventHandler implements FileSystemEventHandler {
    private static final Logger logger = LogManager.getLogger(LoggingEventHandler.class);

    @Override
    public void onCreated(FileSystemEvent event) {
        logger.info("Created {}: {}", describe(event), event.path());
    }

    @Override
    public void onModified(FileSystemEvent event) {
        logger.info("Modified {}: {}", describe(event), event.path());
    }

    @Override
    public void onDeleted(FileSystemEvent event) {
        logger.info("Deleted {}: {}", describe(event), event.path());
    }

    @Override
    public void onMoved(FileSystemEvent event) {
        logger.info("Moved {}: from {} to {}", describe(event), event.path(), event.destPath());
    }

    private static String describe(FileSystemEvent event) {
        return event.isDirectory() ? "directory" : "file";
    }
}
