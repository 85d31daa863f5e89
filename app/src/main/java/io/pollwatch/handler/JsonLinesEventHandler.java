package io.pollwatch.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.pollwatch.event.EventHandler;
import io.pollwatch.event.FileSystemEvent;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Writes each event as one JSON object per line, for consumption by other tools:
 *
 * <pre>{"watch":"/data","kind":"FILE_MOVED","directory":false,"path":"/data/a.txt","dest":"/data/b.txt"}</pre>
 *
 * {@code dest} is present for moves only.
 */
public class JsonLinesEventHandler implements EventHandler {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final Path watch;
    private final PrintStream out;

    public JsonLinesEventHandler(Path watch, PrintStream out) {
        this.watch = watch;
        this.out = out;
    }

    @Override
    public void dispatch(FileSystemEvent event) {
        out.println(toJson(watch, event));
    }

    static String toJson(Path watch, FileSystemEvent event) {
        var node = objectMapper.createObjectNode();
        node.put("watch", watch.toString());
        node.put("kind", event.kind().name());
        node.put("directory", event.isDirectory());
        node.put("path", event.path().toString());
        var dest = event.destPath();
        if (dest != null) {
            node.put("dest", dest.toString());
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
