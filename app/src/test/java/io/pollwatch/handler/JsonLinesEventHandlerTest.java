package io.pollwatch.handler;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.pollwatch.event.FileSystemEvent;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class JsonLinesEventHandlerTest {
    private static final ObjectMapper mapper = new ObjectMapper();
    private static final Path WATCH = Path.of("/data");

    @Test
    void testCreatedEventHasNoDestination() throws Exception {
        var json = JsonLinesEventHandler.toJson(WATCH, new FileSystemEvent.FileCreated(WATCH.resolve("a.txt")));

        var node = mapper.readTree(json);
        assertEquals(WATCH.toString(), node.get("watch").asText());
        assertEquals("FILE_CREATED", node.get("kind").asText());
        assertFalse(node.get("directory").asBoolean());
        assertEquals(WATCH.resolve("a.txt").toString(), node.get("path").asText());
        assertFalse(node.has("dest"));
    }

    @Test
    void testMoveIncludesDestination() throws Exception {
        var event = new FileSystemEvent.DirMoved(WATCH.resolve("old"), WATCH.resolve("new"));

        var node = mapper.readTree(JsonLinesEventHandler.toJson(WATCH, event));

        assertEquals("DIR_MOVED", node.get("kind").asText());
        assertTrue(node.get("directory").asBoolean());
        assertEquals(WATCH.resolve("new").toString(), node.get("dest").asText());
    }

    @Test
    void testWritesOneLinePerEvent() {
        var buffer = new ByteArrayOutputStream();
        var handler = new JsonLinesEventHandler(WATCH, new PrintStream(buffer, true, StandardCharsets.UTF_8));

        handler.dispatch(new FileSystemEvent.FileModified(WATCH.resolve("a.txt")));
        handler.dispatch(new FileSystemEvent.FileDeleted(WATCH.resolve("b.txt")));

        var lines = buffer.toString(StandardCharsets.UTF_8).lines().toList();
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).contains("\"FILE_MODIFIED\""));
        assertTrue(lines.get(1).contains("\"FILE_DELETED\""));
    }
}
