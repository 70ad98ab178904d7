package com.errorsentinel.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.errorsentinel.core.model.HistoryEntry;
import com.errorsentinel.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Iterator;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonFileHistoryStoreTest {
    private static final LocalDate FIRST = LocalDate.parse("2026-10-01");
    private static final LocalDate LAST = LocalDate.parse("2026-10-11");

    @Test
    void roundTripIsLossless() throws Exception {
        Path file = Files.createTempDirectory("history-roundtrip-").resolve("state/error-history.json");
        Map<String, HistoryEntry> history = Map.of(
                "NullPointerException: user {id} not found", new HistoryEntry(FIRST, LAST, 5),
                "[ERROR] Payment declined for order {id}", new HistoryEntry(LAST, LAST, 1)
        );

        new JsonFileHistoryStore(file).save(history);

        assertEquals(history, new JsonFileHistoryStore(file).load());
    }

    @Test
    void missingFileIsColdStart() throws Exception {
        Path dir = Files.createTempDirectory("history-missing-");

        assertTrue(new JsonFileHistoryStore(dir.resolve("none.json")).load().isEmpty());
    }

    @Test
    void emptyOrCorruptFileIsColdStart() throws Exception {
        Path dir = Files.createTempDirectory("history-corrupt-");
        Path empty = dir.resolve("empty.json");
        Path corrupt = dir.resolve("corrupt.json");
        Path badDate = dir.resolve("bad-date.json");
        Files.writeString(empty, "");
        Files.writeString(corrupt, "{ this is not valid json }");
        Files.writeString(badDate, "{\"S\":{\"firstSeenDate\":\"yesterday\",\"lastSeenDate\":\"2026-10-01\",\"totalCount\":1}}");

        assertTrue(new JsonFileHistoryStore(empty).load().isEmpty());
        assertTrue(new JsonFileHistoryStore(corrupt).load().isEmpty());
        assertTrue(new JsonFileHistoryStore(badDate).load().isEmpty());
    }

    @Test
    void nullEntriesAreDroppedOnLoad() throws Exception {
        Path file = Files.createTempDirectory("history-null-").resolve("history.json");
        Files.writeString(file, """
                {
                  "S": null,
                  "T": {"firstSeenDate": "2026-10-01", "lastSeenDate": "2026-10-11", "totalCount": 2}
                }
                """);

        Map<String, HistoryEntry> loaded = new JsonFileHistoryStore(file).load();

        assertEquals(Map.of("T", new HistoryEntry(FIRST, LAST, 2)), loaded);
    }

    @Test
    void legacySnakeCaseHistoryIsReadable() throws Exception {
        Path file = Files.createTempDirectory("history-legacy-").resolve("cloudwatch-error-history.json");
        Files.writeString(file, """
                {
                  "SocketTimeoutException: Read timed out": {
                    "first_seen": "2026-10-01",
                    "last_seen": "2026-10-11",
                    "total_count": 9
                  }
                }
                """);

        Map<String, HistoryEntry> loaded = new JsonFileHistoryStore(file).load();

        assertEquals(new HistoryEntry(FIRST, LAST, 9), loaded.get("SocketTimeoutException: Read timed out"));
    }

    @Test
    void savedFileUsesIsoDatesAndSortedKeys() throws Exception {
        Path dir = Files.createTempDirectory("history-format-");
        Path file = dir.resolve("history.json");

        new JsonFileHistoryStore(file).save(Map.of(
                "b", new HistoryEntry(FIRST, LAST, 2),
                "a", new HistoryEntry(FIRST, FIRST, 1)
        ));

        JsonNode tree = JsonUtils.objectMapper().readTree(Files.readString(file));
        Iterator<String> names = tree.fieldNames();
        assertEquals("a", names.next());
        assertEquals("b", names.next());
        assertEquals("2026-10-01", tree.get("b").get("firstSeenDate").asText());
        assertEquals("2026-10-11", tree.get("b").get("lastSeenDate").asText());
        assertEquals(2, tree.get("b").get("totalCount").asLong());
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(1, files.count(), "temp file should be moved into place");
        }
    }

    @Test
    void saveReplacesPreviousContent() throws Exception {
        Path file = Files.createTempDirectory("history-replace-").resolve("history.json");
        JsonFileHistoryStore store = new JsonFileHistoryStore(file);

        store.save(Map.of("old", new HistoryEntry(FIRST, FIRST, 1)));
        store.save(Map.of("new", new HistoryEntry(LAST, LAST, 1)));

        assertEquals(Map.of("new", new HistoryEntry(LAST, LAST, 1)), store.load());
    }

    @Test
    void unwritableTargetFailsWithClearMessage() throws Exception {
        Path tempDir = Files.createTempDirectory("history-unwritable-");
        Path blocker = tempDir.resolve("not-a-dir");
        Files.writeString(blocker, "blocker");

        JsonFileHistoryStore store = new JsonFileHistoryStore(blocker.resolve("history.json"));

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> store.save(Map.of("S", new HistoryEntry(FIRST, FIRST, 1))));
        assertTrue(ex.getMessage().contains("Failed writing history"));
    }
}
