package com.errorsentinel.service.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.errorsentinel.core.model.HistoryEntry;
import com.errorsentinel.core.util.JsonUtils;
import com.errorsentinel.engine.api.HistoryStore;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

public class JsonFileHistoryStore implements HistoryStore {
    private static final Logger LOGGER = Logger.getLogger(JsonFileHistoryStore.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final TypeReference<Map<String, HistoryEntry>> HISTORY_TYPE = new TypeReference<>() {
    };

    private final Path file;

    public JsonFileHistoryStore(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    @Override
    public Map<String, HistoryEntry> load() {
        if (!Files.exists(file)) {
            LOGGER.info("No error history at " + file + "; starting cold");
            return new TreeMap<>();
        }
        try (InputStream in = Files.newInputStream(file)) {
            Map<String, HistoryEntry> loaded = MAPPER.readValue(in, HISTORY_TYPE);
            Map<String, HistoryEntry> history = new TreeMap<>();
            if (loaded == null) {
                return history;
            }
            loaded.forEach((signature, entry) -> {
                if (entry == null) {
                    LOGGER.warning("Dropping empty history entry '" + signature + "' in " + file);
                } else {
                    history.put(signature, entry);
                }
            });
            return history;
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Unreadable error history at " + file + "; starting cold", e);
            return new TreeMap<>();
        }
    }

    @Override
    public void save(Map<String, HistoryEntry> history) {
        Path temp = null;
        try {
            Path dir = file.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            temp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, new TreeMap<>(history));
            }
            moveIntoPlace(temp);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new IllegalStateException("Failed writing history to " + file, e);
        }
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException cleanupError) {
            LOGGER.log(Level.FINE, "Could not remove temp history file " + temp, cleanupError);
        }
    }
}
