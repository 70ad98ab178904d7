package com.errorsentinel.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.errorsentinel.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

public final class ConfigLoader {
    private static final Logger LOGGER = Logger.getLogger(ConfigLoader.class.getName());

    static final List<String> ALERT_CONFIG_FILES = List.of("alert.local.json", "alert.json");

    private ConfigLoader() {
    }

    public static AlertConfig loadAlertConfig(Path configDir) {
        for (String fileName : ALERT_CONFIG_FILES) {
            Path candidate = configDir.resolve(fileName);
            if (Files.exists(candidate)) {
                LOGGER.info("Using alert config " + candidate);
                return read(candidate, new TypeReference<>() {
                });
            }
        }
        LOGGER.info("No alert config in " + configDir + "; using defaults");
        return AlertConfig.defaults();
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            T value = JsonUtils.objectMapper().readValue(in, ref);
            if (value == null) {
                throw new IllegalStateException("Failed loading config from " + path + ": file is empty");
            }
            return value;
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
