package com.errorsentinel.service.config;

import com.errorsentinel.core.signature.ExtractorSettings;
import com.errorsentinel.engine.run.EngineSettings;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    @Test
    void loadsAlertConfig() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-");
        Files.writeString(dir.resolve("alert.json"), """
                {
                  "historyFile": "data/history.json",
                  "retentionDays": 14,
                  "zone": "Asia/Seoul",
                  "ignorePatterns": ["HealthCheck", "favicon\\\\.ico"],
                  "signatureFields": ["tenant"]
                }
                """);

        AlertConfig config = ConfigLoader.loadAlertConfig(dir);

        assertEquals(Path.of("data/history.json"), config.historyPath());
        assertEquals(ZoneId.of("Asia/Seoul"), config.zoneId());
        assertEquals(new EngineSettings(List.of("HealthCheck", "favicon\\.ico"), 14), config.engineSettings());
        assertEquals(List.of("tenant"), config.extractorSettings().highCardinalityFields());
    }

    @Test
    void localOverrideWinsOverSharedFile() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-local-");
        Files.writeString(dir.resolve("alert.json"), "{\"retentionDays\": 14}");
        Files.writeString(dir.resolve("alert.local.json"), "{\"retentionDays\": 3}");

        assertEquals(3, ConfigLoader.loadAlertConfig(dir).retentionDays());
    }

    @Test
    void missingConfigFallsBackToDefaults() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-missing-");

        AlertConfig config = ConfigLoader.loadAlertConfig(dir);

        assertEquals(AlertConfig.defaults(), config);
        assertEquals(Path.of(AlertConfig.DEFAULT_HISTORY_FILE), config.historyPath());
        assertEquals(EngineSettings.defaults(), config.engineSettings());
        assertEquals(ExtractorSettings.defaults(), config.extractorSettings());
        assertEquals(ZoneId.of("UTC"), config.zoneId());
    }

    @Test
    void partialConfigKeepsDefaultsForOmittedFields() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-partial-");
        Files.writeString(dir.resolve("alert.json"), "{\"ignorePatterns\": [\"quota\"]}");

        AlertConfig config = ConfigLoader.loadAlertConfig(dir);

        assertEquals(EngineSettings.DEFAULT_RETENTION_DAYS, config.retentionDays());
        assertEquals(List.of("quota"), config.ignorePatterns());
    }

    @Test
    void invalidConfigFailsFastWithPathInMessage() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-invalid-");
        Files.writeString(dir.resolve("alert.json"), "{not-json");

        IllegalStateException invalid = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadAlertConfig(dir));
        assertTrue(invalid.getMessage().contains("alert.json"));
    }
}
