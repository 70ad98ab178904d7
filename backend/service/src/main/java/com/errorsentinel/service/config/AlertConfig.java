package com.errorsentinel.service.config;

import com.errorsentinel.core.signature.ExtractorSettings;
import com.errorsentinel.engine.run.EngineSettings;

import java.nio.file.Path;
import java.time.ZoneId;
import java.util.List;

public record AlertConfig(
        String historyFile,
        Integer retentionDays,
        List<String> ignorePatterns,
        String zone,
        List<String> signatureFields
) {
    public static final String DEFAULT_HISTORY_FILE = "state/error-history.json";

    public AlertConfig {
        historyFile = historyFile == null || historyFile.isBlank() ? DEFAULT_HISTORY_FILE : historyFile;
        retentionDays = retentionDays == null ? EngineSettings.DEFAULT_RETENTION_DAYS : retentionDays;
        ignorePatterns = ignorePatterns == null ? List.of() : List.copyOf(ignorePatterns);
        zone = zone == null || zone.isBlank() ? "UTC" : zone;
    }

    public static AlertConfig defaults() {
        return new AlertConfig(null, null, null, null, null);
    }

    public Path historyPath() {
        return Path.of(historyFile);
    }

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }

    public EngineSettings engineSettings() {
        return new EngineSettings(ignorePatterns, retentionDays);
    }

    public ExtractorSettings extractorSettings() {
        ExtractorSettings defaults = ExtractorSettings.defaults();
        return signatureFields == null ? defaults : defaults.withHighCardinalityFields(signatureFields);
    }
}
