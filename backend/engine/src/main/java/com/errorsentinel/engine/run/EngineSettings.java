package com.errorsentinel.engine.run;

import java.util.List;

public record EngineSettings(List<String> customNoisePatterns, int retentionDays) {
    public static final int DEFAULT_RETENTION_DAYS = 30;

    public EngineSettings {
        customNoisePatterns = List.copyOf(customNoisePatterns);
        if (retentionDays < 0) {
            throw new IllegalArgumentException("retentionDays must be >= 0");
        }
    }

    public static EngineSettings defaults() {
        return new EngineSettings(List.of(), DEFAULT_RETENTION_DAYS);
    }
}
