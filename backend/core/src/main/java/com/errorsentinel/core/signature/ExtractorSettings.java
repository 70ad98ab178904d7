package com.errorsentinel.core.signature;

import java.util.List;
import java.util.Set;

public record ExtractorSettings(
        List<String> highCardinalityFields,
        Set<String> errorLevels,
        int minHexIdLength,
        int minNumberLength,
        int minBracePayloadLength,
        int minBracketPayloadLength,
        int messageMaxLength,
        int fallbackMaxLength
) {
    public static final List<String> DEFAULT_FIELDS =
            List.of("preset", "langCode", "consumer", "name", "desc", "image_file", "prompt");
    public static final Set<String> DEFAULT_ERROR_LEVELS = Set.of("ERROR", "WARN", "FATAL");

    public ExtractorSettings {
        highCardinalityFields = List.copyOf(highCardinalityFields);
        errorLevels = Set.copyOf(errorLevels);
        if (errorLevels.isEmpty()) {
            throw new IllegalArgumentException("errorLevels must not be empty");
        }
        if (minHexIdLength < 1 || minNumberLength < 1) {
            throw new IllegalArgumentException("token length thresholds must be positive");
        }
        if (messageMaxLength < 1 || fallbackMaxLength < 1) {
            throw new IllegalArgumentException("max lengths must be positive");
        }
    }

    public static ExtractorSettings defaults() {
        return new ExtractorSettings(DEFAULT_FIELDS, DEFAULT_ERROR_LEVELS, 8, 5, 20, 30, 80, 100);
    }

    public ExtractorSettings withHighCardinalityFields(List<String> fields) {
        return new ExtractorSettings(
                fields,
                errorLevels,
                minHexIdLength,
                minNumberLength,
                minBracePayloadLength,
                minBracketPayloadLength,
                messageMaxLength,
                fallbackMaxLength
        );
    }
}
