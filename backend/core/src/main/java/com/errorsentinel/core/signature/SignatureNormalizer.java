package com.errorsentinel.core.signature;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public final class SignatureNormalizer {
    private final List<Scrub> scrubs;
    private final int maxLength;

    private SignatureNormalizer(List<Scrub> scrubs, int maxLength) {
        this.scrubs = List.copyOf(scrubs);
        this.maxLength = maxLength;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SignatureNormalizer forMessages(ExtractorSettings settings) {
        Builder builder = builder()
                .hexIds(settings.minHexIdLength())
                .longNumbers(settings.minNumberLength())
                .urls();
        if (!settings.highCardinalityFields().isEmpty()) {
            builder.fieldValues(settings.highCardinalityFields());
        }
        return builder
                .bracePayloads(settings.minBracePayloadLength())
                .bracketPayloads(settings.minBracketPayloadLength())
                .maxLength(settings.messageMaxLength())
                .build();
    }

    // no length limit: FallbackRule cuts the raw line before scrubbing
    public static SignatureNormalizer forFallback(ExtractorSettings settings) {
        return builder()
                .hexIds(settings.minHexIdLength())
                .isoTimestamps()
                .longNumbers(settings.minNumberLength())
                .build();
    }

    public String normalize(String text) {
        String result = text;
        for (Scrub scrub : scrubs) {
            result = scrub.pattern().matcher(result).replaceAll(scrub.replacement());
        }
        if (maxLength > 0 && result.length() > maxLength) {
            result = result.substring(0, maxLength);
        }
        return result;
    }

    private record Scrub(Pattern pattern, String replacement) {
    }

    public static final class Builder {
        private final List<Scrub> scrubs = new ArrayList<>();
        private int maxLength;

        private Builder() {
        }

        public Builder replace(String regex, String replacement) {
            scrubs.add(new Scrub(Pattern.compile(regex), replacement));
            return this;
        }

        public Builder hexIds(int minLength) {
            return replace("\\b[0-9a-f]{" + minLength + ",}\\b", "{id}");
        }

        public Builder longNumbers(int minLength) {
            return replace("\\b\\d{" + minLength + ",}\\b", "{num}");
        }

        public Builder urls() {
            return replace("https?://\\S+", "{url}");
        }

        public Builder isoTimestamps() {
            return replace("\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}:\\d{2}[\\d.]*", "{ts}");
        }

        public Builder fieldValues(Collection<String> fieldNames) {
            String alternation = fieldNames.stream()
                    .map(Pattern::quote)
                    .collect(Collectors.joining("|"));
            return replace("(" + alternation + ")[=:]\\s*\\S+", "$1={val}");
        }

        public Builder bracePayloads(int minLength) {
            return replace("\\{[^}]{" + minLength + ",}\\}", "{...}");
        }

        public Builder bracketPayloads(int minLength) {
            return replace("\\[[^\\]]{" + minLength + ",}\\]", "[...]");
        }

        public Builder maxLength(int maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        public SignatureNormalizer build() {
            return new SignatureNormalizer(scrubs, maxLength);
        }
    }
}
