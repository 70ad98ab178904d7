package com.errorsentinel.core.signature;

import java.util.List;
import java.util.Optional;

public final class SignatureExtractor {
    private final List<SignatureRule> rules;

    public SignatureExtractor(List<SignatureRule> rules) {
        if (rules.isEmpty()) {
            throw new IllegalArgumentException("at least one signature rule is required");
        }
        this.rules = List.copyOf(rules);
    }

    public static SignatureExtractor withDefaults() {
        return from(ExtractorSettings.defaults());
    }

    public static SignatureExtractor from(ExtractorSettings settings) {
        return new SignatureExtractor(SignatureRules.defaults(settings));
    }

    public Optional<String> extract(String message) {
        if (message == null || message.isBlank()) {
            return Optional.empty();
        }
        String line = message.strip();
        for (SignatureRule rule : rules) {
            RuleOutcome outcome = rule.apply(line);
            if (outcome.matched()) {
                return Optional.ofNullable(outcome.signature());
            }
        }
        return Optional.empty();
    }

    public List<SignatureRule> rules() {
        return rules;
    }
}
