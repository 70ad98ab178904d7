package com.errorsentinel.core.signature;

import java.util.List;

public final class SignatureRules {
    private SignatureRules() {
    }

    public static List<SignatureRule> defaults(ExtractorSettings settings) {
        SignatureNormalizer messages = SignatureNormalizer.forMessages(settings);
        return List.of(
                new StackTraceLineRule(),
                new ExceptionMessageRule(messages),
                new ExceptionClassRule(),
                new LeveledLogLineRule(settings.errorLevels(), messages),
                new FallbackRule(settings.fallbackMaxLength(), SignatureNormalizer.forFallback(settings))
        );
    }
}
