package com.errorsentinel.core.signature;

import java.util.List;

public final class StackTraceLineRule implements SignatureRule {
    private static final List<String> CONTINUATION_PREFIXES = List.of("at ", "Caused by:", "...");

    @Override
    public RuleOutcome apply(String line) {
        for (String prefix : CONTINUATION_PREFIXES) {
            if (line.startsWith(prefix)) {
                return RuleOutcome.discard();
            }
        }
        return RuleOutcome.noMatch();
    }
}
