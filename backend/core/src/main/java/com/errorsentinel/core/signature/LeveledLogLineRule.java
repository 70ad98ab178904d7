package com.errorsentinel.core.signature;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class LeveledLogLineRule implements SignatureRule {
    private static final Pattern PATTERN = Pattern.compile("\\[(\\w+)\\s*]\\s+\\[[\\w$.\\-]+]\\s+(.*)");

    private final Set<String> levels;
    private final SignatureNormalizer normalizer;

    public LeveledLogLineRule(Set<String> levels, SignatureNormalizer normalizer) {
        this.levels = Set.copyOf(levels);
        this.normalizer = normalizer;
    }

    @Override
    public RuleOutcome apply(String line) {
        Matcher matcher = PATTERN.matcher(line);
        int from = 0;
        // Thread names are bracketed too, so restart after each non-level token.
        while (from < line.length() && matcher.find(from)) {
            String level = matcher.group(1);
            if (levels.contains(level)) {
                String message = normalizer.normalize(matcher.group(2).trim());
                return RuleOutcome.signature("[" + level + "] " + message);
            }
            from = matcher.end(1);
        }
        return RuleOutcome.noMatch();
    }
}
