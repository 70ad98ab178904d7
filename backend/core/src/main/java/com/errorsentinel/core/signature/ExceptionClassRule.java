package com.errorsentinel.core.signature;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class ExceptionClassRule implements SignatureRule {
    private static final Pattern PATTERN = Pattern.compile(ExceptionMessageRule.THROWABLE_CLASS + "\\s*$");

    @Override
    public RuleOutcome apply(String line) {
        Matcher matcher = PATTERN.matcher(line);
        if (!matcher.find()) {
            return RuleOutcome.noMatch();
        }
        return RuleOutcome.signature(ExceptionMessageRule.shortClassName(matcher.group(1)));
    }
}
