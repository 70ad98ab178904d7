package com.errorsentinel.core.signature;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class ExceptionMessageRule implements SignatureRule {
    static final String THROWABLE_CLASS = "([\\w$.]+(?:Exception|Error|Failure|Fault|Throwable))";
    private static final Pattern PATTERN = Pattern.compile(THROWABLE_CLASS + "\\s*:\\s*(.*)");

    private final SignatureNormalizer normalizer;

    public ExceptionMessageRule(SignatureNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    @Override
    public RuleOutcome apply(String line) {
        Matcher matcher = PATTERN.matcher(line);
        if (!matcher.find()) {
            return RuleOutcome.noMatch();
        }
        String exceptionClass = shortClassName(matcher.group(1));
        String message = normalizer.normalize(matcher.group(2).trim());
        return RuleOutcome.signature(message.isEmpty() ? exceptionClass : exceptionClass + ": " + message);
    }

    static String shortClassName(String qualifiedName) {
        int lastDot = qualifiedName.lastIndexOf('.');
        return lastDot < 0 ? qualifiedName : qualifiedName.substring(lastDot + 1);
    }
}
