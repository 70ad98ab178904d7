package com.errorsentinel.core.signature;

public final class FallbackRule implements SignatureRule {
    private final int maxLength;
    private final SignatureNormalizer normalizer;

    public FallbackRule(int maxLength, SignatureNormalizer normalizer) {
        this.maxLength = maxLength;
        this.normalizer = normalizer;
    }

    @Override
    public RuleOutcome apply(String line) {
        String head = line.length() > maxLength ? line.substring(0, maxLength) : line;
        return RuleOutcome.signature(normalizer.normalize(head));
    }
}
