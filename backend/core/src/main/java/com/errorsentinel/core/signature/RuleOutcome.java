package com.errorsentinel.core.signature;

import java.util.Objects;

public record RuleOutcome(Kind kind, String signature) {
    private static final RuleOutcome NO_MATCH = new RuleOutcome(Kind.NO_MATCH, null);
    private static final RuleOutcome DISCARD = new RuleOutcome(Kind.DISCARD, null);

    public enum Kind {
        NO_MATCH,
        // line carries no signature of its own
        DISCARD,
        SIGNATURE
    }

    public RuleOutcome {
        Objects.requireNonNull(kind, "kind is required");
        if (kind == Kind.SIGNATURE && (signature == null || signature.isBlank())) {
            throw new IllegalArgumentException("signature outcome requires a non-blank signature");
        }
    }

    public static RuleOutcome noMatch() {
        return NO_MATCH;
    }

    public static RuleOutcome discard() {
        return DISCARD;
    }

    public static RuleOutcome signature(String signature) {
        return new RuleOutcome(Kind.SIGNATURE, signature);
    }

    public boolean matched() {
        return kind != Kind.NO_MATCH;
    }
}
