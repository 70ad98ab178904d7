package com.errorsentinel.core.signature;

public interface SignatureRule {
    RuleOutcome apply(String line);
}
