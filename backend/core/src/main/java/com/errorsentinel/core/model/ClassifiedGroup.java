package com.errorsentinel.core.model;

import java.util.Objects;

public record ClassifiedGroup(SignatureAggregate aggregate, boolean noise) {
    public ClassifiedGroup {
        Objects.requireNonNull(aggregate, "aggregate is required");
    }

    public String signature() {
        return aggregate.signature();
    }

    public int count() {
        return aggregate.count();
    }
}
