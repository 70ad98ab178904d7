package com.errorsentinel.core.model;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

public record SignatureAggregate(
        String signature,
        int count,
        Set<String> sources,
        String lastSeenTimestamp,
        String sampleMessage
) {
    public SignatureAggregate {
        sources = Collections.unmodifiableSet(new TreeSet<>(sources));
    }
}
