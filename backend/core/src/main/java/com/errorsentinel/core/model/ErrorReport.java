package com.errorsentinel.core.model;

import java.util.List;
import java.util.Set;

public record ErrorReport(
        List<ClassifiedGroup> attention,
        List<ClassifiedGroup> noise,
        Set<String> newSignatures,
        int totalRecords
) {
    public ErrorReport {
        attention = List.copyOf(attention);
        noise = List.copyOf(noise);
        newSignatures = Set.copyOf(newSignatures);
    }

    public int patternCount() {
        return attention.size() + noise.size();
    }

    public int noiseRecordCount() {
        return noise.stream().mapToInt(ClassifiedGroup::count).sum();
    }

    public boolean isNew(String signature) {
        return newSignatures.contains(signature);
    }
}
