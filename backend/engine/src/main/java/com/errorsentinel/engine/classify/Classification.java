package com.errorsentinel.engine.classify;

import com.errorsentinel.core.model.ClassifiedGroup;

import java.util.ArrayList;
import java.util.List;

public record Classification(List<ClassifiedGroup> attention, List<ClassifiedGroup> noise) {
    public Classification {
        attention = List.copyOf(attention);
        noise = List.copyOf(noise);
    }

    public List<ClassifiedGroup> all() {
        List<ClassifiedGroup> all = new ArrayList<>(attention);
        all.addAll(noise);
        return all;
    }
}
