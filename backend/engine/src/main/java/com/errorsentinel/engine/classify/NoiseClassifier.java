package com.errorsentinel.engine.classify;

import com.errorsentinel.core.model.ClassifiedGroup;
import com.errorsentinel.core.model.SignatureAggregate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public class NoiseClassifier {
    static final Comparator<ClassifiedGroup> REPORT_ORDER = Comparator
            .comparingInt(ClassifiedGroup::count).reversed()
            .thenComparing(ClassifiedGroup::signature);

    private final List<Pattern> patterns;

    public NoiseClassifier(List<String> customPatterns) {
        List<Pattern> compiled = new ArrayList<>();
        for (String pattern : NoisePatterns.BUILT_IN) {
            compiled.add(compile(pattern));
        }
        for (String pattern : customPatterns) {
            compiled.add(compile(pattern));
        }
        this.patterns = List.copyOf(compiled);
    }

    public Classification classify(Map<String, SignatureAggregate> aggregates) {
        List<ClassifiedGroup> attention = new ArrayList<>();
        List<ClassifiedGroup> noise = new ArrayList<>();
        for (SignatureAggregate aggregate : aggregates.values()) {
            if (isNoise(aggregate.signature())) {
                noise.add(new ClassifiedGroup(aggregate, true));
            } else {
                attention.add(new ClassifiedGroup(aggregate, false));
            }
        }
        attention.sort(REPORT_ORDER);
        noise.sort(REPORT_ORDER);
        return new Classification(attention, noise);
    }

    public boolean isNoise(String signature) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(signature).find()) {
                return true;
            }
        }
        return false;
    }

    public int patternCount() {
        return patterns.size();
    }

    private static Pattern compile(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("Noise pattern must not be blank");
        }
        try {
            return Pattern.compile(pattern, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid noise pattern '" + pattern + "': " + e.getDescription(), e);
        }
    }
}
