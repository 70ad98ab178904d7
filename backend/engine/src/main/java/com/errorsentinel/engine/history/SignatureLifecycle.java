package com.errorsentinel.engine.history;

import com.errorsentinel.core.model.ClassifiedGroup;
import com.errorsentinel.core.model.HistoryEntry;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

public final class SignatureLifecycle {
    private SignatureLifecycle() {
    }

    public static HistoryUpdate update(Map<String, HistoryEntry> history, List<ClassifiedGroup> groups, LocalDate today) {
        Map<String, HistoryEntry> updated = new TreeMap<>(history);
        Set<String> newSignatures = new LinkedHashSet<>();
        for (ClassifiedGroup group : groups) {
            HistoryEntry entry = updated.get(group.signature());
            if (entry == null) {
                entry = HistoryEntry.firstSeen(today);
                newSignatures.add(group.signature());
            }
            updated.put(group.signature(), entry.observed(today, group.count()));
        }
        return new HistoryUpdate(updated, Collections.unmodifiableSet(newSignatures));
    }

    public static Map<String, HistoryEntry> expire(Map<String, HistoryEntry> history, LocalDate today, int retentionDays) {
        if (retentionDays < 0) {
            throw new IllegalArgumentException("retentionDays must be >= 0");
        }
        LocalDate cutoff = today.minusDays(retentionDays);
        Map<String, HistoryEntry> kept = new TreeMap<>();
        history.forEach((signature, entry) -> {
            if (entry != null && entry.lastSeenDate() != null && !entry.lastSeenDate().isBefore(cutoff)) {
                kept.put(signature, entry);
            }
        });
        return kept;
    }
}
