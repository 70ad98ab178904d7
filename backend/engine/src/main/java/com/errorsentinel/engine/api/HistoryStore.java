package com.errorsentinel.engine.api;

import com.errorsentinel.core.model.ClassifiedGroup;
import com.errorsentinel.core.model.HistoryEntry;
import com.errorsentinel.engine.history.HistoryUpdate;
import com.errorsentinel.engine.history.SignatureLifecycle;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public interface HistoryStore {
    Map<String, HistoryEntry> load();

    void save(Map<String, HistoryEntry> history);

    default HistoryUpdate update(Map<String, HistoryEntry> history, List<ClassifiedGroup> groups, LocalDate today) {
        return SignatureLifecycle.update(history, groups, today);
    }

    default Map<String, HistoryEntry> expire(Map<String, HistoryEntry> history, LocalDate today, int retentionDays) {
        return SignatureLifecycle.expire(history, today, retentionDays);
    }
}
