package com.errorsentinel.engine.support;

import com.errorsentinel.core.model.HistoryEntry;
import com.errorsentinel.engine.api.HistoryStore;

import java.util.Map;
import java.util.TreeMap;

public class InMemoryHistoryStore implements HistoryStore {
    private Map<String, HistoryEntry> stored = new TreeMap<>();
    private int saves;
    private boolean failOnSave;

    @Override
    public Map<String, HistoryEntry> load() {
        return new TreeMap<>(stored);
    }

    @Override
    public void save(Map<String, HistoryEntry> history) {
        if (failOnSave) {
            throw new IllegalStateException("Failed writing history to memory");
        }
        stored = new TreeMap<>(history);
        saves++;
    }

    public void put(String signature, HistoryEntry entry) {
        stored.put(signature, entry);
    }

    public Map<String, HistoryEntry> stored() {
        return Map.copyOf(stored);
    }

    public int saves() {
        return saves;
    }

    public void failOnSave(boolean failOnSave) {
        this.failOnSave = failOnSave;
    }
}
