package com.errorsentinel.engine.history;

import com.errorsentinel.core.model.HistoryEntry;

import java.util.Map;
import java.util.Set;

public record HistoryUpdate(Map<String, HistoryEntry> history, Set<String> newSignatures) {
}
