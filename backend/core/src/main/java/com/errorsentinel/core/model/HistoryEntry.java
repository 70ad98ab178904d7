package com.errorsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.time.LocalDate;

// snake_case aliases read history files from the older script-based tool
public record HistoryEntry(
        @JsonAlias("first_seen") LocalDate firstSeenDate,
        @JsonAlias("last_seen") LocalDate lastSeenDate,
        @JsonAlias("total_count") long totalCount
) {
    public static HistoryEntry firstSeen(LocalDate today) {
        return new HistoryEntry(today, today, 0);
    }

    public HistoryEntry observed(LocalDate today, int count) {
        return new HistoryEntry(firstSeenDate, today, totalCount + count);
    }
}
