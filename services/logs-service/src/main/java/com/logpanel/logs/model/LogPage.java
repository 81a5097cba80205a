package com.logpanel.logs.model;

import java.util.Collections;
import java.util.List;

public class LogPage {
    private final List<LogEntry> entries;
    private final String nextCursor;
    private final int pageSize;
    private final String translatedQuery;
    private final boolean cacheHit;

    public LogPage(List<LogEntry> entries, String nextCursor, int pageSize, String translatedQuery, boolean cacheHit) {
        this.entries = entries == null ? Collections.emptyList() : List.copyOf(entries);
        this.nextCursor = nextCursor == null ? "" : nextCursor;
        this.pageSize = pageSize;
        this.translatedQuery = translatedQuery;
        this.cacheHit = cacheHit;
    }

    public List<LogEntry> getEntries() {
        return entries;
    }

    public String getNextCursor() {
        return nextCursor;
    }

    public boolean hasNextPage() {
        return !nextCursor.isEmpty();
    }

    public int getPageSize() {
        return pageSize;
    }

    public String getTranslatedQuery() {
        return translatedQuery;
    }

    public boolean isCacheHit() {
        return cacheHit;
    }
}
