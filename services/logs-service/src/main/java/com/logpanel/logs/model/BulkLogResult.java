package com.logpanel.logs.model;

import java.util.Collections;
import java.util.List;

public class BulkLogResult {
    private final List<LogEntry> entries;
    private final int pagesFetched;
    private final String lastCursor;
    private final boolean rateLimited;
    private final boolean truncated;

    public BulkLogResult(
        List<LogEntry> entries,
        int pagesFetched,
        String lastCursor,
        boolean rateLimited,
        boolean truncated
    ) {
        this.entries = entries == null ? Collections.emptyList() : List.copyOf(entries);
        this.pagesFetched = pagesFetched;
        this.lastCursor = lastCursor == null ? "" : lastCursor;
        this.rateLimited = rateLimited;
        this.truncated = truncated;
    }

    public List<LogEntry> getEntries() {
        return entries;
    }

    public int getPagesFetched() {
        return pagesFetched;
    }

    public String getLastCursor() {
        return lastCursor;
    }

    public boolean isRateLimited() {
        return rateLimited;
    }

    public boolean isTruncated() {
        return truncated;
    }
}
