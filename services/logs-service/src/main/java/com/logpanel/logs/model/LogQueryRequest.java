package com.logpanel.logs.model;

import java.time.Instant;
import java.util.Objects;

public final class LogQueryRequest {
    public static final int DEFAULT_PAGE_SIZE = 100;
    public static final int MAX_PAGE_SIZE = 1000;

    private final String query;
    private final Instant from;
    private final Instant to;
    private final String cursor;
    private final int pageSize;

    public LogQueryRequest(String query, Instant from, Instant to, String cursor, Integer pageSize) {
        this.query = query == null ? "" : query;
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
        this.cursor = cursor == null ? "" : cursor.trim();
        this.pageSize = resolvePageSize(pageSize);
    }

    public static LogQueryRequest firstPage(String query, Instant from, Instant to, Integer pageSize) {
        return new LogQueryRequest(query, from, to, "", pageSize);
    }

    public LogQueryRequest withCursor(String nextCursor) {
        return new LogQueryRequest(query, from, to, nextCursor, pageSize);
    }

    public LogQueryRequest withPageSize(int size) {
        return new LogQueryRequest(query, from, to, cursor, size);
    }

    public String getQuery() {
        return query;
    }

    public Instant getFrom() {
        return from;
    }

    public Instant getTo() {
        return to;
    }

    public String getCursor() {
        return cursor;
    }

    public boolean isFirstPage() {
        return cursor.isEmpty();
    }

    public int getPageSize() {
        return pageSize;
    }

    static int resolvePageSize(Integer requested) {
        if (requested == null || requested <= 0) {
            return DEFAULT_PAGE_SIZE;
        }
        return Math.min(requested, MAX_PAGE_SIZE);
    }
}
