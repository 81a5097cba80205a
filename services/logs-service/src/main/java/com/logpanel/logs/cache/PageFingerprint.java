package com.logpanel.logs.cache;

import java.time.Instant;

public record PageFingerprint(String translatedQuery, long fromMillis, long toMillis, String cursor, int pageSize) {
    static final String KEY_PREFIX = "logs";
    static final String FIRST_PAGE = "first";

    public PageFingerprint {
        translatedQuery = translatedQuery == null ? "" : translatedQuery;
        cursor = cursor == null ? "" : cursor;
    }

    public static PageFingerprint of(String translatedQuery, Instant from, Instant to, String cursor, int pageSize) {
        return new PageFingerprint(translatedQuery, from.toEpochMilli(), to.toEpochMilli(), cursor, pageSize);
    }

    /**
     * Renders {@code logs:<query>:<from>:<to>:<cursor|first>:<pageSize>}. Separators inside the
     * query and cursor are escaped so distinct fingerprints never share a key.
     */
    public String toKey() {
        return KEY_PREFIX
            + ':' + escape(translatedQuery)
            + ':' + fromMillis
            + ':' + toMillis
            + ':' + cursorComponent()
            + ':' + pageSize;
    }

    private String cursorComponent() {
        if (cursor.isEmpty()) {
            return FIRST_PAGE;
        }
        String escaped = escape(cursor);
        return FIRST_PAGE.equals(escaped) ? "%66irst" : escaped;
    }

    private static String escape(String value) {
        return value.replace("%", "%25").replace(":", "%3A");
    }
}
