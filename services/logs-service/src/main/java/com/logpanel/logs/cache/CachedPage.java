package com.logpanel.logs.cache;

import com.logpanel.logs.model.LogEntry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

public record CachedPage(List<LogEntry> entries, String nextCursor, Instant storedAt) {
    public CachedPage {
        entries = entries == null ? List.of() : List.copyOf(entries);
        nextCursor = nextCursor == null ? "" : nextCursor;
    }

    public boolean isExpired(Instant now, Duration ttl) {
        return Duration.between(storedAt, now).compareTo(ttl) > 0;
    }
}
