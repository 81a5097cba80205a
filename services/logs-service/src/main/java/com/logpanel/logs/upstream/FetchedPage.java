package com.logpanel.logs.upstream;

import com.logpanel.logs.model.LogEntry;
import java.util.List;

// An empty nextCursor means there are no further pages.
public record FetchedPage(List<LogEntry> entries, String nextCursor) {
    public FetchedPage {
        entries = entries == null ? List.of() : List.copyOf(entries);
        nextCursor = nextCursor == null ? "" : nextCursor;
    }
}
