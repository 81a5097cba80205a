package com.logpanel.logs.upstream;

import java.time.Instant;

public interface LogPageFetcher {
    FetchedPage fetchPage(
        String translatedQuery,
        Instant from,
        Instant to,
        String cursor,
        int pageSize,
        FetchBudget budget
    );
}
