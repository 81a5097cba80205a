package com.logpanel.logs.service;

import com.logpanel.logs.cache.CachedPage;
import com.logpanel.logs.cache.PageCache;
import com.logpanel.logs.cache.PageFingerprint;
import com.logpanel.logs.model.BulkLogResult;
import com.logpanel.logs.model.LogEntry;
import com.logpanel.logs.model.LogPage;
import com.logpanel.logs.model.LogQueryRequest;
import com.logpanel.logs.query.LogQueryTranslator;
import com.logpanel.logs.resilience.ConcurrencyGate;
import com.logpanel.logs.upstream.FetchBudget;
import com.logpanel.logs.upstream.FetchedPage;
import com.logpanel.logs.upstream.LogPageFetcher;
import com.logpanel.logs.upstream.LogsApiException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class LogRetrievalService {
    private static final Logger logger = LoggerFactory.getLogger(LogRetrievalService.class);

    private final LogQueryTranslator translator;
    private final PageCache pageCache;
    private final ConcurrencyGate gate;
    private final LogPageFetcher fetcher;
    private final RetrievalProperties properties;

    public LogRetrievalService(
        LogQueryTranslator translator,
        PageCache pageCache,
        ConcurrencyGate gate,
        LogPageFetcher fetcher,
        RetrievalProperties properties
    ) {
        this.translator = translator;
        this.pageCache = pageCache;
        this.gate = gate;
        this.fetcher = fetcher;
        this.properties = properties;
    }

    public LogPage retrieve(LogQueryRequest request) {
        return retrieve(request, FetchBudget.of(Duration.ofMillis(properties.getFetchTimeoutMs())));
    }

    // A failed fetch caches nothing and keeps any earlier entry for the fingerprint.
    public LogPage retrieve(LogQueryRequest request, FetchBudget budget) {
        validate(request);
        String translated = translator.translate(request.getQuery());
        PageFingerprint fingerprint = PageFingerprint.of(
            translated,
            request.getFrom(),
            request.getTo(),
            request.getCursor(),
            request.getPageSize()
        );

        Optional<CachedPage> cached = pageCache.get(fingerprint, pageCache.getTtl());
        if (cached.isPresent()) {
            CachedPage page = cached.get();
            logger.debug("logs_page_cache_hit query={} cursor={}", translated, request.getCursor());
            return new LogPage(page.entries(), page.nextCursor(), request.getPageSize(), translated, true);
        }

        FetchBudget fetchBudget = budget.narrowTo(Duration.ofMillis(properties.getFetchTimeoutMs()));
        gate.acquire(fetchBudget);
        FetchedPage fetched;
        try {
            fetched = fetcher.fetchPage(
                translated,
                request.getFrom(),
                request.getTo(),
                request.getCursor(),
                request.getPageSize(),
                fetchBudget
            );
        } finally {
            gate.release();
        }

        pageCache.put(fingerprint, fetched.entries(), fetched.nextCursor());
        return new LogPage(fetched.entries(), fetched.nextCursor(), request.getPageSize(), translated, false);
    }

    public BulkLogResult retrieveAll(LogQueryRequest request) {
        return retrieveAll(request, FetchBudget.of(Duration.ofMillis(properties.getBulk().getTimeoutMs())));
    }

    public BulkLogResult retrieveAll(LogQueryRequest request, FetchBudget budget) {
        validate(request);
        RetrievalProperties.Bulk bulk = properties.getBulk();
        LogQueryRequest pageRequest = request.withPageSize(bulk.getPageSize());

        budget.await(Duration.ofMillis(bulk.getInitialDelayMs()));

        List<LogEntry> entries = new ArrayList<>();
        int pagesFetched = 0;
        String cursor = pageRequest.getCursor();
        boolean rateLimited = false;
        boolean truncated = false;

        while (true) {
            if (pagesFetched > 0) {
                budget.await(interPageDelay(pagesFetched, bulk));
            }
            LogPage page;
            try {
                page = retrieve(pageRequest.withCursor(cursor), budget);
            } catch (LogsApiException e) {
                if (!e.isRateLimited()) {
                    throw e;
                }
                logger.warn("logs_bulk_rate_limited entries={} pages_fetched={}", entries.size(), pagesFetched);
                rateLimited = true;
                break;
            }
            pagesFetched++;
            entries.addAll(page.getEntries());
            cursor = page.getNextCursor();

            if (!page.hasNextPage() || page.getEntries().isEmpty()) {
                break;
            }
            if (entries.size() >= bulk.getMaxEntries() || pagesFetched >= bulk.getMaxPages()) {
                truncated = true;
                break;
            }
        }

        if (entries.size() > bulk.getMaxEntries()) {
            entries = new ArrayList<>(entries.subList(0, bulk.getMaxEntries()));
            truncated = true;
        }
        logger.info(
            "logs_bulk_completed pages_fetched={} entries={} rate_limited={} truncated={}",
            pagesFetched,
            entries.size(),
            rateLimited,
            truncated
        );
        return new BulkLogResult(entries, pagesFetched, cursor, rateLimited, truncated);
    }

    static Duration interPageDelay(int pagesFetched, RetrievalProperties.Bulk bulk) {
        int shift = Math.min(Math.max(0, pagesFetched - 1), 30);
        long delayMs = bulk.getInterPageDelayMs() << shift;
        if (delayMs < 0 || delayMs > bulk.getMaxInterPageDelayMs()) {
            delayMs = bulk.getMaxInterPageDelayMs();
        }
        return Duration.ofMillis(delayMs);
    }

    private static void validate(LogQueryRequest request) {
        if (request == null) {
            throw new InvalidLogQueryException("request is required");
        }
        if (request.getFrom().isAfter(request.getTo())) {
            throw new InvalidLogQueryException("from must not be after to");
        }
    }
}
