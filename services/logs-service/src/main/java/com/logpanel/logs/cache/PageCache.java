package com.logpanel.logs.cache;

import com.logpanel.logs.model.LogEntry;
import io.micrometer.core.instrument.Metrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
public class PageCache {
    private static final Logger logger = LoggerFactory.getLogger(PageCache.class);

    private final PageCacheProperties properties;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, CachedPage> entries = new LinkedHashMap<>();

    @Autowired
    public PageCache(PageCacheProperties properties) {
        this(properties, Clock.systemUTC());
    }

    PageCache(PageCacheProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public boolean isEnabled() {
        return properties.isEnabled();
    }

    public Duration getTtl() {
        return Duration.ofMillis(properties.getTtlMs());
    }

    public Optional<CachedPage> get(PageFingerprint fingerprint, Duration ttl) {
        if (!properties.isEnabled() || fingerprint == null) {
            return Optional.empty();
        }
        String key = fingerprint.toKey();
        lock.lock();
        try {
            CachedPage page = entries.get(key);
            if (page == null) {
                Metrics.counter("logs_page_cache_misses_total").increment();
                return Optional.empty();
            }
            if (page.isExpired(clock.instant(), ttl)) {
                entries.remove(key, page);
                Metrics.counter("logs_page_cache_misses_total").increment();
                return Optional.empty();
            }
            Metrics.counter("logs_page_cache_hits_total").increment();
            return Optional.of(page);
        } finally {
            lock.unlock();
        }
    }

    public void put(PageFingerprint fingerprint, List<LogEntry> pageEntries, String nextCursor) {
        if (!properties.isEnabled() || fingerprint == null) {
            return;
        }
        String key = fingerprint.toKey();
        CachedPage page = new CachedPage(pageEntries, nextCursor, clock.instant());
        lock.lock();
        try {
            // Re-insert so an overwritten key moves to the young end of the eviction order.
            entries.remove(key);
            entries.put(key, page);
            evictIfNeeded();
        } finally {
            lock.unlock();
        }
    }

    public int sweepExpired(Duration ttl) {
        Instant now = clock.instant();
        int removed = 0;
        lock.lock();
        try {
            Iterator<Map.Entry<String, CachedPage>> iterator = entries.entrySet().iterator();
            while (iterator.hasNext()) {
                if (iterator.next().getValue().isExpired(now, ttl)) {
                    iterator.remove();
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            logger.debug("logs_page_cache_swept removed={}", removed);
        }
        return removed;
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    private void evictIfNeeded() {
        int maxEntries = Math.max(1, properties.getMaxEntries());
        Iterator<String> oldest = entries.keySet().iterator();
        while (entries.size() > maxEntries && oldest.hasNext()) {
            oldest.next();
            oldest.remove();
        }
    }
}
