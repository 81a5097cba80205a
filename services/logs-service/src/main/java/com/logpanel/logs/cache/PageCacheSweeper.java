package com.logpanel.logs.cache;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class PageCacheSweeper {
    private final PageCache cache;

    public PageCacheSweeper(PageCache cache) {
        this.cache = cache;
    }

    @Scheduled(fixedDelayString = "${logs.cache.page.sweep-interval-ms:60000}")
    public void sweep() {
        if (cache.isEnabled()) {
            cache.sweepExpired(cache.getTtl());
        }
    }
}
