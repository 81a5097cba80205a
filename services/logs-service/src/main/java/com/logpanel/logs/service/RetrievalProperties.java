package com.logpanel.logs.service;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "logs.retrieval")
public class RetrievalProperties {
    private long fetchTimeoutMs = 30000;
    private Bulk bulk = new Bulk();

    public long getFetchTimeoutMs() {
        return fetchTimeoutMs;
    }

    public void setFetchTimeoutMs(long fetchTimeoutMs) {
        this.fetchTimeoutMs = fetchTimeoutMs;
    }

    public Bulk getBulk() {
        return bulk;
    }

    public void setBulk(Bulk bulk) {
        this.bulk = bulk;
    }

    public static class Bulk {
        private int maxPages = 3;
        private int maxEntries = 3000;
        private int pageSize = 500;
        private long initialDelayMs = 500;
        private long interPageDelayMs = 2000;
        private long maxInterPageDelayMs = 10000;
        private long timeoutMs = 30000;

        public int getMaxPages() {
            return maxPages;
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = maxPages;
        }

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }

        public int getPageSize() {
            return pageSize;
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }

        public long getInitialDelayMs() {
            return initialDelayMs;
        }

        public void setInitialDelayMs(long initialDelayMs) {
            this.initialDelayMs = initialDelayMs;
        }

        public long getInterPageDelayMs() {
            return interPageDelayMs;
        }

        public void setInterPageDelayMs(long interPageDelayMs) {
            this.interPageDelayMs = interPageDelayMs;
        }

        public long getMaxInterPageDelayMs() {
            return maxInterPageDelayMs;
        }

        public void setMaxInterPageDelayMs(long maxInterPageDelayMs) {
            this.maxInterPageDelayMs = maxInterPageDelayMs;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }
}
