package com.logpanel.logs.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class LogsQueryResponse {
    private List<LogRecord> entries;
    private Pagination pagination;

    @JsonProperty("translated_query")
    private String translatedQuery;

    @JsonProperty("cache_hit")
    private boolean cacheHit;

    @JsonProperty("took_ms")
    private long tookMs;

    @JsonProperty("trace_id")
    private String traceId;

    @JsonProperty("request_id")
    private String requestId;

    public List<LogRecord> getEntries() {
        return entries;
    }

    public void setEntries(List<LogRecord> entries) {
        this.entries = entries;
    }

    public Pagination getPagination() {
        return pagination;
    }

    public void setPagination(Pagination pagination) {
        this.pagination = pagination;
    }

    public String getTranslatedQuery() {
        return translatedQuery;
    }

    public void setTranslatedQuery(String translatedQuery) {
        this.translatedQuery = translatedQuery;
    }

    public boolean isCacheHit() {
        return cacheHit;
    }

    public void setCacheHit(boolean cacheHit) {
        this.cacheHit = cacheHit;
    }

    public long getTookMs() {
        return tookMs;
    }

    public void setTookMs(long tookMs) {
        this.tookMs = tookMs;
    }

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public static class Pagination {
        @JsonProperty("current_page")
        private int currentPage;

        @JsonProperty("page_size")
        private int pageSize;

        @JsonProperty("has_next_page")
        private boolean hasNextPage;

        @JsonProperty("next_cursor")
        private String nextCursor;

        @JsonProperty("total_entries")
        private int totalEntries;

        public int getCurrentPage() {
            return currentPage;
        }

        public void setCurrentPage(int currentPage) {
            this.currentPage = currentPage;
        }

        public int getPageSize() {
            return pageSize;
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }

        public boolean isHasNextPage() {
            return hasNextPage;
        }

        public void setHasNextPage(boolean hasNextPage) {
            this.hasNextPage = hasNextPage;
        }

        public String getNextCursor() {
            return nextCursor;
        }

        public void setNextCursor(String nextCursor) {
            this.nextCursor = nextCursor;
        }

        public int getTotalEntries() {
            return totalEntries;
        }

        public void setTotalEntries(int totalEntries) {
            this.totalEntries = totalEntries;
        }
    }
}
