package com.logpanel.logs.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class LogsBulkResponse {
    private List<LogRecord> entries;

    @JsonProperty("total_entries")
    private int totalEntries;

    @JsonProperty("pages_fetched")
    private int pagesFetched;

    @JsonProperty("last_cursor")
    private String lastCursor;

    @JsonProperty("rate_limited")
    private boolean rateLimited;

    private boolean truncated;

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

    public int getTotalEntries() {
        return totalEntries;
    }

    public void setTotalEntries(int totalEntries) {
        this.totalEntries = totalEntries;
    }

    public int getPagesFetched() {
        return pagesFetched;
    }

    public void setPagesFetched(int pagesFetched) {
        this.pagesFetched = pagesFetched;
    }

    public String getLastCursor() {
        return lastCursor;
    }

    public void setLastCursor(String lastCursor) {
        this.lastCursor = lastCursor;
    }

    public boolean isRateLimited() {
        return rateLimited;
    }

    public void setRateLimited(boolean rateLimited) {
        this.rateLimited = rateLimited;
    }

    public boolean isTruncated() {
        return truncated;
    }

    public void setTruncated(boolean truncated) {
        this.truncated = truncated;
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
}
