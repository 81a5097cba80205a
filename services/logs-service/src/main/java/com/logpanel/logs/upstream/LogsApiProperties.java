package com.logpanel.logs.upstream;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "logs.api")
public class LogsApiProperties {
    private String site = "datadoghq.com";
    private String baseUrl;
    private String apiKey;
    private String appKey;
    private String apiKeyHeader = "DD-API-KEY";
    private String appKeyHeader = "DD-APPLICATION-KEY";
    private String searchPath = "/api/v2/logs/events/search";
    private int connectTimeoutMs = 5000;
    private int readTimeoutMs = 30000;
    private int narrowingSlackMs = 1000;
    private int maxPageSize = 1000;
    private Retry retry = new Retry();

    public String resolveBaseUrl() {
        if (baseUrl != null && !baseUrl.isBlank()) {
            return baseUrl;
        }
        return "https://api." + site;
    }

    public boolean hasCredentials() {
        return apiKey != null && !apiKey.isBlank() && appKey != null && !appKey.isBlank();
    }

    public String getSite() {
        return site;
    }

    public void setSite(String site) {
        this.site = site;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getAppKey() {
        return appKey;
    }

    public void setAppKey(String appKey) {
        this.appKey = appKey;
    }

    public String getApiKeyHeader() {
        return apiKeyHeader;
    }

    public void setApiKeyHeader(String apiKeyHeader) {
        this.apiKeyHeader = apiKeyHeader;
    }

    public String getAppKeyHeader() {
        return appKeyHeader;
    }

    public void setAppKeyHeader(String appKeyHeader) {
        this.appKeyHeader = appKeyHeader;
    }

    public String getSearchPath() {
        return searchPath;
    }

    public void setSearchPath(String searchPath) {
        this.searchPath = searchPath;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(int readTimeoutMs) {
        this.readTimeoutMs = readTimeoutMs;
    }

    public int getNarrowingSlackMs() {
        return narrowingSlackMs;
    }

    public void setNarrowingSlackMs(int narrowingSlackMs) {
        this.narrowingSlackMs = narrowingSlackMs;
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    public void setMaxPageSize(int maxPageSize) {
        this.maxPageSize = maxPageSize;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public static class Retry {
        private int maxRetries = 2;
        private long baseDelayMs = 3000;
        private long maxDelayMs = 15000;

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }
}
