package com.logpanel.logs.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public final class LogEntry {
    private final String id;
    private final Instant timestamp;
    private final String message;
    private final String level;
    private final String service;
    private final String source;
    private final String host;
    private final String env;
    private final String version;
    private final Map<String, String> tags;
    private final Map<String, Object> attributes;

    private LogEntry(Builder builder) {
        this.id = builder.id;
        this.timestamp = builder.timestamp;
        this.message = builder.message;
        this.level = builder.level;
        this.service = builder.service;
        this.source = builder.source;
        this.host = builder.host;
        this.env = builder.env;
        this.version = builder.version;
        this.tags = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tags));
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() {
        return id;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getMessage() {
        return message;
    }

    public String getLevel() {
        return level;
    }

    public String getService() {
        return service;
    }

    public String getSource() {
        return source;
    }

    public String getHost() {
        return host;
    }

    public String getEnv() {
        return env;
    }

    public String getVersion() {
        return version;
    }

    public Map<String, String> getTags() {
        return tags;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public LogEntry sanitized() {
        return toBuilder()
            .timestamp(timestamp == null ? Instant.now() : timestamp)
            .message(trim(message))
            .level(level == null ? null : level.trim().toUpperCase(Locale.ROOT))
            .service(trim(service))
            .source(trim(source))
            .host(trim(host))
            .env(trim(env))
            .version(trim(version))
            .build();
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .timestamp(timestamp)
            .message(message)
            .level(level)
            .service(service)
            .source(source)
            .host(host)
            .env(env)
            .version(version)
            .tags(tags)
            .attributes(attributes);
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }

    public static class Builder {
        private String id;
        private Instant timestamp;
        private String message;
        private String level;
        private String service;
        private String source;
        private String host;
        private String env;
        private String version;
        private Map<String, String> tags = new LinkedHashMap<>();
        private Map<String, Object> attributes = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder level(String level) {
            this.level = level;
            return this;
        }

        public Builder service(String service) {
            this.service = service;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder env(String env) {
            this.env = env;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder tags(Map<String, String> tags) {
            this.tags = tags == null ? new LinkedHashMap<>() : new LinkedHashMap<>(tags);
            return this;
        }

        public Builder attributes(Map<String, Object> attributes) {
            this.attributes = attributes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(attributes);
            return this;
        }

        public LogEntry build() {
            return new LogEntry(this);
        }
    }
}
