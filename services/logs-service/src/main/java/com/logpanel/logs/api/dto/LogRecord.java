package com.logpanel.logs.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.logpanel.logs.model.LogEntry;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class LogRecord {
    private String id;
    private String timestamp;
    private String message;
    private String level;
    private String service;
    private String source;
    private String host;
    private String env;
    private String version;
    private Map<String, String> tags;
    private Map<String, Object> attributes;

    public static LogRecord from(LogEntry entry) {
        LogRecord result = new LogRecord();
        result.id = entry.getId();
        result.timestamp = entry.getTimestamp() == null ? null : entry.getTimestamp().toString();
        result.message = entry.getMessage();
        result.level = entry.getLevel();
        result.service = entry.getService();
        result.source = entry.getSource();
        result.host = entry.getHost();
        result.env = entry.getEnv();
        result.version = entry.getVersion();
        result.tags = entry.getTags();
        result.attributes = entry.getAttributes();
        return result;
    }

    public String getId() {
        return id;
    }

    public String getTimestamp() {
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
}
