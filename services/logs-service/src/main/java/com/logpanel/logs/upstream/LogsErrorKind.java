package com.logpanel.logs.upstream;

public enum LogsErrorKind {
    AUTHENTICATION("authentication_failed", false),
    PERMISSION("permission_denied", false),
    INVALID_QUERY("invalid_query", false),
    RATE_LIMIT("rate_limited", true),
    RATE_LIMIT_EXCEEDED("rate_limit_exceeded", true),
    TIMEOUT("timeout", true),
    CANCELLED("cancelled", false),
    SERVER_ERROR("upstream_server_error", true),
    MALFORMED_RESPONSE("malformed_response", false),
    OTHER("upstream_error", false);

    private final String code;
    // Whether the same request may succeed if the caller tries again later.
    private final boolean retryable;

    LogsErrorKind(String code, boolean retryable) {
        this.code = code;
        this.retryable = retryable;
    }

    public String getCode() {
        return code;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
