package com.logpanel.logs.upstream;

public class LogsApiException extends RuntimeException {
    private final LogsErrorKind kind;
    private final int status;
    private final String responseBody;

    public LogsApiException(LogsErrorKind kind, String message) {
        this(kind, message, 0, null, null);
    }

    public LogsApiException(LogsErrorKind kind, String message, Throwable cause) {
        this(kind, message, 0, null, cause);
    }

    public LogsApiException(LogsErrorKind kind, String message, int status, String responseBody, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.status = status;
        this.responseBody = responseBody;
    }

    public LogsErrorKind getKind() {
        return kind;
    }

    public int getStatus() {
        return status;
    }

    public String getResponseBody() {
        return responseBody;
    }

    public boolean isRateLimited() {
        return kind == LogsErrorKind.RATE_LIMIT || kind == LogsErrorKind.RATE_LIMIT_EXCEEDED;
    }
}
