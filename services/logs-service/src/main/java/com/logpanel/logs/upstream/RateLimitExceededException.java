package com.logpanel.logs.upstream;

public class RateLimitExceededException extends LogsApiException {
    private final int attempts;

    public RateLimitExceededException(int attempts, LogsApiException lastError) {
        super(
            LogsErrorKind.RATE_LIMIT_EXCEEDED,
            "Rate limit exceeded after " + attempts + " attempts - reduce refresh frequency or narrow the time range",
            lastError == null ? 429 : lastError.getStatus(),
            lastError == null ? null : lastError.getResponseBody(),
            lastError
        );
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
