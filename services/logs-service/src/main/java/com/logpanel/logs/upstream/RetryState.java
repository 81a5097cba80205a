package com.logpanel.logs.upstream;

import java.time.Duration;

// Delay before retry n is base * 2^(n-1), capped at maxDelay.
public final class RetryState {
    private final int attempt;
    private final int maxRetries;
    private final Duration baseDelay;
    private final Duration maxDelay;

    private RetryState(int attempt, int maxRetries, Duration baseDelay, Duration maxDelay) {
        this.attempt = attempt;
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
    }

    public static RetryState initial(int maxRetries, Duration baseDelay, Duration maxDelay) {
        return new RetryState(0, Math.max(0, maxRetries), baseDelay, maxDelay);
    }

    public int attempt() {
        return attempt;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public boolean canRetry() {
        return attempt < maxRetries;
    }

    public Duration nextDelay() {
        int shift = Math.min(attempt, 30);
        long delayMs = baseDelay.toMillis() << shift;
        if (delayMs < 0 || delayMs > maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis(delayMs);
    }

    public RetryState advance() {
        return new RetryState(attempt + 1, maxRetries, baseDelay, maxDelay);
    }
}
