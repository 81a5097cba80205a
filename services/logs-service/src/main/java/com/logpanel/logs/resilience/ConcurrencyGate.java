package com.logpanel.logs.resilience;

import com.logpanel.logs.upstream.FetchBudget;
import com.logpanel.logs.upstream.LogsApiException;
import com.logpanel.logs.upstream.LogsErrorKind;
import com.logpanel.logs.upstream.UpstreamErrorMessages;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

// One permit covers a fetch and all of its retries.
@Component
public class ConcurrencyGate {
    private static final Logger logger = LoggerFactory.getLogger(ConcurrencyGate.class);

    private final Semaphore permits;
    private final int capacity;
    private final long pollMs;

    @Autowired
    public ConcurrencyGate(LogsResilienceProperties properties) {
        this(properties.getMaxConcurrentRequests(), properties.getPermitPollMs());
    }

    ConcurrencyGate(int capacity, long pollMs) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        this.capacity = capacity;
        this.pollMs = Math.max(1L, pollMs);
        this.permits = new Semaphore(capacity, true);
    }

    /**
     * Blocks until a permit is free. Fails with {@code TIMEOUT} when the budget runs out and
     * with {@code CANCELLED} when the budget is cancelled or the thread is interrupted.
     */
    public void acquire(FetchBudget budget) {
        if (permits.tryAcquire()) {
            return;
        }
        logger.debug("logs_gate_waiting available={} capacity={}", permits.availablePermits(), capacity);
        while (true) {
            budget.checkActive();
            long slice = Math.min(pollMs, Math.max(1L, budget.remainingMillis()));
            try {
                if (permits.tryAcquire(slice, TimeUnit.MILLISECONDS)) {
                    return;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LogsApiException(LogsErrorKind.CANCELLED, "Log query cancelled", e);
            }
            if (budget.isExpired()) {
                throw new LogsApiException(LogsErrorKind.TIMEOUT, UpstreamErrorMessages.TIMEOUT_MESSAGE);
            }
        }
    }

    public void release() {
        permits.release();
    }

    public int availablePermits() {
        return permits.availablePermits();
    }

    public int capacity() {
        return capacity;
    }
}
