package com.logpanel.logs.upstream;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public final class FetchBudget {
    private final long deadlineNanos;
    private final CountDownLatch cancelSignal;

    private FetchBudget(long deadlineNanos, CountDownLatch cancelSignal) {
        this.deadlineNanos = deadlineNanos;
        this.cancelSignal = cancelSignal;
    }

    public static FetchBudget of(Duration timeout) {
        return new FetchBudget(System.nanoTime() + Math.max(0L, timeout.toNanos()), new CountDownLatch(1));
    }

    public FetchBudget narrowTo(Duration timeout) {
        long candidate = System.nanoTime() + Math.max(0L, timeout.toNanos());
        long deadline = candidate - deadlineNanos < 0 ? candidate : deadlineNanos;
        return new FetchBudget(deadline, cancelSignal);
    }

    public void cancel() {
        cancelSignal.countDown();
    }

    public boolean isCancelled() {
        return cancelSignal.getCount() == 0;
    }

    public boolean isExpired() {
        return remainingNanos() <= 0;
    }

    public long remainingMillis() {
        return Math.max(0L, TimeUnit.NANOSECONDS.toMillis(remainingNanos()));
    }

    public void checkActive() {
        if (isCancelled() || Thread.currentThread().isInterrupted()) {
            throw cancelled();
        }
        if (isExpired()) {
            throw expired();
        }
    }

    /**
     * Waits for {@code delay}, returning early with an exception if the budget is cancelled,
     * interrupted or runs out first.
     */
    public void await(Duration delay) {
        checkActive();
        long delayNanos = Math.max(0L, delay.toNanos());
        long waitNanos = Math.min(delayNanos, remainingNanos());
        try {
            if (cancelSignal.await(waitNanos, TimeUnit.NANOSECONDS)) {
                throw cancelled();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw cancelled();
        }
        if (waitNanos < delayNanos) {
            throw expired();
        }
    }

    LogsApiException cancelled() {
        return new LogsApiException(LogsErrorKind.CANCELLED, "Log query cancelled");
    }

    LogsApiException expired() {
        return new LogsApiException(LogsErrorKind.TIMEOUT, UpstreamErrorMessages.TIMEOUT_MESSAGE);
    }

    private long remainingNanos() {
        return deadlineNanos - System.nanoTime();
    }
}
