package com.logpanel.logs.upstream;

import io.micrometer.core.instrument.Metrics;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

@Primary
@Component
public class RateLimitedLogFetcher implements LogPageFetcher {
    private static final Logger logger = LoggerFactory.getLogger(RateLimitedLogFetcher.class);

    private final LogsApiGateway gateway;
    private final LogsApiProperties.Retry retry;

    public RateLimitedLogFetcher(LogsApiGateway gateway, LogsApiProperties properties) {
        this.gateway = gateway;
        this.retry = properties.getRetry();
    }

    @Override
    public FetchedPage fetchPage(
        String translatedQuery,
        Instant from,
        Instant to,
        String cursor,
        int pageSize,
        FetchBudget budget
    ) {
        RetryState state = RetryState.initial(
            retry.getMaxRetries(),
            Duration.ofMillis(retry.getBaseDelayMs()),
            Duration.ofMillis(retry.getMaxDelayMs())
        );
        while (true) {
            try {
                return gateway.fetchPage(translatedQuery, from, to, cursor, pageSize, budget);
            } catch (LogsApiException e) {
                if (e.getKind() != LogsErrorKind.RATE_LIMIT) {
                    throw e;
                }
                if (!state.canRetry()) {
                    Metrics.counter("logs_rate_limit_exhausted_total").increment();
                    logger.warn("logs_rate_limit_exhausted attempts={}", state.attempt() + 1);
                    throw new RateLimitExceededException(state.maxRetries() + 1, e);
                }
                Duration delay = state.nextDelay();
                Metrics.counter("logs_rate_limit_retries_total").increment();
                logger.info(
                    "logs_rate_limit_retry attempt={} max_retries={} delay_ms={}",
                    state.attempt() + 1,
                    state.maxRetries(),
                    delay.toMillis()
                );
                budget.await(delay);
                state = state.advance();
            }
        }
    }
}
