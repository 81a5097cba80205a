package com.logpanel.logs.upstream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RateLimitedLogFetcherTest {

    private static final Instant FROM = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant TO = Instant.parse("2024-01-01T01:00:00Z");

    @Mock
    private LogsApiGateway gateway;

    private LogsApiProperties properties;
    private RateLimitedLogFetcher fetcher;

    @BeforeEach
    void setUp() {
        properties = new LogsApiProperties();
        properties.getRetry().setBaseDelayMs(1);
        properties.getRetry().setMaxDelayMs(5);
        fetcher = new RateLimitedLogFetcher(gateway, properties);
    }

    @Test
    void retriesRateLimitThenSucceeds() {
        FetchedPage page = new FetchedPage(List.of(), "c1");
        when(gateway.fetchPage(anyString(), any(), any(), anyString(), anyInt(), any()))
            .thenThrow(rateLimited())
            .thenReturn(page);

        FetchedPage result = fetcher.fetchPage("*", FROM, TO, "", 100, budget());

        assertThat(result).isSameAs(page);
        verify(gateway, times(2)).fetchPage(anyString(), any(), any(), anyString(), anyInt(), any());
    }

    @Test
    void persistentRateLimitStopsAfterOnePlusMaxRetriesCalls() {
        when(gateway.fetchPage(anyString(), any(), any(), anyString(), anyInt(), any()))
            .thenThrow(rateLimited());

        assertThatThrownBy(() -> fetcher.fetchPage("*", FROM, TO, "", 100, budget()))
            .isInstanceOf(RateLimitExceededException.class)
            .hasMessageContaining("3 attempts")
            .satisfies(e -> {
                RateLimitExceededException exceeded = (RateLimitExceededException) e;
                assertThat(exceeded.getKind()).isEqualTo(LogsErrorKind.RATE_LIMIT_EXCEEDED);
                assertThat(exceeded.getAttempts()).isEqualTo(3);
            });
        verify(gateway, times(3)).fetchPage(anyString(), any(), any(), anyString(), anyInt(), any());
    }

    @Test
    void otherErrorsAreNotRetried() {
        when(gateway.fetchPage(anyString(), any(), any(), anyString(), anyInt(), any()))
            .thenThrow(new LogsApiException(LogsErrorKind.AUTHENTICATION, UpstreamErrorMessages.AUTHENTICATION_MESSAGE));

        assertThatThrownBy(() -> fetcher.fetchPage("*", FROM, TO, "", 100, budget()))
            .isInstanceOf(LogsApiException.class)
            .isNotInstanceOf(RateLimitExceededException.class)
            .extracting(e -> ((LogsApiException) e).getKind())
            .isEqualTo(LogsErrorKind.AUTHENTICATION);
        verify(gateway, times(1)).fetchPage(anyString(), any(), any(), anyString(), anyInt(), any());
    }

    @Test
    void cancelledBudgetAbortsBackoff() {
        properties.getRetry().setBaseDelayMs(10_000);
        properties.getRetry().setMaxDelayMs(10_000);
        when(gateway.fetchPage(anyString(), any(), any(), anyString(), anyInt(), any()))
            .thenThrow(rateLimited());
        FetchBudget budget = budget();
        budget.cancel();

        assertThatThrownBy(() -> fetcher.fetchPage("*", FROM, TO, "", 100, budget))
            .isInstanceOf(LogsApiException.class)
            .extracting(e -> ((LogsApiException) e).getKind())
            .isEqualTo(LogsErrorKind.CANCELLED);
        verify(gateway, times(1)).fetchPage(anyString(), any(), any(), anyString(), anyInt(), any());
    }

    private static LogsApiException rateLimited() {
        return new LogsApiException(LogsErrorKind.RATE_LIMIT, UpstreamErrorMessages.RATE_LIMIT_MESSAGE, 429, "", null);
    }

    private static FetchBudget budget() {
        return FetchBudget.of(Duration.ofSeconds(10));
    }
}
