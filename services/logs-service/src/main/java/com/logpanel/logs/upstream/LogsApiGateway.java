package com.logpanel.logs.upstream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Metrics;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

// One search call per fetch; retries live in RateLimitedLogFetcher.
@Component
public class LogsApiGateway implements LogPageFetcher {
    private static final Logger logger = LoggerFactory.getLogger(LogsApiGateway.class);
    private static final DateTimeFormatter UTC_TIMESTAMP = DateTimeFormatter.ISO_INSTANT.withZone(ZoneOffset.UTC);

    private final RestTemplate restTemplate;
    private final RestTemplateBuilder restTemplateBuilder;
    private final ObjectMapper objectMapper;
    private final LogsApiProperties properties;
    private final LogsResponseParser parser;

    public LogsApiGateway(
        @Qualifier("logsApiRestTemplate") RestTemplate restTemplate,
        RestTemplateBuilder restTemplateBuilder,
        ObjectMapper objectMapper,
        LogsApiProperties properties,
        LogsResponseParser parser
    ) {
        this.restTemplate = restTemplate;
        this.restTemplateBuilder = restTemplateBuilder;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.parser = parser;
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
        if (!properties.hasCredentials()) {
            throw new LogsApiException(LogsErrorKind.AUTHENTICATION, UpstreamErrorMessages.MISSING_CREDENTIALS_MESSAGE);
        }
        budget.checkActive();

        String url = buildUrl(properties.getSearchPath());
        String payload;
        try {
            payload = objectMapper.writeValueAsString(buildBody(translatedQuery, from, to, cursor, pageSize));
        } catch (JsonProcessingException e) {
            throw new LogsApiException(LogsErrorKind.OTHER, "Failed to encode logs search request", e);
        }

        long started = System.nanoTime();
        try {
            RestTemplate client = restTemplateFor(budget.remainingMillis());
            ResponseEntity<String> response = client.exchange(url, HttpMethod.POST, new HttpEntity<>(payload, headers()), String.class);
            FetchedPage page = parser.parse(response.getBody());
            logger.info(
                "logs_page_fetched entries={} has_next={} took_ms={}",
                page.entries().size(),
                !page.nextCursor().isEmpty(),
                (System.nanoTime() - started) / 1_000_000L
            );
            return page;
        } catch (ResourceAccessException e) {
            throw classifyIoFailure(e, budget);
        } catch (HttpStatusCodeException e) {
            throw classifyStatus(e.getStatusCode().value(), e.getResponseBodyAsString(), e);
        }
    }

    Map<String, Object> buildBody(String translatedQuery, Instant from, Instant to, String cursor, int pageSize) {
        Map<String, Object> filter = new LinkedHashMap<>();
        filter.put("query", translatedQuery);
        filter.put("from", UTC_TIMESTAMP.format(from));
        filter.put("to", UTC_TIMESTAMP.format(to));

        Map<String, Object> page = new LinkedHashMap<>();
        page.put("limit", Math.max(1, Math.min(pageSize, properties.getMaxPageSize())));
        if (cursor != null && !cursor.isEmpty()) {
            page.put("cursor", cursor);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("filter", filter);
        body.put("sort", "timestamp");
        body.put("page", page);
        return body;
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(properties.getApiKeyHeader(), properties.getApiKey());
        headers.set(properties.getAppKeyHeader(), properties.getAppKey());
        return headers;
    }

    private LogsApiException classifyStatus(int status, String body, HttpStatusCodeException cause) {
        logger.warn("logs_api_error status={} body={}", status, abbreviate(body));
        Metrics.counter("logs_upstream_errors_total", "status", String.valueOf(status)).increment();
        if (status == 401) {
            return new LogsApiException(LogsErrorKind.AUTHENTICATION, UpstreamErrorMessages.AUTHENTICATION_MESSAGE, status, body, cause);
        }
        if (status == 403) {
            return new LogsApiException(LogsErrorKind.PERMISSION, UpstreamErrorMessages.PERMISSION_MESSAGE, status, body, cause);
        }
        if (status == 429) {
            return new LogsApiException(LogsErrorKind.RATE_LIMIT, UpstreamErrorMessages.RATE_LIMIT_MESSAGE, status, body, cause);
        }
        if (status == 400) {
            String message = UpstreamErrorMessages.invalidQuery(body, objectMapper);
            return new LogsApiException(LogsErrorKind.INVALID_QUERY, message, status, body, cause);
        }
        if (status == 408 || status == 504) {
            return new LogsApiException(LogsErrorKind.TIMEOUT, UpstreamErrorMessages.TIMEOUT_MESSAGE, status, body, cause);
        }
        if (status >= 500) {
            return new LogsApiException(LogsErrorKind.SERVER_ERROR, UpstreamErrorMessages.serverError(status), status, body, cause);
        }
        return new LogsApiException(LogsErrorKind.OTHER, UpstreamErrorMessages.unexpectedStatus(status), status, body, cause);
    }

    private LogsApiException classifyIoFailure(ResourceAccessException e, FetchBudget budget) {
        if (budget.isCancelled()) {
            return new LogsApiException(LogsErrorKind.CANCELLED, "Log query cancelled", e);
        }
        if (e.getCause() instanceof SocketTimeoutException || budget.isExpired()) {
            logger.warn("logs_api_timeout message={}", e.getMessage());
            return new LogsApiException(LogsErrorKind.TIMEOUT, UpstreamErrorMessages.TIMEOUT_MESSAGE, e);
        }
        logger.warn("logs_api_unreachable message={}", e.getMessage());
        return new LogsApiException(LogsErrorKind.OTHER, "Logs API unreachable: " + e.getMessage(), e);
    }

    private String buildUrl(String path) {
        String base = properties.resolveBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    // The configured client serves any call whose budget covers the read timeout within the slack.
    RestTemplate restTemplateFor(long remainingMs) {
        int readTimeoutMs = properties.getReadTimeoutMs();
        if (remainingMs <= 0 || remainingMs + properties.getNarrowingSlackMs() >= readTimeoutMs) {
            return restTemplate;
        }
        long timeoutMs = Math.max(1L, remainingMs);
        return restTemplateBuilder
            .setConnectTimeout(Duration.ofMillis(Math.min(timeoutMs, properties.getConnectTimeoutMs())))
            .setReadTimeout(Duration.ofMillis(timeoutMs))
            .build();
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 500 ? body.substring(0, 500) + "..." : body;
    }
}
