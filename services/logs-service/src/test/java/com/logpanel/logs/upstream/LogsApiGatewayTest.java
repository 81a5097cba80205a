package com.logpanel.logs.upstream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class LogsApiGatewayTest {

    private static final String SEARCH_URL = "http://logs.test/api/v2/logs/events/search";
    private static final Instant FROM = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant TO = Instant.parse("2024-01-01T01:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private LogsApiProperties properties;
    private MockRestServiceServer server;
    private RestTemplate restTemplate;
    private LogsApiGateway gateway;

    @BeforeEach
    void setUp() {
        properties = new LogsApiProperties();
        properties.setBaseUrl("http://logs.test/");
        properties.setApiKey("api-key");
        properties.setAppKey("app-key");
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        gateway = gatewayWith(new RestTemplateBuilder());
    }

    @Test
    void firstPageRequestCarriesFilterSortAndLimitWithoutCursor() {
        server.expect(requestTo(SEARCH_URL))
            .andExpect(method(POST))
            .andExpect(header("DD-API-KEY", "api-key"))
            .andExpect(header("DD-APPLICATION-KEY", "app-key"))
            .andExpect(jsonPath("$.filter.query").value("status:ERROR"))
            .andExpect(jsonPath("$.filter.from").value("2024-01-01T00:00:00Z"))
            .andExpect(jsonPath("$.filter.to").value("2024-01-01T01:00:00Z"))
            .andExpect(jsonPath("$.sort").value("timestamp"))
            .andExpect(jsonPath("$.page.limit").value(100))
            .andExpect(jsonPath("$.page.cursor").doesNotExist())
            .andRespond(withSuccess(
                "{\"data\":[{\"id\":\"a\",\"attributes\":{\"message\":\"boom\",\"status\":\"error\","
                    + "\"timestamp\":\"2024-01-01T00:10:00Z\"}}],\"meta\":{\"page\":{\"after\":\"c1\"}}}",
                MediaType.APPLICATION_JSON
            ));

        FetchedPage page = gateway.fetchPage("status:ERROR", FROM, TO, "", 100, budget());

        server.verify();
        assertThat(page.entries()).hasSize(1);
        assertThat(page.entries().get(0).getLevel()).isEqualTo("ERROR");
        assertThat(page.nextCursor()).isEqualTo("c1");
    }

    @Test
    void followUpRequestSendsCursorAndCapsLimit() {
        server.expect(requestTo(SEARCH_URL))
            .andExpect(jsonPath("$.page.cursor").value("c1"))
            .andExpect(jsonPath("$.page.limit").value(1000))
            .andRespond(withSuccess("{\"data\":[]}", MediaType.APPLICATION_JSON));

        FetchedPage page = gateway.fetchPage("*", FROM, TO, "c1", 5000, budget());

        server.verify();
        assertThat(page.entries()).isEmpty();
        assertThat(page.nextCursor()).isEmpty();
    }

    @Test
    void unauthorizedMapsToAuthentication() {
        server.expect(requestTo(SEARCH_URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertKind(LogsErrorKind.AUTHENTICATION, UpstreamErrorMessages.AUTHENTICATION_MESSAGE);
    }

    @Test
    void forbiddenMapsToPermission() {
        server.expect(requestTo(SEARCH_URL)).andRespond(withStatus(HttpStatus.FORBIDDEN));

        assertKind(LogsErrorKind.PERMISSION, UpstreamErrorMessages.PERMISSION_MESSAGE);
    }

    @Test
    void tooManyRequestsMapsToRateLimit() {
        server.expect(requestTo(SEARCH_URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertKind(LogsErrorKind.RATE_LIMIT, UpstreamErrorMessages.RATE_LIMIT_MESSAGE);
    }

    @Test
    void serverErrorCarriesStatusInMessage() {
        server.expect(requestTo(SEARCH_URL))
            .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE).body("down").contentType(MediaType.TEXT_PLAIN));

        LogsApiException error = fetchExpectingError();
        assertThat(error.getKind()).isEqualTo(LogsErrorKind.SERVER_ERROR);
        assertThat(error.getMessage()).contains("503");
        assertThat(error.getStatus()).isEqualTo(503);
        assertThat(error.getResponseBody()).isEqualTo("down");
    }

    @Test
    void badRequestExtractsUpstreamMessage() {
        server.expect(requestTo(SEARCH_URL))
            .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                .body("{\"errors\":[\"invalid log query: unexpected token\"]}")
                .contentType(MediaType.APPLICATION_JSON));

        LogsApiException error = fetchExpectingError();
        assertThat(error.getKind()).isEqualTo(LogsErrorKind.INVALID_QUERY);
        assertThat(error.getMessage()).startsWith("Invalid query: invalid log query: unexpected token");
    }

    @Test
    void undecodableBodyMapsToMalformedResponse() {
        server.expect(requestTo(SEARCH_URL)).andRespond(withSuccess("not json", MediaType.APPLICATION_JSON));

        assertKind(LogsErrorKind.MALFORMED_RESPONSE, UpstreamErrorMessages.MALFORMED_MESSAGE);
    }

    @Test
    void fullBudgetWithDefaultTimeoutsUsesConfiguredClient() {
        server.expect(requestTo(SEARCH_URL)).andRespond(withSuccess("{\"data\":[]}", MediaType.APPLICATION_JSON));

        FetchedPage page = gateway.fetchPage("*", FROM, TO, "", 10, FetchBudget.of(Duration.ofMillis(30000)));

        server.verify();
        assertThat(page.entries()).isEmpty();
        assertThat(gateway.restTemplateFor(29_500)).isSameAs(restTemplate);
    }

    @Test
    void shortBudgetBuildsNarrowedClientThroughBuilderCustomizers() {
        AtomicReference<MockRestServiceServer> narrowedServer = new AtomicReference<>();
        gateway = gatewayWith(new RestTemplateBuilder(template -> {
            MockRestServiceServer bound = MockRestServiceServer.bindTo(template).build();
            bound.expect(requestTo(SEARCH_URL))
                .andRespond(withSuccess("{\"data\":[],\"meta\":{\"page\":{\"after\":\"c2\"}}}", MediaType.APPLICATION_JSON));
            narrowedServer.set(bound);
        }));

        FetchedPage page = gateway.fetchPage("*", FROM, TO, "", 10, FetchBudget.of(Duration.ofSeconds(2)));

        assertThat(narrowedServer.get()).isNotNull();
        narrowedServer.get().verify();
        server.verify();
        assertThat(page.nextCursor()).isEqualTo("c2");
    }

    @Test
    void socketTimeoutMapsToTimeout() {
        server.expect(requestTo(SEARCH_URL)).andRespond(withException(new SocketTimeoutException("read timed out")));

        assertKind(LogsErrorKind.TIMEOUT, UpstreamErrorMessages.TIMEOUT_MESSAGE);
    }

    @Test
    void missingCredentialsFailWithoutCallingUpstream() {
        properties.setAppKey("");

        assertThatThrownBy(() -> gateway.fetchPage("*", FROM, TO, "", 10, budget()))
            .isInstanceOf(LogsApiException.class)
            .extracting(e -> ((LogsApiException) e).getKind())
            .isEqualTo(LogsErrorKind.AUTHENTICATION);
        server.verify();
    }

    @Test
    void cancelledBudgetFailsBeforeCall() {
        FetchBudget budget = budget();
        budget.cancel();

        assertThatThrownBy(() -> gateway.fetchPage("*", FROM, TO, "", 10, budget))
            .isInstanceOf(LogsApiException.class)
            .extracting(e -> ((LogsApiException) e).getKind())
            .isEqualTo(LogsErrorKind.CANCELLED);
    }

    private LogsApiGateway gatewayWith(RestTemplateBuilder builder) {
        return new LogsApiGateway(restTemplate, builder, objectMapper, properties, new LogsResponseParser(objectMapper));
    }

    private void assertKind(LogsErrorKind kind, String message) {
        LogsApiException error = fetchExpectingError();
        assertThat(error.getKind()).isEqualTo(kind);
        assertThat(error.getMessage()).isEqualTo(message);
    }

    private LogsApiException fetchExpectingError() {
        try {
            gateway.fetchPage("error", FROM, TO, "", 10, budget());
        } catch (LogsApiException e) {
            server.verify();
            return e;
        }
        throw new AssertionError("expected LogsApiException");
    }

    private static FetchBudget budget() {
        return FetchBudget.of(Duration.ofSeconds(30));
    }
}
