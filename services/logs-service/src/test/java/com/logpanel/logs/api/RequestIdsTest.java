package com.logpanel.logs.api;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class RequestIdsTest {

    private static final String TRACEPARENT = "00-4bf92f3577b34da6a3ce929d0e0e4736-00f067aa0ba902b7-01";

    @Test
    void explicitHeadersAreEchoed() {
        RequestIds ids = RequestIds.resolve(" trace-1 ", TRACEPARENT, "req-1");

        assertThat(ids.traceId()).isEqualTo("trace-1");
        assertThat(ids.requestId()).isEqualTo("req-1");
    }

    @Test
    void traceIdComesFromTraceparentWhenTraceHeaderMissing() {
        RequestIds ids = RequestIds.resolve(null, TRACEPARENT, null);

        assertThat(ids.traceId()).isEqualTo("4bf92f3577b34da6a3ce929d0e0e4736");
        assertThat(ids.requestId()).isNotBlank();
    }

    @Test
    void uppercaseTraceparentIsAccepted() {
        assertThat(RequestIds.traceIdFromTraceparent(TRACEPARENT.toUpperCase()))
            .isEqualTo("4bf92f3577b34da6a3ce929d0e0e4736");
    }

    @Test
    void malformedOrInvalidTraceparentIsIgnored() {
        assertThat(RequestIds.traceIdFromTraceparent("garbage")).isNull();
        assertThat(RequestIds.traceIdFromTraceparent("00-4bf92f35-00f067aa0ba902b7-01")).isNull();
        assertThat(RequestIds.traceIdFromTraceparent("00-00000000000000000000000000000000-00f067aa0ba902b7-01")).isNull();
        assertThat(RequestIds.traceIdFromTraceparent("ff-4bf92f3577b34da6a3ce929d0e0e4736-00f067aa0ba902b7-01")).isNull();
    }

    @Test
    void missingIdsAreGeneratedInTraceContextShape() {
        RequestIds ids = RequestIds.resolve("", "garbage", " ");

        assertThat(ids.traceId()).matches("[0-9a-f]{32}");
        assertThat(ids.requestId()).isNotBlank();
        assertThat(RequestIds.resolve(null, null, null).traceId()).isNotEqualTo(ids.traceId());
    }
}
