package com.logpanel.logs.api;

import java.util.Locale;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.http.ResponseEntity;

public record RequestIds(String traceId, String requestId) {
    public static final String TRACE_ID_HEADER = "x-trace-id";
    public static final String REQUEST_ID_HEADER = "x-request-id";
    public static final String TRACEPARENT_HEADER = "traceparent";

    private static final Pattern TRACEPARENT = Pattern.compile(
        "^([0-9a-f]{2})-([0-9a-f]{32})-([0-9a-f]{16})-([0-9a-f]{2})$"
    );
    private static final String ZERO_TRACE_ID = "0".repeat(32);

    // x-trace-id wins over traceparent; a missing trace id is generated in W3C form.
    public static RequestIds resolve(String traceIdHeader, String traceparentHeader, String requestIdHeader) {
        String traceId = hasText(traceIdHeader) ? traceIdHeader.trim() : traceIdFromTraceparent(traceparentHeader);
        if (traceId == null) {
            traceId = newTraceId();
        }
        String requestId = hasText(requestIdHeader) ? requestIdHeader.trim() : UUID.randomUUID().toString();
        return new RequestIds(traceId, requestId);
    }

    static String traceIdFromTraceparent(String traceparent) {
        if (!hasText(traceparent)) {
            return null;
        }
        Matcher matcher = TRACEPARENT.matcher(traceparent.trim().toLowerCase(Locale.ROOT));
        if (!matcher.matches() || "ff".equals(matcher.group(1)) || ZERO_TRACE_ID.equals(matcher.group(2))) {
            return null;
        }
        return matcher.group(2);
    }

    static String newTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public ResponseEntity.BodyBuilder applyTo(ResponseEntity.BodyBuilder builder) {
        return builder.header(TRACE_ID_HEADER, traceId).header(REQUEST_ID_HEADER, requestId);
    }

    private static boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }
}
