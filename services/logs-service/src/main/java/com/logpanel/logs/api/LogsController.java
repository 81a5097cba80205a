package com.logpanel.logs.api;

import com.logpanel.logs.api.dto.ErrorResponse;
import com.logpanel.logs.api.dto.LogRecord;
import com.logpanel.logs.api.dto.LogsBulkResponse;
import com.logpanel.logs.api.dto.LogsQueryRequest;
import com.logpanel.logs.api.dto.LogsQueryResponse;
import com.logpanel.logs.model.BulkLogResult;
import com.logpanel.logs.model.LogEntry;
import com.logpanel.logs.model.LogPage;
import com.logpanel.logs.model.LogQueryRequest;
import com.logpanel.logs.service.InvalidLogQueryException;
import com.logpanel.logs.service.LogRetrievalService;
import com.logpanel.logs.upstream.LogsApiException;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class LogsController {
    private static final Logger logger = LoggerFactory.getLogger(LogsController.class);

    private final LogRetrievalService retrievalService;

    public LogsController(LogRetrievalService retrievalService) {
        this.retrievalService = retrievalService;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @PostMapping("/logs/query")
    public ResponseEntity<?> query(
        @RequestBody(required = false) LogsQueryRequest request,
        @RequestHeader(value = RequestIds.TRACE_ID_HEADER, required = false) String traceIdHeader,
        @RequestHeader(value = RequestIds.TRACEPARENT_HEADER, required = false) String traceparent,
        @RequestHeader(value = RequestIds.REQUEST_ID_HEADER, required = false) String requestIdHeader
    ) {
        RequestIds ids = RequestIds.resolve(traceIdHeader, traceparent, requestIdHeader);
        long started = System.nanoTime();

        try {
            LogPage page = retrievalService.retrieve(toDomain(request));

            LogsQueryResponse.Pagination pagination = new LogsQueryResponse.Pagination();
            pagination.setCurrentPage(resolveCurrentPage(request.getCurrentPage()));
            pagination.setPageSize(page.getPageSize());
            pagination.setHasNextPage(page.hasNextPage());
            pagination.setNextCursor(page.getNextCursor());
            pagination.setTotalEntries(page.getEntries().size());

            LogsQueryResponse response = new LogsQueryResponse();
            response.setEntries(toRecords(page.getEntries()));
            response.setPagination(pagination);
            response.setTranslatedQuery(page.getTranslatedQuery());
            response.setCacheHit(page.isCacheHit());
            response.setTookMs(elapsedMs(started));
            response.setTraceId(ids.traceId());
            response.setRequestId(ids.requestId());
            return ids.applyTo(ResponseEntity.ok()).body(response);
        } catch (InvalidLogQueryException e) {
            return error(HttpStatus.BAD_REQUEST, "bad_request", e.getMessage(), ids);
        } catch (LogsApiException e) {
            return upstreamError(e, ids);
        } catch (Exception e) {
            logger.error("logs_query_failed request_id={}", ids.requestId(), e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Unexpected error", ids);
        }
    }

    @PostMapping("/logs/query/bulk")
    public ResponseEntity<?> queryBulk(
        @RequestBody(required = false) LogsQueryRequest request,
        @RequestHeader(value = RequestIds.TRACE_ID_HEADER, required = false) String traceIdHeader,
        @RequestHeader(value = RequestIds.TRACEPARENT_HEADER, required = false) String traceparent,
        @RequestHeader(value = RequestIds.REQUEST_ID_HEADER, required = false) String requestIdHeader
    ) {
        RequestIds ids = RequestIds.resolve(traceIdHeader, traceparent, requestIdHeader);
        long started = System.nanoTime();

        try {
            BulkLogResult result = retrievalService.retrieveAll(toDomain(request));

            LogsBulkResponse response = new LogsBulkResponse();
            response.setEntries(toRecords(result.getEntries()));
            response.setTotalEntries(result.getEntries().size());
            response.setPagesFetched(result.getPagesFetched());
            response.setLastCursor(result.getLastCursor());
            response.setRateLimited(result.isRateLimited());
            response.setTruncated(result.isTruncated());
            response.setTookMs(elapsedMs(started));
            response.setTraceId(ids.traceId());
            response.setRequestId(ids.requestId());
            return ids.applyTo(ResponseEntity.ok()).body(response);
        } catch (InvalidLogQueryException e) {
            return error(HttpStatus.BAD_REQUEST, "bad_request", e.getMessage(), ids);
        } catch (LogsApiException e) {
            return upstreamError(e, ids);
        } catch (Exception e) {
            logger.error("logs_bulk_query_failed request_id={}", ids.requestId(), e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Unexpected error", ids);
        }
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleInvalidJson(HttpMessageNotReadableException e, HttpServletRequest request) {
        RequestIds ids = RequestIds.resolve(
            request.getHeader(RequestIds.TRACE_ID_HEADER),
            request.getHeader(RequestIds.TRACEPARENT_HEADER),
            request.getHeader(RequestIds.REQUEST_ID_HEADER)
        );
        return error(HttpStatus.BAD_REQUEST, "bad_request", "invalid JSON", ids);
    }

    static HttpStatus statusFor(LogsApiException e) {
        return switch (e.getKind()) {
            case INVALID_QUERY -> HttpStatus.BAD_REQUEST;
            case AUTHENTICATION -> HttpStatus.UNAUTHORIZED;
            case PERMISSION -> HttpStatus.FORBIDDEN;
            case RATE_LIMIT, RATE_LIMIT_EXCEEDED -> HttpStatus.TOO_MANY_REQUESTS;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case CANCELLED -> HttpStatus.SERVICE_UNAVAILABLE;
            case SERVER_ERROR, MALFORMED_RESPONSE, OTHER -> HttpStatus.BAD_GATEWAY;
        };
    }

    private ResponseEntity<ErrorResponse> upstreamError(LogsApiException e, RequestIds ids) {
        HttpStatus status = statusFor(e);
        logger.warn(
            "logs_upstream_failed kind={} upstream_status={} status={} request_id={}",
            e.getKind(),
            e.getStatus(),
            status.value(),
            ids.requestId()
        );
        return ids.applyTo(ResponseEntity.status(status))
            .body(ErrorResponse.upstream(e, ids.traceId(), ids.requestId()));
    }

    private static LogQueryRequest toDomain(LogsQueryRequest request) {
        if (request == null) {
            throw new InvalidLogQueryException("request body is required");
        }
        Instant from = TimeBounds.parse("from", request.getFrom());
        Instant to = TimeBounds.parse("to", request.getTo());
        return new LogQueryRequest(request.getQuery(), from, to, request.getCursor(), request.getPageSize());
    }

    private static List<LogRecord> toRecords(List<LogEntry> entries) {
        return entries.stream().map(LogRecord::from).collect(Collectors.toList());
    }

    private static int resolveCurrentPage(Integer currentPage) {
        return currentPage == null || currentPage < 1 ? 1 : currentPage;
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000L;
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message, RequestIds ids) {
        return ids.applyTo(ResponseEntity.status(status))
            .body(ErrorResponse.local(code, message, ids.traceId(), ids.requestId()));
    }
}
