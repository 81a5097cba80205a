package com.logpanel.logs.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.logpanel.logs.upstream.LogsApiException;
import com.logpanel.logs.upstream.RateLimitExceededException;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private ErrorDetail error;

    @JsonProperty("trace_id")
    private String traceId;

    @JsonProperty("request_id")
    private String requestId;

    public ErrorResponse() {
    }

    public ErrorResponse(ErrorDetail error, String traceId, String requestId) {
        this.error = error;
        this.traceId = traceId;
        this.requestId = requestId;
    }

    public static ErrorResponse local(String code, String message, String traceId, String requestId) {
        return new ErrorResponse(new ErrorDetail(code, message), traceId, requestId);
    }

    public static ErrorResponse upstream(LogsApiException e, String traceId, String requestId) {
        ErrorDetail detail = new ErrorDetail(e.getKind().getCode(), e.getMessage());
        detail.setRetryable(e.getKind().isRetryable());
        if (e.getStatus() > 0) {
            detail.setUpstreamStatus(e.getStatus());
        }
        if (e instanceof RateLimitExceededException) {
            detail.setAttempts(((RateLimitExceededException) e).getAttempts());
        }
        return new ErrorResponse(detail, traceId, requestId);
    }

    public ErrorDetail getError() {
        return error;
    }

    public void setError(ErrorDetail error) {
        this.error = error;
    }

    public String getTraceId() {
        return traceId;
    }

    public void setTraceId(String traceId) {
        this.traceId = traceId;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorDetail {
        private String code;
        private String message;
        // Unset for failures raised before any upstream call.
        private Boolean retryable;

        @JsonProperty("upstream_status")
        private Integer upstreamStatus;

        private Integer attempts;

        public ErrorDetail() {
        }

        public ErrorDetail(String code, String message) {
            this.code = code;
            this.message = message;
        }

        public String getCode() {
            return code;
        }

        public void setCode(String code) {
            this.code = code;
        }

        public String getMessage() {
            return message;
        }

        public void setMessage(String message) {
            this.message = message;
        }

        public Boolean getRetryable() {
            return retryable;
        }

        public void setRetryable(Boolean retryable) {
            this.retryable = retryable;
        }

        public Integer getUpstreamStatus() {
            return upstreamStatus;
        }

        public void setUpstreamStatus(Integer upstreamStatus) {
            this.upstreamStatus = upstreamStatus;
        }

        public Integer getAttempts() {
            return attempts;
        }

        public void setAttempts(Integer attempts) {
            this.attempts = attempts;
        }
    }
}
