package com.logpanel.logs.upstream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class UpstreamErrorMessages {
    public static final String AUTHENTICATION_MESSAGE =
        "Invalid API credentials - check your API key and App key";
    public static final String PERMISSION_MESSAGE =
        "API key missing required permissions - need 'logs_read_data' scope";
    public static final String RATE_LIMIT_MESSAGE = "Rate limit exceeded - too many requests";
    public static final String TIMEOUT_MESSAGE =
        "Log query timeout - try narrowing your search criteria or time range";
    public static final String MALFORMED_MESSAGE = "Failed to parse logs API response";
    public static final String MISSING_CREDENTIALS_MESSAGE =
        "Missing API credentials - configure logs.api.api-key and logs.api.app-key";
    public static final String INVALID_QUERY_FALLBACK = "Invalid query syntax";

    private static final int MAX_RAW_BODY = 200;

    private UpstreamErrorMessages() {
    }

    public static String serverError(int status) {
        return "API error (" + status + ") - service may be unavailable";
    }

    public static String unexpectedStatus(int status) {
        return "Unexpected logs API response (" + status + ")";
    }

    public static String invalidQuery(String responseBody, ObjectMapper objectMapper) {
        if (responseBody == null || responseBody.isBlank()) {
            return INVALID_QUERY_FALLBACK;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            root = null;
        }
        if (root == null || !root.isObject()) {
            String raw = responseBody.length() > MAX_RAW_BODY
                ? responseBody.substring(0, MAX_RAW_BODY) + "..."
                : responseBody;
            return "Invalid query: " + raw;
        }

        List<String> messages = extractMessages(root);
        if (messages.isEmpty()) {
            return INVALID_QUERY_FALLBACK;
        }
        String errorText = String.join("; ", messages);
        String suggestion = suggestFix(errorText);
        if (suggestion == null) {
            return "Invalid query: " + errorText;
        }
        return "Invalid query: " + errorText + "\n" + suggestion;
    }

    static List<String> extractMessages(JsonNode root) {
        List<String> messages = new ArrayList<>();
        JsonNode errors = root.path("errors");
        if (errors.isArray()) {
            for (JsonNode item : errors) {
                if (item.isTextual()) {
                    messages.add(item.asText());
                } else if (item.path("message").isTextual()) {
                    messages.add(item.path("message").asText());
                } else if (item.path("detail").isTextual()) {
                    messages.add(item.path("detail").asText());
                }
            }
        } else if (errors.isTextual()) {
            messages.add(errors.asText());
        }

        if (messages.isEmpty()) {
            JsonNode error = root.path("error");
            if (error.isTextual()) {
                messages.add(error.asText());
            } else if (error.path("message").isTextual()) {
                messages.add(error.path("message").asText());
            }
        }
        if (messages.isEmpty() && root.path("message").isTextual()) {
            messages.add(root.path("message").asText());
        }
        return messages;
    }

    static String suggestFix(String errorText) {
        String lower = errorText.toLowerCase(Locale.ROOT);
        if (lower.contains("log")) {
            if (lower.contains("service") || lower.contains("facet")) {
                return "Suggestion: Use facet syntax 'service:api-gateway' or 'source:nginx'. "
                    + "Multiple facets: 'service:web-app source:nginx'";
            }
            if (lower.contains("status") || lower.contains("level")) {
                return "Suggestion: Use log level syntax 'status:ERROR' or 'status:(ERROR OR WARN)'. "
                    + "Valid levels: DEBUG, INFO, WARN, ERROR, FATAL";
            }
            if (lower.contains("operator") || lower.contains("boolean")) {
                return "Suggestion: Use boolean operators 'AND', 'OR', 'NOT'. "
                    + "Example: 'service:web-app AND status:ERROR'";
            }
            if (lower.contains("wildcard") || lower.contains("pattern")) {
                return "Suggestion: Use wildcard patterns like 'error*' or '*exception*' for text matching";
            }
            return "Suggestion: Examples: 'service:web-app status:ERROR', 'error AND service:api', 'source:nginx'";
        }
        if (lower.contains("tag") || lower.contains("filter") || lower.contains("syntax")) {
            return "Suggestion: Use tag syntax 'tag_key:tag_value' (e.g., 'host:web-01')";
        }
        return null;
    }
}
