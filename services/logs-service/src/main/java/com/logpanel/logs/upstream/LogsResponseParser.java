package com.logpanel.logs.upstream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logpanel.logs.model.LogEntry;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LogsResponseParser {
    private static final Logger logger = LoggerFactory.getLogger(LogsResponseParser.class);

    private static final Set<String> KNOWN_FIELDS = Set.of(
        "message", "status", "service", "source", "host", "tags", "timestamp", "attributes"
    );
    private static final DateTimeFormatter SPACED_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final long EPOCH_MILLIS_THRESHOLD = 1_000_000_000_000L;

    private final ObjectMapper objectMapper;

    public LogsResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public FetchedPage parse(String body) {
        if (body == null || body.isBlank()) {
            throw new LogsApiException(LogsErrorKind.MALFORMED_RESPONSE, UpstreamErrorMessages.MALFORMED_MESSAGE);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new LogsApiException(LogsErrorKind.MALFORMED_RESPONSE, UpstreamErrorMessages.MALFORMED_MESSAGE, e);
        }
        if (root == null || !root.isObject()) {
            throw new LogsApiException(LogsErrorKind.MALFORMED_RESPONSE, UpstreamErrorMessages.MALFORMED_MESSAGE);
        }
        JsonNode data = root.path("data");
        if (!data.isMissingNode() && !data.isNull() && !data.isArray()) {
            throw new LogsApiException(LogsErrorKind.MALFORMED_RESPONSE, UpstreamErrorMessages.MALFORMED_MESSAGE);
        }

        List<LogEntry> entries = new ArrayList<>();
        int skipped = 0;
        for (JsonNode item : data) {
            JsonNode attributes = item.path("attributes");
            if (!attributes.isObject()) {
                skipped++;
                logger.warn("logs_record_skipped reason=missing_attributes id={}", item.path("id").asText(""));
                continue;
            }
            entries.add(toEntry(item.path("id").asText(""), attributes));
        }

        String nextCursor = root.path("meta").path("page").path("after").asText("");
        logger.debug("logs_page_parsed entries={} skipped={} has_next={}", entries.size(), skipped, !nextCursor.isEmpty());
        return new FetchedPage(entries, nextCursor);
    }

    LogEntry toEntry(String id, JsonNode attributes) {
        Map<String, String> tags = parseTags(attributes.path("tags"));
        Map<String, Object> extra = extraAttributes(attributes);

        String status = text(attributes, "status");
        return LogEntry.builder()
            .id(id)
            .timestamp(parseTimestamp(attributes.path("timestamp")))
            .message(text(attributes, "message"))
            .level(status == null ? null : status.toUpperCase(Locale.ROOT))
            .service(text(attributes, "service"))
            .source(text(attributes, "source"))
            .host(text(attributes, "host"))
            .env(attributeOrTag(extra, tags, "env"))
            .version(attributeOrTag(extra, tags, "version"))
            .tags(tags)
            .attributes(extra)
            .build()
            .sanitized();
    }

    Instant parseTimestamp(JsonNode node) {
        if (node.isIntegralNumber()) {
            long value = node.asLong();
            return value > EPOCH_MILLIS_THRESHOLD ? Instant.ofEpochMilli(value) : Instant.ofEpochSecond(value);
        }
        if (node.isNumber()) {
            return Instant.ofEpochSecond(node.asLong());
        }
        if (node.isTextual()) {
            String text = node.asText().trim();
            try {
                return OffsetDateTime.parse(text).toInstant();
            } catch (DateTimeParseException ignored) {
                // fall through to the space-separated form
            }
            try {
                return LocalDateTime.parse(text, SPACED_TIMESTAMP).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                logger.debug("logs_timestamp_unparseable value={}", text);
            }
        }
        return Instant.now();
    }

    private Map<String, String> parseTags(JsonNode tagsNode) {
        Map<String, String> tags = new LinkedHashMap<>();
        if (!tagsNode.isArray()) {
            return tags;
        }
        for (JsonNode tag : tagsNode) {
            if (!tag.isTextual()) {
                continue;
            }
            String value = tag.asText();
            int colon = value.indexOf(':');
            if (colon > 0) {
                tags.put(value.substring(0, colon), value.substring(colon + 1));
            }
        }
        return tags;
    }

    // Custom attributes may arrive nested one level deep under "attributes".
    private Map<String, Object> extraAttributes(JsonNode attributes) {
        Map<String, Object> extra = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = attributes.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!KNOWN_FIELDS.contains(field.getKey())) {
                extra.put(field.getKey(), objectMapper.convertValue(field.getValue(), Object.class));
            }
        }
        JsonNode nested = attributes.path("attributes");
        if (nested.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> nestedFields = nested.fields();
            while (nestedFields.hasNext()) {
                Map.Entry<String, JsonNode> field = nestedFields.next();
                extra.putIfAbsent(field.getKey(), objectMapper.convertValue(field.getValue(), Object.class));
            }
        }
        return extra;
    }

    private static String attributeOrTag(Map<String, Object> attributes, Map<String, String> tags, String name) {
        Object value = attributes.get(name);
        if (value instanceof String && !((String) value).isBlank()) {
            return (String) value;
        }
        return tags.get(name);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        return value.asText();
    }
}
