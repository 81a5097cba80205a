package com.logpanel.logs.api;

import com.logpanel.logs.service.InvalidLogQueryException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

final class TimeBounds {
    private TimeBounds() {
    }

    static Instant parse(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidLogQueryException(field + " is required");
        }
        String trimmed = value.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            try {
                return Instant.ofEpochMilli(Long.parseLong(trimmed));
            } catch (NumberFormatException e) {
                throw new InvalidLogQueryException(field + " is out of range");
            }
        }
        try {
            return OffsetDateTime.parse(trimmed).toInstant();
        } catch (DateTimeParseException e) {
            throw new InvalidLogQueryException(field + " must be ISO-8601 or epoch milliseconds");
        }
    }
}
