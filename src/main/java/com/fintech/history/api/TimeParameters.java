package com.fintech.history.api;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Parses range boundaries given as an ISO date (midnight UTC), an ISO instant or epoch milliseconds.
 */
final class TimeParameters {

    private TimeParameters() {
    }

    static long toEpochMillis(String name, String value) {
        String trimmed = value.trim();
        if (!trimmed.isEmpty() && trimmed.chars().allMatch(Character::isDigit)) {
            return Long.parseLong(trimmed);
        }
        try {
            if (trimmed.length() == 10) {
                return LocalDate.parse(trimmed).atStartOfDay().toInstant(ZoneOffset.UTC).toEpochMilli();
            }
            return Instant.parse(trimmed).toEpochMilli();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(String.format(
                "Parameter '%s' must be an ISO date, ISO instant or epoch milliseconds, got '%s'", name, value), e);
        }
    }
}
