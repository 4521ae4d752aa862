package com.fintech.history.domain;

import com.fintech.history.exception.InvalidRangeException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Half-open time range {@code [startMillis, endMillis)} in epoch milliseconds (UTC).
 * An empty or inverted range is rejected at construction.
 */
public record TimeRange(long startMillis, long endMillis) {

    public TimeRange {
        if (startMillis >= endMillis) {
            throw InvalidRangeException.emptyOrInverted(startMillis, endMillis);
        }
    }

    /**
     * Range from midnight UTC of {@code from} to midnight UTC of {@code toExclusive}.
     * "2024-01-01 to 2024-01-03" therefore covers January 1st and 2nd.
     */
    public static TimeRange ofDates(LocalDate from, LocalDate toExclusive) {
        return new TimeRange(startOfDay(from), startOfDay(toExclusive));
    }

    /** The single UTC calendar day {@code date}. */
    public static TimeRange ofDay(LocalDate date) {
        return ofDates(date, date.plusDays(1));
    }

    public static long startOfDay(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
    }

    public boolean overlaps(TimeRange other) {
        return startMillis < other.endMillis && other.startMillis < endMillis;
    }

    public boolean contains(long timestamp) {
        return timestamp >= startMillis && timestamp < endMillis;
    }

    public long durationMillis() {
        return endMillis - startMillis;
    }

    @Override
    public String toString() {
        return "[" + Instant.ofEpochMilli(startMillis) + ", " + Instant.ofEpochMilli(endMillis) + ")";
    }
}
