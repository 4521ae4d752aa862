package com.fintech.history.domain;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Objects;

/**
 * Canonical identity of a logical query, used as the result cache key.
 * Two requests that differ only in spelling (symbol case, granularity alias) map to the same fingerprint.
 */
public record QueryFingerprint(
    Kind kind,
    Category category,
    String symbol,
    long startMillis,
    long endMillis,
    Granularity granularity,
    LocalDate expiry,
    int strikeWindow
) {

    public enum Kind {
        BARS,
        CHAIN
    }

    public QueryFingerprint {
        Objects.requireNonNull(kind, "Kind cannot be null");
        Objects.requireNonNull(category, "Category cannot be null");
        Objects.requireNonNull(symbol, "Symbol cannot be null");
        symbol = symbol.trim().toUpperCase(Locale.ROOT);
    }

    public static QueryFingerprint bars(Category category, String symbol, TimeRange range, Granularity granularity) {
        Objects.requireNonNull(granularity, "Granularity cannot be null");
        return new QueryFingerprint(Kind.BARS, category, symbol, range.startMillis(), range.endMillis(),
            granularity, null, 0);
    }

    public static QueryFingerprint chain(String underlying, LocalDate date, LocalDate expiry, int strikeWindow) {
        TimeRange day = TimeRange.ofDay(date);
        return new QueryFingerprint(Kind.CHAIN, Category.OPTIONS, underlying, day.startMillis(), day.endMillis(),
            null, expiry, strikeWindow);
    }

    /**
     * Creates a string representation suitable for logs.
     * Format: "KIND|category|SYMBOL|start|end|granularity|expiry|window"
     */
    public String toStringKey() {
        return String.join("|",
            kind.name(),
            category.prefix(),
            symbol,
            Long.toString(startMillis),
            Long.toString(endMillis),
            granularity == null ? "-" : granularity.canonical(),
            expiry == null ? "-" : expiry.toString(),
            Integer.toString(strikeWindow));
    }
}
