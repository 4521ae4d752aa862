package com.fintech.history.domain;

import java.util.Locale;

/**
 * Bar widths with epoch-aligned window calculations.
 * All widths divide a UTC day evenly, so {@link #D1} windows start at UTC midnight.
 */
public enum Granularity {

    M1(60_000L, "1m"),
    M5(300_000L, "5m"),
    M15(900_000L, "15m"),
    M30(1_800_000L, "30m"),
    H1(3_600_000L, "1h"),
    D1(86_400_000L, "1d");

    private final long milliseconds;
    private final String canonical;

    Granularity(long milliseconds, String canonical) {
        this.milliseconds = milliseconds;
        this.canonical = canonical;
    }

    /** Returns bar width in milliseconds. */
    public long toMillis() {
        return milliseconds;
    }

    /** Returns the short form used in file names and fingerprints, e.g. "5m". */
    public String canonical() {
        return canonical;
    }

    /**
     * Aligns timestamp to window start.
     * Floor division keeps pre-epoch timestamps in the correct window.
     */
    public long alignTimestamp(long timestamp) {
        return Math.floorDiv(timestamp, milliseconds) * milliseconds;
    }

    /** Returns exclusive window end: windowStart + width. */
    public long windowEnd(long windowStart) {
        return windowStart + milliseconds;
    }

    /** Returns true if both timestamps align to same window start. */
    public boolean inSameWindow(long timestamp1, long timestamp2) {
        return alignTimestamp(timestamp1) == alignTimestamp(timestamp2);
    }

    /**
     * Returns true if bars of this width can be rolled up into {@code target}:
     * the target is strictly wider and an exact multiple.
     */
    public boolean divides(Granularity target) {
        return target.milliseconds > milliseconds && target.milliseconds % milliseconds == 0;
    }

    /**
     * Parses a granularity string. Accepts "1m"/"1min"/"m1", "5m"/"5min"/"m5",
     * "15m", "30m", "1h"/"60m"/"h1" and "1d"/"d"/"day"/"d1".
     *
     * @throws IllegalArgumentException if the value is not a supported granularity
     */
    public static Granularity parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Granularity cannot be null or blank");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "1m", "1min", "m1", "minute" -> M1;
            case "5m", "5min", "m5" -> M5;
            case "15m", "15min", "m15" -> M15;
            case "30m", "30min", "m30" -> M30;
            case "1h", "60m", "h1", "hour" -> H1;
            case "1d", "d", "day", "d1", "daily" -> D1;
            default -> throw new IllegalArgumentException(
                "Unsupported granularity '" + value + "'. Allowed: 1m, 5m, 15m, 30m, 1h, 1d");
        };
    }
}
