package com.fintech.history.domain;

import java.util.Locale;

/**
 * Instrument category. Each category is stored in its own directory under the catalog root
 * and its shard file names start with {@link #prefix()}.
 */
public enum Category {

    INDICES("indices"),
    OPTIONS("options"),
    ETFS("etfs"),
    STOCKS("stocks");

    private final String prefix;

    Category(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    /**
     * Parses a category name, singular or plural, case-insensitive.
     *
     * @throws IllegalArgumentException if the value names no category
     */
    public static Category parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Category cannot be null or blank");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "indices", "index" -> INDICES;
            case "options", "option" -> OPTIONS;
            case "etfs", "etf" -> ETFS;
            case "stocks", "stock", "equities", "equity" -> STOCKS;
            default -> throw new IllegalArgumentException(
                "Unsupported category '" + value + "'. Allowed: indices, options, etfs, stocks");
        };
    }
}
