package com.fintech.history.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Option chain around the money for one underlying, date and expiry.
 * Entries are ordered calls first, then by ascending strike.
 */
public record ChainResult(
    String underlying,
    LocalDate date,
    LocalDate expiry,
    BigDecimal spot,
    BigDecimal atmStrike,
    int strikeWindow,
    List<ChainEntry> entries,
    boolean partialCoverage,
    List<String> shards,
    List<String> unavailableShards
) {

    public ChainResult {
        entries = List.copyOf(entries);
        shards = List.copyOf(shards);
        unavailableShards = List.copyOf(unavailableShards);
    }
}
