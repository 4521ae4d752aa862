package com.fintech.history.domain;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.Objects;

/**
 * One shard file and the slice of data it is authoritative for.
 *
 * @param id file name, unique within a catalog root
 * @param category instrument category
 * @param symbol upper-case symbol (or option underlying)
 * @param coverageStart first covered UTC day (inclusive)
 * @param coverageEnd last covered UTC day (inclusive)
 * @param granularity native bar width stored in the file
 * @param path location on disk
 * @param sizeBytes file size at scan time, a hint only
 */
public record ShardDescriptor(
    String id,
    Category category,
    String symbol,
    LocalDate coverageStart,
    LocalDate coverageEnd,
    Granularity granularity,
    Path path,
    long sizeBytes
) {

    /**
     * Seam precedence: later coverage start wins, then later coverage end, then file name.
     */
    public static final Comparator<ShardDescriptor> PRECEDENCE = Comparator
        .comparing(ShardDescriptor::coverageStart)
        .thenComparing(ShardDescriptor::coverageEnd)
        .thenComparing(ShardDescriptor::id);

    public ShardDescriptor {
        Objects.requireNonNull(id, "Shard id cannot be null");
        Objects.requireNonNull(category, "Category cannot be null");
        Objects.requireNonNull(symbol, "Symbol cannot be null");
        Objects.requireNonNull(coverageStart, "Coverage start cannot be null");
        Objects.requireNonNull(coverageEnd, "Coverage end cannot be null");
        Objects.requireNonNull(granularity, "Granularity cannot be null");
        Objects.requireNonNull(path, "Path cannot be null");
        if (coverageEnd.isBefore(coverageStart)) {
            throw new IllegalArgumentException(
                "Coverage end (" + coverageEnd + ") cannot be before coverage start (" + coverageStart + ")");
        }
    }

    /** Coverage as a half-open millisecond range. */
    public TimeRange coverage() {
        return TimeRange.ofDates(coverageStart, coverageEnd.plusDays(1));
    }

    public boolean overlaps(TimeRange range) {
        return coverage().overlaps(range);
    }
}
