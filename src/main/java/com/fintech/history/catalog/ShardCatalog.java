package com.fintech.history.catalog;

import com.fintech.history.domain.Category;
import com.fintech.history.domain.CoverageReport;
import com.fintech.history.domain.Granularity;
import com.fintech.history.domain.ShardDescriptor;
import com.fintech.history.domain.TimeRange;
import com.fintech.history.exception.InvalidRangeException;
import com.fintech.history.exception.ShardNotFoundException;
import com.fintech.history.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Routes logical queries to shard files.
 *
 * <p>Readers always see one consistent {@link CatalogSnapshot}; {@link #refresh()} builds a new snapshot
 * from a directory scan and swaps it in atomically, so resolution never blocks and never observes
 * a half-built inventory.
 */
public class ShardCatalog {

    private static final Logger log = LoggerFactory.getLogger(ShardCatalog.class);
    private static final int SCAN_DEPTH = 2;  // root/{category}/file.db

    private final Path root;
    private final Clock clock;
    private final AtomicReference<CatalogSnapshot> snapshot = new AtomicReference<>(CatalogSnapshot.empty());

    public ShardCatalog(Path root, Clock clock) {
        this.root = Objects.requireNonNull(root, "Catalog root cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    /**
     * Rescans the root directory and publishes a new snapshot.
     * A missing root yields an empty catalog rather than an error.
     *
     * @return the published snapshot
     */
    public CatalogSnapshot refresh() {
        List<ShardDescriptor> found = new ArrayList<>();
        if (Files.isDirectory(root)) {
            try (Stream<Path> files = Files.walk(root, SCAN_DEPTH)) {
                files.filter(Files::isRegularFile)
                    .forEach(file -> ShardFileNameParser.parse(file, sizeOf(file)).ifPresent(found::add));
            } catch (IOException | UncheckedIOException e) {
                throw new StorageException("Failed to scan catalog root " + root, e);
            }
        } else {
            log.warn("Catalog root {} does not exist, publishing empty catalog", root);
        }

        Instant scannedAt = clock.instant();
        CatalogSnapshot next = snapshot.updateAndGet(
            previous -> new CatalogSnapshot(previous.version() + 1, scannedAt, found));
        log.info("Catalog refreshed: root={}, shards={}, version={}", root, next.size(), next.version());
        return next;
    }

    public CatalogSnapshot snapshot() {
        return snapshot.get();
    }

    /**
     * Shards of one symbol at one native granularity whose coverage intersects the range,
     * sorted by ascending coverage start.
     *
     * @throws ShardNotFoundException if the symbol (or the granularity for it) has no shard at all
     * @throws InvalidRangeException if shards exist but none intersects the range
     */
    public List<ShardDescriptor> resolve(Category category, String symbol, Granularity granularity, TimeRange range) {
        Objects.requireNonNull(granularity, "Granularity cannot be null");
        List<ShardDescriptor> candidates = shardsOrThrow(category, symbol).stream()
            .filter(shard -> shard.granularity() == granularity)
            .collect(Collectors.toList());
        if (candidates.isEmpty()) {
            throw new ShardNotFoundException(String.format(
                "No %s shards for %s %s", granularity.canonical(), category.prefix(), symbol));
        }
        return overlapping(candidates, category, symbol, range);
    }

    /**
     * Shards of one symbol at any granularity intersecting the range. Used for option shards,
     * where a date maps to the calendar-month file(s) covering it.
     */
    public List<ShardDescriptor> resolve(Category category, String symbol, TimeRange range) {
        return overlapping(shardsOrThrow(category, symbol), category, symbol, range);
    }

    /** Native granularities stored for the symbol, finest first. Empty if the symbol is unknown. */
    public Set<Granularity> granularities(Category category, String symbol) {
        Set<Granularity> stored = EnumSet.noneOf(Granularity.class);
        snapshot.get().shardsFor(category, symbol).forEach(shard -> stored.add(shard.granularity()));
        return stored;
    }

    public boolean contains(Category category, String symbol) {
        return !snapshot.get().shardsFor(category, symbol).isEmpty();
    }

    /**
     * Lists shards, optionally narrowed to a category and symbol.
     */
    public List<ShardDescriptor> list(Optional<Category> category, Optional<String> symbol) {
        return snapshot.get().all().stream()
            .filter(shard -> category.map(c -> shard.category() == c).orElse(true))
            .filter(shard -> symbol.map(s -> shard.symbol().equalsIgnoreCase(s)).orElse(true))
            .collect(Collectors.toList());
    }

    /**
     * Covered intervals and gaps for one symbol and granularity inside the range.
     */
    public CoverageReport coverage(Category category, String symbol, Granularity granularity, TimeRange range) {
        List<TimeRange> covered = new ArrayList<>();
        snapshot.get().shardsFor(category, symbol).stream()
            .filter(shard -> shard.granularity() == granularity)
            .map(ShardDescriptor::coverage)
            .filter(c -> c.overlaps(range))
            .forEach(c -> {
                long start = Math.max(c.startMillis(), range.startMillis());
                long end = Math.min(c.endMillis(), range.endMillis());
                int last = covered.size() - 1;
                if (last >= 0 && start <= covered.get(last).endMillis()) {
                    TimeRange merged = covered.get(last);
                    covered.set(last, new TimeRange(merged.startMillis(), Math.max(merged.endMillis(), end)));
                } else {
                    covered.add(new TimeRange(start, end));
                }
            });

        List<TimeRange> gaps = new ArrayList<>();
        long cursor = range.startMillis();
        for (TimeRange c : covered) {
            if (c.startMillis() > cursor) {
                gaps.add(new TimeRange(cursor, c.startMillis()));
            }
            cursor = Math.max(cursor, c.endMillis());
        }
        if (cursor < range.endMillis()) {
            gaps.add(new TimeRange(cursor, range.endMillis()));
        }
        return new CoverageReport(category, symbol.toUpperCase(Locale.ROOT), granularity, range, covered, gaps);
    }

    private List<ShardDescriptor> shardsOrThrow(Category category, String symbol) {
        Objects.requireNonNull(category, "Category cannot be null");
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol cannot be null or blank");
        }
        List<ShardDescriptor> shards = snapshot.get().shardsFor(category, symbol);
        if (shards.isEmpty()) {
            throw new ShardNotFoundException(String.format("No shards for %s %s", category.prefix(), symbol));
        }
        return shards;
    }

    private static List<ShardDescriptor> overlapping(
            List<ShardDescriptor> candidates, Category category, String symbol, TimeRange range) {
        Objects.requireNonNull(range, "Range cannot be null");
        List<ShardDescriptor> matched = candidates.stream()
            .filter(shard -> shard.overlaps(range))
            .sorted(ShardDescriptor.PRECEDENCE)
            .collect(Collectors.toList());
        if (matched.isEmpty()) {
            throw new InvalidRangeException(InvalidRangeException.Reason.OUTSIDE_COVERAGE, String.format(
                "Range %s lies outside the coverage of %s %s", range, category.prefix(), symbol));
        }
        log.debug("Resolved {} {} {} -> {} shard(s)", category.prefix(), symbol, range, matched.size());
        return matched;
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            log.debug("Could not read size of {}: {}", file, e.getMessage());
            return 0L;
        }
    }
}
