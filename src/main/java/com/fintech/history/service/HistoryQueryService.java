package com.fintech.history.service;

import com.fintech.history.cache.ResultCache;
import com.fintech.history.catalog.CatalogSnapshot;
import com.fintech.history.catalog.ShardCatalog;
import com.fintech.history.config.HistoryProperties;
import com.fintech.history.domain.Bar;
import com.fintech.history.domain.BarQueryResult;
import com.fintech.history.domain.Category;
import com.fintech.history.domain.ChainResult;
import com.fintech.history.domain.CoverageReport;
import com.fintech.history.domain.Granularity;
import com.fintech.history.domain.QueryFingerprint;
import com.fintech.history.domain.ShardDescriptor;
import com.fintech.history.domain.TimeRange;
import com.fintech.history.exception.InvalidRangeException;
import com.fintech.history.exception.NoDataSourceException;
import com.fintech.history.options.OptionsChainResolver;
import com.fintech.history.query.CrossShardQueryPlanner;
import com.fintech.history.query.PlanExecution;
import com.fintech.history.query.QueryPlan;
import com.fintech.history.rollup.RollupResolver;
import com.fintech.history.rollup.SourceSegment;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Entry point for logical history queries.
 *
 * Responsibilities:
 * - Input validation before anything reaches the catalog
 * - Result caching keyed by query fingerprint
 * - Orchestration: catalog, planner, rollup, chain resolution
 * - Metrics and logging
 */
public class HistoryQueryService {

    private static final Logger log = LoggerFactory.getLogger(HistoryQueryService.class);
    private static final int LARGE_RESULT_WARNING = 100_000;

    private final ShardCatalog catalog;
    private final CrossShardQueryPlanner planner;
    private final RollupResolver rollupResolver;
    private final OptionsChainResolver chainResolver;
    private final ResultCache cache;
    private final HistoryProperties properties;
    private final MeterRegistry meterRegistry;

    private final AtomicLong validationErrors = new AtomicLong(0);

    public HistoryQueryService(
            ShardCatalog catalog,
            CrossShardQueryPlanner planner,
            RollupResolver rollupResolver,
            OptionsChainResolver chainResolver,
            ResultCache cache,
            HistoryProperties properties,
            MeterRegistry meterRegistry) {
        this.catalog = catalog;
        this.planner = planner;
        this.rollupResolver = rollupResolver;
        this.chainResolver = chainResolver;
        this.cache = cache;
        this.properties = properties;
        this.meterRegistry = meterRegistry;

        meterRegistry.gauge("history.service.validation.errors", validationErrors);
    }

    /**
     * Bars for one symbol over a half-open range at the requested granularity, rolled up from a finer
     * stored granularity when needed. A range outside the symbol's coverage yields an empty result.
     *
     * @throws ValidationException if the symbol is blank
     */
    public BarQueryResult getBars(Category category, String symbol, TimeRange range, Granularity granularity) {
        validateSymbol(symbol);
        if (category == null || range == null || granularity == null) {
            validationErrors.incrementAndGet();
            throw new ValidationException("Category, range and granularity are required");
        }
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return cache.getOrCompute(
                QueryFingerprint.bars(category, normalized, range, granularity),
                properties.getCache().getBarsTtl(),
                () -> loadBars(category, normalized, range, granularity));
        } finally {
            sample.stop(meterRegistry.timer("history.query.bars.time",
                "category", category.prefix(),
                "granularity", granularity.canonical()));
        }
    }

    /**
     * Option chain around the money.
     *
     * @param strikeWindow strikes either side of the money, or null for the configured default
     * @param expiry expiry to use, or null for the nearest one on or after the date
     */
    public ChainResult getChain(String underlying, LocalDate date, Integer strikeWindow, LocalDate expiry) {
        validateSymbol(underlying);
        if (date == null) {
            validationErrors.incrementAndGet();
            throw new ValidationException("Date is required");
        }
        int window = strikeWindow != null ? strikeWindow : properties.getOptions().getDefaultStrikeWindow();
        if (window < 0 || window > properties.getOptions().getMaxStrikeWindow()) {
            validationErrors.incrementAndGet();
            throw new ValidationException(String.format(
                "Strike window must be between 0 and %d", properties.getOptions().getMaxStrikeWindow()));
        }
        if (expiry != null && expiry.isBefore(date)) {
            validationErrors.incrementAndGet();
            throw new ValidationException("Expiry cannot be before date");
        }
        String normalized = underlying.trim().toUpperCase(Locale.ROOT);

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return cache.getOrCompute(
                QueryFingerprint.chain(normalized, date, expiry, window),
                properties.getCache().getChainTtl(),
                () -> chainResolver.resolveChain(normalized, date, window, expiry));
        } finally {
            sample.stop(meterRegistry.timer("history.query.chain.time"));
        }
    }

    public List<ShardDescriptor> listShards(Optional<Category> category, Optional<String> symbol) {
        return catalog.list(category, symbol);
    }

    public CoverageReport coverage(Category category, String symbol, Granularity granularity, TimeRange range) {
        validateSymbol(symbol);
        return catalog.coverage(category, symbol.trim().toUpperCase(Locale.ROOT), granularity, range);
    }

    /**
     * Rescans the catalog root and drops cached results computed against the previous inventory.
     */
    public CatalogSnapshot refreshCatalog() {
        CatalogSnapshot snapshot = catalog.refresh();
        cache.invalidateAll();
        return snapshot;
    }

    private BarQueryResult loadBars(Category category, String symbol, TimeRange range, Granularity granularity) {
        List<SourceSegment> segments;
        try {
            segments = rollupResolver.planSources(category, symbol, granularity, range);
        } catch (InvalidRangeException e) {
            log.debug("Empty result for {} {}: {}", category.prefix(), symbol, e.getMessage());
            return BarQueryResult.empty(category, symbol, range, granularity);
        }

        List<Bar> result = new ArrayList<>();
        Set<String> contributing = new LinkedHashSet<>();
        Set<String> unavailable = new LinkedHashSet<>();
        NoDataSourceException lastFailure = null;
        int failedSegments = 0;
        for (SourceSegment segment : segments) {
            try {
                readSegment(category, symbol, granularity, segment, result, contributing, unavailable);
            } catch (NoDataSourceException e) {
                failedSegments++;
                lastFailure = e;
                unavailable.addAll(e.getUnavailableShards());
                log.warn("No readable shard for {} {} in {}: {}", category.prefix(), symbol, segment.range(),
                    e.getMessage());
            }
        }
        if (failedSegments == segments.size()) {
            throw segments.size() == 1 ? lastFailure : new NoDataSourceException(String.format(
                "None of the shards for %s %s could be read", category.prefix(), symbol), List.copyOf(unavailable));
        }

        boolean partial = !unavailable.isEmpty();
        Granularity source = segments.stream().map(SourceSegment::granularity)
            .min(Comparator.naturalOrder()).orElse(granularity);
        if (result.size() > LARGE_RESULT_WARNING) {
            log.warn("Large result set: {} bars for {} {} at {}", result.size(), category.prefix(), symbol,
                granularity.canonical());
        }
        if (partial) {
            log.warn("Partial coverage for {} {}: unavailable={}", category.prefix(), symbol, unavailable);
        }
        log.debug("Bars query: {} {} {} at {} (source {}) -> {} bars from {} shard(s)", category.prefix(), symbol,
            range, granularity.canonical(), source.canonical(), result.size(), contributing.size());

        return new BarQueryResult(category, symbol, range, granularity, source, result,
            partial, List.copyOf(contributing), List.copyOf(unavailable));
    }

    private void readSegment(Category category, String symbol, Granularity granularity, SourceSegment segment,
                             List<Bar> into, Set<String> contributing, Set<String> unavailable) {
        List<ShardDescriptor> shards = catalog.resolve(category, symbol, segment.granularity(), segment.range());
        QueryPlan plan = planner.plan(shards, symbol, segment.range());
        try (PlanExecution execution = planner.open(plan);
             Stream<Bar> stored = execution.bars();
             Stream<Bar> bars = segment.granularity() == granularity
                 ? stored : rollupResolver.rollup(stored, granularity)) {
            bars.forEachOrdered(into::add);
            contributing.addAll(execution.contributingShards());
            unavailable.addAll(execution.unavailableShards());
        }
    }

    private void validateSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            validationErrors.incrementAndGet();
            throw new ValidationException("Symbol cannot be null or blank");
        }
    }

    /**
     * Business logic validation exception.
     */
    public static class ValidationException extends RuntimeException {
        public ValidationException(String message) {
            super(message);
        }
    }
}
