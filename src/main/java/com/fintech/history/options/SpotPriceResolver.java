package com.fintech.history.options;

import com.fintech.history.catalog.ShardCatalog;
import com.fintech.history.domain.Bar;
import com.fintech.history.domain.Category;
import com.fintech.history.domain.Granularity;
import com.fintech.history.domain.ShardDescriptor;
import com.fintech.history.domain.TimeRange;
import com.fintech.history.exception.InvalidRangeException;
import com.fintech.history.exception.NoDataSourceException;
import com.fintech.history.exception.ShardNotFoundException;
import com.fintech.history.query.CrossShardQueryPlanner;
import com.fintech.history.query.PlanExecution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Finds an underlying's price on a date: the close of its latest bar at or before the end of that day,
 * read through the normal cross-shard path.
 */
public class SpotPriceResolver {

    private static final Logger log = LoggerFactory.getLogger(SpotPriceResolver.class);
    private static final List<Category> SPOT_CATEGORIES = List.of(Category.INDICES, Category.ETFS, Category.STOCKS);

    private final ShardCatalog catalog;
    private final CrossShardQueryPlanner planner;
    private final int lookbackDays;

    public SpotPriceResolver(ShardCatalog catalog, CrossShardQueryPlanner planner, int lookbackDays) {
        this.catalog = catalog;
        this.planner = planner;
        this.lookbackDays = lookbackDays;
    }

    /**
     * Searches indices, then ETFs, then stocks, finest stored granularity first.
     *
     * @throws ShardNotFoundException if no bar is found within the look-back window
     */
    public BigDecimal resolve(String underlying, LocalDate date) {
        TimeRange window = TimeRange.ofDates(date.minusDays(lookbackDays), date.plusDays(1));
        for (Category category : SPOT_CATEGORIES) {
            for (Granularity granularity : catalog.granularities(category, underlying)) {
                Optional<Bar> last = lastBar(category, underlying, granularity, window);
                if (last.isPresent()) {
                    log.debug("Spot for {} on {}: {} from {} {}", underlying, date, last.get().close(),
                        category.prefix(), granularity.canonical());
                    return last.get().close();
                }
            }
        }
        throw new ShardNotFoundException(String.format(
            "No spot price for %s within %d day(s) before %s", underlying, lookbackDays, date));
    }

    private Optional<Bar> lastBar(Category category, String underlying, Granularity granularity, TimeRange window) {
        List<ShardDescriptor> shards;
        try {
            shards = catalog.resolve(category, underlying, granularity, window);
        } catch (InvalidRangeException e) {
            return Optional.empty();
        }
        try (PlanExecution execution = planner.open(planner.plan(shards, underlying, window));
             Stream<Bar> bars = execution.bars()) {
            return bars.reduce((earlier, later) -> later);
        } catch (NoDataSourceException e) {
            log.warn("Spot source {} {} unavailable: {}", category.prefix(), underlying, e.getMessage());
            return Optional.empty();
        }
    }
}
