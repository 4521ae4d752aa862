package com.fintech.history.service;

import com.fintech.history.domain.BarQueryResult;
import com.fintech.history.domain.Category;
import com.fintech.history.domain.ChainResult;
import com.fintech.history.domain.Granularity;
import com.fintech.history.domain.ShardDescriptor;
import com.fintech.history.domain.TimeRange;
import com.fintech.history.exception.NoDataSourceException;
import com.fintech.history.exception.ShardNotFoundException;
import com.fintech.history.exception.UnsupportedGranularityException;
import com.fintech.history.testsupport.ShardFixtures;
import com.fintech.history.testsupport.SpxMarket;
import com.fintech.history.testsupport.TestEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Tests for {@link HistoryQueryService} over a real engine on fixture shards.
 */
@DisplayName("HistoryQueryService Tests")
class HistoryQueryServiceTest {

    private static final LocalDate MAR_14 = LocalDate.of(2024, 3, 14);
    private static final LocalDate MAR_16 = LocalDate.of(2024, 3, 16);

    @TempDir
    Path root;

    private TestEngine engine;
    private HistoryQueryService service;

    @BeforeEach
    void setUp() {
        SpxMarket.write(root);
        engine = new TestEngine(root);
        service = engine.service;
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    @DisplayName("Should return stored minute bars for a range")
    void testMinuteBars() {
        BarQueryResult result = service.getBars(Category.INDICES, "spx", TimeRange.ofDates(MAR_14, MAR_16),
            Granularity.M1);

        assertThat(result.symbol()).isEqualTo("SPX");
        assertThat(result.bars()).hasSize(20);
        assertThat(result.sourceGranularity()).isEqualTo(Granularity.M1);
        assertThat(result.partialCoverage()).isFalse();
        assertThat(result.shards()).containsExactly("indices_SPX_2024.db");
    }

    @Test
    @DisplayName("Should roll minute bars up to daily bars")
    void testDailyRollup() {
        BarQueryResult result = service.getBars(Category.INDICES, "SPX", TimeRange.ofDates(MAR_14, MAR_16),
            Granularity.D1);

        assertThat(result.granularity()).isEqualTo(Granularity.D1);
        assertThat(result.sourceGranularity()).isEqualTo(Granularity.M1);
        assertThat(result.bars()).hasSize(2);
        assertThat(result.bars().get(0).timestamp()).isEqualTo(ShardFixtures.startOfDay(MAR_14));
        assertThat(result.bars().get(0).volume()).isEqualTo(100L);
        assertThat(result.bars().get(1).close()).isEqualByComparingTo("5117");
    }

    @Test
    @DisplayName("A repeated query should be served from the cache without touching shards")
    void testRepeatedQueryCached() {
        TimeRange range = TimeRange.ofDates(MAR_14, MAR_16);

        BarQueryResult first = service.getBars(Category.INDICES, "SPX", range, Granularity.M5);
        BarQueryResult second = service.getBars(Category.INDICES, "spx", range, Granularity.parse("5min"));

        assertThat(second).isSameAs(first);
        verify(engine.pool, times(1)).acquire(any(ShardDescriptor.class));
    }

    @Test
    @DisplayName("A range outside a known symbol's coverage should give an empty result")
    void testOutsideCoverage() {
        BarQueryResult result = service.getBars(Category.INDICES, "SPX",
            TimeRange.ofDates(LocalDate.of(2021, 1, 4), LocalDate.of(2021, 1, 5)), Granularity.M1);

        assertThat(result.bars()).isEmpty();
        assertThat(result.shards()).isEmpty();
    }

    @Test
    @DisplayName("Unknown symbols and underivable granularities should be reported as errors")
    void testQueryErrors() {
        TimeRange range = TimeRange.ofDates(MAR_14, MAR_16);
        new ShardFixtures(root).barShard("etfs", "etfs_SPY_2024_1h.db", "SPY", List.of());
        service.refreshCatalog();

        assertThatThrownBy(() -> service.getBars(Category.INDICES, "NDX", range, Granularity.M1))
            .isInstanceOf(ShardNotFoundException.class);
        assertThatThrownBy(() -> service.getBars(Category.ETFS, "SPY", range, Granularity.M5))
            .isInstanceOf(UnsupportedGranularityException.class);
    }

    @Test
    @DisplayName("Covered days stored at different widths should all be returned")
    void testMixedStoredWidths() {
        ShardFixtures fixtures = new ShardFixtures(root);
        fixtures.barShard("indices", "indices_SPX_2023_1d.db", "SPX", ShardFixtures.flatBars(
            ShardFixtures.startOfDay(LocalDate.of(2023, 12, 28)), 86_400_000L, 2, 4780.0));
        fixtures.barShard("indices", "indices_SPX_2024.db", "SPX", ShardFixtures.flatBars(
            ShardFixtures.millis("2024-01-02T14:30:00"), 60_000L, 30, 4740.0));
        service.refreshCatalog();

        BarQueryResult result = service.getBars(Category.INDICES, "SPX",
            TimeRange.ofDates(LocalDate.of(2023, 12, 28), LocalDate.of(2024, 1, 3)), Granularity.D1);

        assertThat(result.bars()).extracting(bar -> bar.timestamp()).containsExactly(
            ShardFixtures.startOfDay(LocalDate.of(2023, 12, 28)),
            ShardFixtures.startOfDay(LocalDate.of(2023, 12, 29)),
            ShardFixtures.startOfDay(LocalDate.of(2024, 1, 2)));
        assertThat(result.bars().get(2).volume()).isEqualTo(300L);
        assertThat(result.shards()).containsExactly("indices_SPX_2023_1d.db", "indices_SPX_2024.db");
        assertThat(result.sourceGranularity()).isEqualTo(Granularity.M1);
        assertThat(result.partialCoverage()).isFalse();
    }

    @Test
    @DisplayName("A query whose every shard fails to read should report no data source")
    void testEveryShardUnreadable() {
        new ShardFixtures(root).foreignShard("indices", "indices_QQQ_2024.db");
        service.refreshCatalog();

        assertThatThrownBy(() -> service.getBars(Category.INDICES, "QQQ", TimeRange.ofDates(MAR_14, MAR_16),
                Granularity.M1))
            .isInstanceOf(NoDataSourceException.class)
            .satisfies(e -> assertThat(((NoDataSourceException) e).getUnavailableShards())
                .containsExactly("indices_QQQ_2024.db"));
        assertThat(engine.pool.activeLeases()).isZero();
        assertThat(engine.cache.size()).isZero();
    }

    @Test
    @DisplayName("Should validate inputs before querying")
    void testValidation() {
        TimeRange range = TimeRange.ofDates(MAR_14, MAR_16);

        assertThatThrownBy(() -> service.getBars(Category.INDICES, " ", range, Granularity.M1))
            .isInstanceOf(HistoryQueryService.ValidationException.class);
        assertThatThrownBy(() -> service.getBars(Category.INDICES, "SPX", range, null))
            .isInstanceOf(HistoryQueryService.ValidationException.class);
        assertThatThrownBy(() -> service.getChain("SPX", SpxMarket.DATE, 101, null))
            .isInstanceOf(HistoryQueryService.ValidationException.class)
            .hasMessageContaining("between 0 and 100");
        assertThatThrownBy(() -> service.getChain("SPX", SpxMarket.DATE, 5, MAR_14))
            .isInstanceOf(HistoryQueryService.ValidationException.class);
        assertThat(engine.meterRegistry.get("history.service.validation.errors").gauge().value()).isEqualTo(4.0);
    }

    @Test
    @DisplayName("getChain() should fall back to the configured window")
    void testDefaultWindow() {
        ChainResult chain = service.getChain("spx", SpxMarket.DATE, null, null);

        assertThat(chain.strikeWindow()).isEqualTo(10);
        assertThat(chain.underlying()).isEqualTo("SPX");
        assertThat(chain.entries()).isNotEmpty();
    }

    @Test
    @DisplayName("refreshCatalog() should pick up new shards and drop cached results")
    void testRefreshInvalidates() {
        TimeRange range = TimeRange.ofDates(MAR_14, MAR_16);
        service.getBars(Category.INDICES, "SPX", range, Granularity.M1);
        assertThat(engine.cache.size()).isEqualTo(1);

        new ShardFixtures(root).barShard("stocks", "stocks_AAPL_2024.db", "AAPL", List.of());
        service.refreshCatalog();

        assertThat(engine.cache.size()).isZero();
        assertThat(service.listShards(Optional.of(Category.STOCKS), Optional.empty()))
            .extracting(ShardDescriptor::id)
            .containsExactly("stocks_AAPL_2024.db");
    }
}
