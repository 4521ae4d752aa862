package com.fintech.history.rollup;

import com.fintech.history.catalog.ShardCatalog;
import com.fintech.history.domain.Bar;
import com.fintech.history.domain.Category;
import com.fintech.history.domain.Granularity;
import com.fintech.history.domain.TimeRange;
import com.fintech.history.exception.InvalidRangeException;
import com.fintech.history.exception.ShardNotFoundException;
import com.fintech.history.exception.UnsupportedGranularityException;
import com.fintech.history.testsupport.MutableClock;
import com.fintech.history.testsupport.ShardFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RollupResolver}.
 *
 * <p><b>Test Strategy:</b>
 * <ul>
 *   <li>Source planning against a catalog holding 1m (2024) and 1h (2020-2023) shards</li>
 *   <li>Aggregation: OHLC, volume, trade count, vwap</li>
 *   <li>Algebra: same-width rollup is the identity, rollups compose, empty buckets are never emitted</li>
 * </ul>
 */
@DisplayName("RollupResolver Tests")
class RollupResolverTest {

    private static final long JAN_02 = ShardFixtures.startOfDay(LocalDate.of(2024, 1, 2));

    @TempDir
    Path root;

    private RollupResolver resolver;

    @BeforeEach
    void setUp() {
        ShardFixtures fixtures = new ShardFixtures(root);
        fixtures.barShard("indices", "indices_SPX_2024.db", "SPX", List.of());
        fixtures.barShard("indices", "indices_SPX_2020_2023_1h.db", "SPX", List.of());
        ShardCatalog catalog = new ShardCatalog(root, new MutableClock(Instant.EPOCH));
        catalog.refresh();
        resolver = new RollupResolver(catalog);
    }

    /** Minute bars from 14:30 with prices 100, 101, 102 ... and volume 10 each. */
    private static List<Bar> minuteBars(long start, int count) {
        List<Bar> bars = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            double price = 100.0 + i;
            bars.add(Bar.of(start + i * 60_000L, price, price + 0.5, price - 0.5, price + 0.25, 10L));
        }
        return bars;
    }

    private List<Bar> rollup(List<Bar> bars, Granularity target) {
        try (Stream<Bar> rolled = resolver.rollup(bars.stream(), target)) {
            return rolled.collect(Collectors.toList());
        }
    }

    private static TimeRange days(LocalDate from, LocalDate to) {
        return TimeRange.ofDates(from, to);
    }

    @Test
    @DisplayName("planSources() should read the target as stored when it covers the range")
    void testPlanStoredTarget() {
        TimeRange range = days(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 3));

        assertThat(resolver.planSources(Category.INDICES, "SPX", Granularity.M1, range))
            .containsExactly(new SourceSegment(Granularity.M1, range));
    }

    @Test
    @DisplayName("planSources() should pick the finest covering width that divides the target")
    void testPlanFinerSource() {
        TimeRange in2024 = days(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 4));
        TimeRange in2022 = days(LocalDate.of(2022, 1, 3), LocalDate.of(2022, 1, 5));

        assertThat(resolver.planSources(Category.INDICES, "SPX", Granularity.D1, in2024))
            .containsExactly(new SourceSegment(Granularity.M1, in2024));
        // only the 1h shard covers 2022
        assertThat(resolver.planSources(Category.INDICES, "SPX", Granularity.D1, in2022))
            .containsExactly(new SourceSegment(Granularity.H1, in2022));
        assertThat(resolver.planSources(Category.INDICES, "SPX", Granularity.H1, in2022))
            .containsExactly(new SourceSegment(Granularity.H1, in2022));
    }

    @Test
    @DisplayName("planSources() should stitch widths together where each covers part of the range")
    void testPlanAcrossWidths() {
        LocalDate newYear = LocalDate.of(2024, 1, 1);
        TimeRange range = days(LocalDate.of(2023, 12, 28), LocalDate.of(2024, 1, 3));

        assertThat(resolver.planSources(Category.INDICES, "SPX", Granularity.D1, range)).containsExactly(
            new SourceSegment(Granularity.H1, days(LocalDate.of(2023, 12, 28), newYear)),
            new SourceSegment(Granularity.M1, days(newYear, LocalDate.of(2024, 1, 3))));
        // the stored target covers 2023, minutes fill 2024
        assertThat(resolver.planSources(Category.INDICES, "SPX", Granularity.H1, range)).containsExactly(
            new SourceSegment(Granularity.H1, days(LocalDate.of(2023, 12, 28), newYear)),
            new SourceSegment(Granularity.M1, days(newYear, LocalDate.of(2024, 1, 3))));
    }

    @Test
    @DisplayName("planSources() should leave out parts no usable width covers")
    void testPlanLeavesUncoveredOut() {
        TimeRange range = days(LocalDate.of(2019, 12, 30), LocalDate.of(2020, 1, 3));

        assertThat(resolver.planSources(Category.INDICES, "SPX", Granularity.D1, range))
            .containsExactly(new SourceSegment(Granularity.H1,
                days(LocalDate.of(2020, 1, 1), LocalDate.of(2020, 1, 3))));
    }

    @Test
    @DisplayName("planSources() should fail for unknown symbols, underivable widths and uncovered ranges")
    void testPlanFailures() {
        TimeRange in2022 = days(LocalDate.of(2022, 1, 3), LocalDate.of(2022, 1, 5));
        TimeRange in2019 = days(LocalDate.of(2019, 1, 3), LocalDate.of(2019, 1, 5));

        assertThatThrownBy(() -> resolver.planSources(Category.INDICES, "NDX", Granularity.D1, in2022))
            .isInstanceOf(ShardNotFoundException.class);
        // 1h bars cannot produce 15m bars, and no 1m shard covers 2022
        assertThatThrownBy(() -> resolver.planSources(Category.INDICES, "SPX", Granularity.M15, in2022))
            .isInstanceOf(InvalidRangeException.class);
        assertThatThrownBy(() -> resolver.planSources(Category.INDICES, "SPX", Granularity.D1, in2019))
            .isInstanceOf(InvalidRangeException.class);
    }

    @Test
    @DisplayName("planSources() should reject targets finer than every stored width")
    void testUnsupportedGranularity() {
        ShardFixtures fixtures = new ShardFixtures(root.resolve("coarse"));
        fixtures.barShard("etfs", "etfs_SPY_2024_1d.db", "SPY", List.of());
        ShardCatalog catalog = new ShardCatalog(root.resolve("coarse"), new MutableClock(Instant.EPOCH));
        catalog.refresh();
        TimeRange range = days(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 3));

        assertThatThrownBy(() -> new RollupResolver(catalog).planSources(Category.ETFS, "SPY", Granularity.H1, range))
            .isInstanceOf(UnsupportedGranularityException.class)
            .hasMessageContaining("1h");
    }

    @Test
    @DisplayName("Five minute bars should aggregate OHLCV from their minutes")
    void testAggregation() {
        long start = JAN_02 + 14 * 3_600_000L + 30 * 60_000L;

        List<Bar> rolled = rollup(minuteBars(start, 7), Granularity.M5);

        assertThat(rolled).hasSize(2);
        Bar first = rolled.get(0);
        assertThat(first.timestamp()).isEqualTo(start);
        assertThat(first.open()).isEqualByComparingTo("100");
        assertThat(first.high()).isEqualByComparingTo("104.5");
        assertThat(first.low()).isEqualByComparingTo("99.5");
        assertThat(first.close()).isEqualByComparingTo("104.25");
        assertThat(first.volume()).isEqualTo(50L);
        Bar second = rolled.get(1);
        assertThat(second.timestamp()).isEqualTo(start + 300_000L);
        assertThat(second.volume()).isEqualTo(20L);
    }

    @Test
    @DisplayName("Trade counts should sum and vwap should be volume weighted")
    void testTradeCountAndVwap() {
        List<Bar> bars = List.of(
            new Bar(JAN_02, BigDecimal.TEN, BigDecimal.TEN, BigDecimal.TEN, BigDecimal.TEN, 10L, 4L, BigDecimal.TEN),
            new Bar(JAN_02 + 60_000L, new BigDecimal("20"), new BigDecimal("20"), new BigDecimal("20"),
                new BigDecimal("20"), 30L, 6L, new BigDecimal("20")),
            new Bar(JAN_02 + 120_000L, BigDecimal.TEN, BigDecimal.TEN, BigDecimal.TEN, BigDecimal.TEN, 0L, null, null));

        Bar rolled = rollup(bars, Granularity.M5).get(0);

        assertThat(rolled.tradeCount()).isEqualTo(10L);
        // (10 * 10 + 30 * 20) / 40
        assertThat(rolled.vwap()).isEqualByComparingTo("17.5");
        assertThat(rolled.volume()).isEqualTo(40L);
    }

    @Test
    @DisplayName("Rolling up to the same width should be the identity")
    void testIdempotence() {
        List<Bar> fiveMinute = rollup(minuteBars(JAN_02, 30), Granularity.M5);

        assertThat(rollup(fiveMinute, Granularity.M5)).isEqualTo(fiveMinute);
    }

    @Test
    @DisplayName("Rolling 1m to 5m to 15m should equal rolling 1m to 15m directly")
    void testAssociativity() {
        List<Bar> minutes = minuteBars(JAN_02 + 7 * 60_000L, 95);

        List<Bar> direct = rollup(minutes, Granularity.M15);
        List<Bar> stepped = rollup(rollup(minutes, Granularity.M5), Granularity.M15);

        assertThat(stepped).isEqualTo(direct);
    }

    @Test
    @DisplayName("Buckets without source bars should not be emitted")
    void testNoEmptyBuckets() {
        List<Bar> sparse = List.of(
            Bar.of(JAN_02, 1, 1, 1, 1, 1L),
            Bar.of(JAN_02 + 3 * 3_600_000L, 2, 2, 2, 2, 1L));

        assertThat(rollup(sparse, Granularity.H1)).extracting(Bar::timestamp)
            .containsExactly(JAN_02, JAN_02 + 3 * 3_600_000L);
    }

    @Test
    @DisplayName("Two trading days of minutes should roll up to two daily bars")
    void testDailyRollup() {
        List<Bar> minutes = new ArrayList<>(minuteBars(JAN_02 + 14 * 3_600_000L + 30 * 60_000L, 390));
        minutes.addAll(minuteBars(JAN_02 + 86_400_000L + 14 * 3_600_000L + 30 * 60_000L, 390));

        List<Bar> daily = rollup(minutes, Granularity.D1);

        assertThat(daily).extracting(Bar::timestamp).containsExactly(JAN_02, JAN_02 + 86_400_000L);
        assertThat(daily).allSatisfy(bar -> assertThat(bar.volume()).isEqualTo(3900L));
    }

    @Test
    @DisplayName("Closing the rolled stream should close the source stream")
    void testCloseCascades() {
        AtomicBoolean closed = new AtomicBoolean(false);
        Stream<Bar> source = minuteBars(JAN_02, 3).stream().onClose(() -> closed.set(true));

        resolver.rollup(source, Granularity.M5).close();

        assertThat(closed).isTrue();
    }
}
