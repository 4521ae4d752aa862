package com.fintech.history.testsupport;

import com.fintech.history.cache.ResultCache;
import com.fintech.history.catalog.ShardCatalog;
import com.fintech.history.config.HistoryProperties;
import com.fintech.history.options.ImpliedVolatilitySolver;
import com.fintech.history.options.OptionsChainResolver;
import com.fintech.history.options.SpotPriceResolver;
import com.fintech.history.query.CrossShardQueryPlanner;
import com.fintech.history.rollup.RollupResolver;
import com.fintech.history.service.HistoryQueryService;
import com.fintech.history.storage.ShardConnectionPool;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.nio.file.Path;
import java.time.Instant;

import static org.mockito.Mockito.spy;

/**
 * The engine wired the way the application configuration wires it, over a fixture root.
 * The pool is a Mockito spy so tests can count acquisitions.
 */
public final class TestEngine implements AutoCloseable {

    public final HistoryProperties properties = new HistoryProperties();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final MutableClock clock = new MutableClock(Instant.parse("2024-06-01T00:00:00Z"));
    public final ShardCatalog catalog;
    public final ShardConnectionPool pool;
    public final CrossShardQueryPlanner planner;
    public final RollupResolver rollupResolver;
    public final OptionsChainResolver chainResolver;
    public final ResultCache cache;
    public final HistoryQueryService service;

    public TestEngine(Path root) {
        properties.setPool(TestPools.fastSettings());
        catalog = new ShardCatalog(root, clock);
        catalog.refresh();
        pool = spy(TestPools.newPool(properties.getPool(), meterRegistry));
        planner = new CrossShardQueryPlanner(pool, meterRegistry);
        rollupResolver = new RollupResolver(catalog);
        HistoryProperties.Options options = properties.getOptions();
        SpotPriceResolver spotPriceResolver = new SpotPriceResolver(catalog, planner, options.getSpotLookbackDays());
        chainResolver = new OptionsChainResolver(catalog, planner, spotPriceResolver,
            new ImpliedVolatilitySolver(options.getIvTolerance(), options.getIvMaxIterations()),
            options.getRiskFreeRate(), meterRegistry);
        cache = new ResultCache(properties.getCache().getMaxEntries(), clock, meterRegistry);
        service = new HistoryQueryService(catalog, planner, rollupResolver, chainResolver, cache, properties,
            meterRegistry);
    }

    @Override
    public void close() {
        pool.close();
    }
}
