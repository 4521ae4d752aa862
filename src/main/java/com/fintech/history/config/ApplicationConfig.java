package com.fintech.history.config;

import com.fintech.history.cache.ResultCache;
import com.fintech.history.catalog.ShardCatalog;
import com.fintech.history.options.ImpliedVolatilitySolver;
import com.fintech.history.options.OptionsChainResolver;
import com.fintech.history.options.SpotPriceResolver;
import com.fintech.history.query.CrossShardQueryPlanner;
import com.fintech.history.rollup.RollupResolver;
import com.fintech.history.service.HistoryQueryService;
import com.fintech.history.storage.ShardConnectionPool;
import com.fintech.history.storage.ShardCredential;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Spring configuration for core application beans.
 * The engine classes carry no framework annotations; everything is wired here.
 */
@Configuration
public class ApplicationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ShardCatalog shardCatalog(HistoryProperties properties, Clock clock) {
        ShardCatalog catalog = new ShardCatalog(Path.of(properties.getCatalog().getRoot()), clock);
        if (properties.getCatalog().isRefreshOnStartup()) {
            catalog.refresh();
        }
        return catalog;
    }

    /**
     * One breaker per shard file: a single failed open trips it, and it admits one trial open
     * after the cool-down.
     */
    @Bean
    public CircuitBreakerRegistry shardCircuitBreakerRegistry(HistoryProperties properties) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(1)
            .minimumNumberOfCalls(1)
            .failureRateThreshold(100)
            .waitDurationInOpenState(properties.getPool().getCoolDown())
            .permittedNumberOfCallsInHalfOpenState(1)
            .build();
        return CircuitBreakerRegistry.of(config);
    }

    @Bean
    public ShardCredential shardCredential(HistoryProperties properties) {
        String secret = properties.getStorage().getCredential();
        return secret == null || secret.isEmpty() ? ShardCredential.none() : ShardCredential.of(secret);
    }

    @Bean
    public ShardConnectionPool shardConnectionPool(
            HistoryProperties properties,
            ShardCredential credential,
            CircuitBreakerRegistry shardCircuitBreakerRegistry,
            MeterRegistry meterRegistry) {
        return new ShardConnectionPool(properties.getPool(), credential, shardCircuitBreakerRegistry, meterRegistry);
    }

    @Bean
    public CrossShardQueryPlanner crossShardQueryPlanner(ShardConnectionPool pool, MeterRegistry meterRegistry) {
        return new CrossShardQueryPlanner(pool, meterRegistry);
    }

    @Bean
    public RollupResolver rollupResolver(ShardCatalog catalog) {
        return new RollupResolver(catalog);
    }

    @Bean
    public ImpliedVolatilitySolver impliedVolatilitySolver(HistoryProperties properties) {
        HistoryProperties.Options options = properties.getOptions();
        return new ImpliedVolatilitySolver(options.getIvTolerance(), options.getIvMaxIterations());
    }

    @Bean
    public SpotPriceResolver spotPriceResolver(
            ShardCatalog catalog, CrossShardQueryPlanner planner, HistoryProperties properties) {
        return new SpotPriceResolver(catalog, planner, properties.getOptions().getSpotLookbackDays());
    }

    @Bean
    public OptionsChainResolver optionsChainResolver(
            ShardCatalog catalog,
            CrossShardQueryPlanner planner,
            SpotPriceResolver spotPriceResolver,
            ImpliedVolatilitySolver solver,
            HistoryProperties properties,
            MeterRegistry meterRegistry) {
        return new OptionsChainResolver(catalog, planner, spotPriceResolver, solver,
            properties.getOptions().getRiskFreeRate(), meterRegistry);
    }

    @Bean
    public ResultCache resultCache(HistoryProperties properties, Clock clock, MeterRegistry meterRegistry) {
        return new ResultCache(properties.getCache().getMaxEntries(), clock, meterRegistry);
    }

    @Bean
    public HistoryQueryService historyQueryService(
            ShardCatalog catalog,
            CrossShardQueryPlanner planner,
            RollupResolver rollupResolver,
            OptionsChainResolver optionsChainResolver,
            ResultCache resultCache,
            HistoryProperties properties,
            MeterRegistry meterRegistry) {
        return new HistoryQueryService(catalog, planner, rollupResolver, optionsChainResolver, resultCache,
            properties, meterRegistry);
    }
}
