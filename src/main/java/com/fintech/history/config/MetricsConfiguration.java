package com.fintech.history.config;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Metrics configuration for query latency percentiles.
 *
 * APPROACH:
 * - Client-side p50, p95, p99 for every Timer
 * - SLO buckets from 1 ms to 1 s, sized for shard reads rather than in-memory lookups
 * - 60s rotation so percentiles track recent load
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags(
            @Value("${spring.profiles.active:local}") String environment) {
        return registry -> {
            registry.config().commonTags(
                "application", "market-history-query-service",
                "environment", environment
            );

            registry.config().meterFilter(new MeterFilter() {
                @Override
                public DistributionStatisticConfig configure(Meter.Id id, DistributionStatisticConfig config) {
                    if (id.getType() != Meter.Type.TIMER) {
                        return config;
                    }
                    return DistributionStatisticConfig.builder()
                        .percentiles(0.5, 0.95, 0.99)
                        .percentilePrecision(2)
                        // seconds
                        .serviceLevelObjectives(
                            0.001,
                            0.005,
                            0.01,
                            0.05,
                            0.1,
                            0.25,
                            0.5,
                            1.0
                        )
                        .percentilesHistogram(true)
                        .expiry(Duration.ofSeconds(60))
                        .bufferLength(3)
                        .build()
                        .merge(config);
                }
            });
        };
    }
}
