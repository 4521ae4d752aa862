package com.fintech.history;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Market History Query Service
 *
 * Read-only query engine over market history stored as SQLite shard files,
 * one file per category, symbol and period.
 *
 * Key Features:
 * - Directory-scanned shard catalog with atomic refresh
 * - Bounded per-shard connection pools with failure cool-down
 * - Cross-shard merges with seam de-duplication
 * - Bar rollup from finer stored granularities
 * - Option chains with Black-Scholes Greeks and implied volatility
 * - TTL/LRU result cache with single-flight computation
 *
 * @since 1.0.0
 */
@SpringBootApplication
@EnableScheduling
public class MarketHistoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketHistoryApplication.class, args);
    }
}
