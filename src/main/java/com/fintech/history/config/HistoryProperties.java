package com.fintech.history.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Externalized configuration for the shard query engine.
 * Maps to 'history.*' properties in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "history")
public class HistoryProperties {

    private Catalog catalog = new Catalog();
    private Pool pool = new Pool();
    private Cache cache = new Cache();
    private Options options = new Options();
    private Storage storage = new Storage();

    @Data
    public static class Catalog {
        private String root = "./data";
        private boolean refreshOnStartup = true;
    }

    @Data
    public static class Pool {
        private int maxConnectionsPerShard = 1;
        private Map<String, Integer> hotShards = new HashMap<>();  // file name -> max connections
        private int maxOpenShards = 64;
        private Duration connectionTimeout = Duration.ofSeconds(5);
        private Duration idleTimeout = Duration.ofSeconds(60);
        private Duration coolDown = Duration.ofSeconds(30);
        private Duration sweepInterval = Duration.ofSeconds(30);

        /** Max live connections for one shard file. */
        public int maxConnectionsFor(String shardId) {
            return hotShards.getOrDefault(shardId, maxConnectionsPerShard);
        }
    }

    @Data
    public static class Cache {
        private int maxEntries = 512;
        private Duration barsTtl = Duration.ofMinutes(5);
        private Duration chainTtl = Duration.ofMinutes(1);
    }

    @Data
    public static class Options {
        private double riskFreeRate = 0.05;
        private int defaultStrikeWindow = 10;
        private int maxStrikeWindow = 100;
        private int spotLookbackDays = 7;
        private double ivTolerance = 1e-6;
        private int ivMaxIterations = 100;
    }

    @Data
    public static class Storage {
        private String credential;  // resolved by property binding, never read by the engine itself
    }
}
