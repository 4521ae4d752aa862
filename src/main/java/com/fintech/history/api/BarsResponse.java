package com.fintech.history.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fintech.history.domain.Bar;
import com.fintech.history.domain.BarQueryResult;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Columnar bar response compatible with TradingView Lightweight Charts, extended with
 * coverage metadata.
 *
 * Example response:
 * {
 *   "s": "ok",
 *   "t": [1704067200, 1704067260],
 *   "o": [4745.5, 4746.0],
 *   "h": [4747.0, 4748.25],
 *   "l": [4744.75, 4745.5],
 *   "c": [4746.0, 4747.5],
 *   "v": [0, 0],
 *   "granularity": "1m",
 *   "sourceGranularity": "1m",
 *   "partial": false,
 *   "shards": ["indices_SPX_2024.db"],
 *   "unavailableShards": []
 * }
 */
public record BarsResponse(
    @JsonProperty("s") String status,
    @JsonProperty("t") List<Long> time,
    @JsonProperty("o") List<BigDecimal> open,
    @JsonProperty("h") List<BigDecimal> high,
    @JsonProperty("l") List<BigDecimal> low,
    @JsonProperty("c") List<BigDecimal> close,
    @JsonProperty("v") List<Long> volume,
    String granularity,
    String sourceGranularity,
    boolean partial,
    List<String> shards,
    List<String> unavailableShards
) {

    /**
     * Creates a response from a query result. Timestamps are converted to Unix seconds.
     */
    public static BarsResponse fromResult(BarQueryResult result) {
        List<Bar> bars = result.bars();
        int size = bars.size();

        List<Long> time = new ArrayList<>(size);
        List<BigDecimal> open = new ArrayList<>(size);
        List<BigDecimal> high = new ArrayList<>(size);
        List<BigDecimal> low = new ArrayList<>(size);
        List<BigDecimal> close = new ArrayList<>(size);
        List<Long> volume = new ArrayList<>(size);

        for (Bar bar : bars) {
            time.add(bar.timestamp() / 1000);
            open.add(bar.open());
            high.add(bar.high());
            low.add(bar.low());
            close.add(bar.close());
            volume.add(bar.volume());
        }

        return new BarsResponse(
            size == 0 ? "no_data" : "ok",
            time, open, high, low, close, volume,
            result.granularity().canonical(),
            result.sourceGranularity().canonical(),
            result.partialCoverage(),
            result.shards(),
            result.unavailableShards());
    }
}
