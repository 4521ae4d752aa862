package com.fintech.history.rollup;

import com.fintech.history.domain.Bar;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Mutable state of the one bucket a rollup is currently filling.
 * Open and close come from the earliest and latest timestamps seen, so the result does not depend
 * on arrival order within the bucket.
 */
final class BarAccumulator {

    /** Bucket start timestamp */
    final long bucketStart;

    private final Bar first;
    private int count;

    private long openTimestamp;
    private BigDecimal open;
    private long closeTimestamp;
    private BigDecimal close;
    private BigDecimal high;
    private BigDecimal low;
    private long volume;

    /** Null until a bar with a trade count arrives */
    private Long tradeCount;

    /** Running sum of volume * vwap over bars that carry a vwap */
    private BigDecimal vwapNotional = BigDecimal.ZERO;
    private long vwapVolume;

    BarAccumulator(long bucketStart, Bar initial) {
        this.bucketStart = bucketStart;
        this.first = initial;
        this.openTimestamp = initial.timestamp();
        this.open = initial.open();
        this.closeTimestamp = initial.timestamp();
        this.close = initial.close();
        this.high = initial.high();
        this.low = initial.low();
        addTotals(initial);
    }

    void update(Bar bar) {
        if (bar.timestamp() < openTimestamp) {
            openTimestamp = bar.timestamp();
            open = bar.open();
        }
        if (bar.timestamp() >= closeTimestamp) {
            closeTimestamp = bar.timestamp();
            close = bar.close();
        }
        high = high.max(bar.high());
        low = low.min(bar.low());
        addTotals(bar);
    }

    /**
     * Returns the bucket's bar. A bucket holding a single bar already stamped at the bucket start
     * is returned unchanged, so re-bucketing at the same width is the identity.
     */
    Bar toBar() {
        if (count == 1 && first.timestamp() == bucketStart) {
            return first;
        }
        BigDecimal vwap = vwapVolume > 0
            ? vwapNotional.divide(BigDecimal.valueOf(vwapVolume), MathContext.DECIMAL64)
            : null;
        return new Bar(bucketStart, open, high, low, close, volume, tradeCount, vwap);
    }

    private void addTotals(Bar bar) {
        count++;
        volume += bar.volume();
        if (bar.tradeCount() != null) {
            tradeCount = (tradeCount == null ? 0L : tradeCount) + bar.tradeCount();
        }
        if (bar.vwap() != null && bar.volume() > 0) {
            vwapNotional = vwapNotional.add(bar.vwap().multiply(BigDecimal.valueOf(bar.volume())));
            vwapVolume += bar.volume();
        }
    }
}
