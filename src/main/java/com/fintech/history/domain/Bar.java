package com.fintech.history.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Immutable OHLCV bar as stored in a shard or produced by a rollup.
 * Prices are normalized to {@link #PRICE_SCALE} decimal places so that equal bars compare equal.
 *
 * @param timestamp bar start, epoch millis UTC
 * @param open first price
 * @param high maximum price (must be >= open, close, low)
 * @param low minimum price (must be <= open, close, high)
 * @param close last price
 * @param volume traded volume, never negative
 * @param tradeCount number of trades, null when the source did not record it
 * @param vwap volume-weighted average price, null when unknown
 */
public record Bar(
    long timestamp,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    long volume,
    Long tradeCount,
    BigDecimal vwap
) {

    public static final int PRICE_SCALE = 4;

    /**
     * Validates OHLC invariants: high >= {open,close,low}, low <= {open,close,high}, volume >= 0.
     */
    public Bar {
        Objects.requireNonNull(open, "Open price cannot be null");
        Objects.requireNonNull(high, "High price cannot be null");
        Objects.requireNonNull(low, "Low price cannot be null");
        Objects.requireNonNull(close, "Close price cannot be null");
        open = scale(open);
        high = scale(high);
        low = scale(low);
        close = scale(close);
        vwap = vwap == null ? null : scale(vwap);

        if (high.compareTo(low) < 0) {
            throw new IllegalArgumentException(
                "High price (" + high + ") cannot be less than low price (" + low + ")"
            );
        }
        if (high.compareTo(open) < 0 || high.compareTo(close) < 0) {
            throw new IllegalArgumentException(
                "High price (" + high + ") must be >= open (" + open + ") and close (" + close + ")"
            );
        }
        if (low.compareTo(open) > 0 || low.compareTo(close) > 0) {
            throw new IllegalArgumentException(
                "Low price (" + low + ") must be <= open (" + open + ") and close (" + close + ")"
            );
        }
        if (volume < 0) {
            throw new IllegalArgumentException("Volume (" + volume + ") cannot be negative");
        }
    }

    /** Creates a bar without trade count or vwap. */
    public static Bar of(long timestamp, double open, double high, double low, double close, long volume) {
        return new Bar(timestamp, BigDecimal.valueOf(open), BigDecimal.valueOf(high),
            BigDecimal.valueOf(low), BigDecimal.valueOf(close), volume, null, null);
    }

    public static BigDecimal scale(BigDecimal price) {
        return price.setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }

    /** Returns price range (high - low). */
    public BigDecimal range() {
        return high.subtract(low);
    }
}
