package com.fintech.history.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Latest known quote for one contract. Any price field may be absent.
 * A crossed market (bid above ask) keeps neither side, so {@code bid <= mid <= ask}
 * holds whenever both sides are present.
 */
public record OptionQuote(
    String contractId,
    long timestamp,
    BigDecimal bid,
    BigDecimal ask,
    BigDecimal last,
    Long volume,
    Long openInterest
) {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    public OptionQuote {
        Objects.requireNonNull(contractId, "Contract id cannot be null");
        bid = normalize(bid);
        ask = normalize(ask);
        last = normalize(last);
        if (bid != null && ask != null && bid.compareTo(ask) > 0) {
            bid = null;
            ask = null;
        }
    }

    /**
     * Mid price: (bid + ask) / 2 when both sides are present and non-zero, otherwise last trade.
     */
    public BigDecimal mid() {
        if (hasBothSides()) {
            return bid.add(ask).divide(TWO, Bar.PRICE_SCALE, RoundingMode.HALF_UP);
        }
        return last;
    }

    /** ask - bid, or null when a side is missing. */
    public BigDecimal spread() {
        return hasBothSides() ? ask.subtract(bid) : null;
    }

    public boolean hasBothSides() {
        return bid != null && ask != null && bid.signum() > 0 && ask.signum() > 0;
    }

    private static BigDecimal normalize(BigDecimal price) {
        if (price == null || price.signum() < 0) {
            return null;
        }
        return Bar.scale(price);
    }
}
