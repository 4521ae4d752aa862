package com.fintech.history.domain;

import java.math.BigDecimal;
import java.util.Locale;

public enum OptionType {

    CALL('C'),
    PUT('P');

    private final char code;

    OptionType(char code) {
        this.code = code;
    }

    /** OCC type letter. */
    public char code() {
        return code;
    }

    /** Intrinsic value: max(spot - strike, 0) for calls, max(strike - spot, 0) for puts. */
    public BigDecimal intrinsic(BigDecimal spot, BigDecimal strike) {
        BigDecimal value = this == CALL ? spot.subtract(strike) : strike.subtract(spot);
        return value.signum() > 0 ? value : BigDecimal.ZERO;
    }

    /**
     * Accepts "C", "P", "CALL", "PUT" in any case.
     */
    public static OptionType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Option type cannot be null or blank");
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "C", "CALL" -> CALL;
            case "P", "PUT" -> PUT;
            default -> throw new IllegalArgumentException("Unsupported option type: " + value);
        };
    }
}
