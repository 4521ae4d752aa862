package com.fintech.history.domain;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One contract of a resolved chain.
 *
 * @param contract the listed contract
 * @param quote latest quote on the chain date, null when the shard holds none
 * @param greeks computed sensitivities, null unless status is {@link Status#OK}
 * @param intrinsic intrinsic value against the resolved spot
 * @param belowIntrinsic true when the mid price is below intrinsic value
 * @param status per-contract outcome
 * @param message detail for a non-OK status
 */
public record ChainEntry(
    OptionContract contract,
    OptionQuote quote,
    Greeks greeks,
    BigDecimal intrinsic,
    boolean belowIntrinsic,
    Status status,
    String message
) {

    public enum Status {
        OK,
        NO_PRICE,
        IV_CONVERGENCE_FAILED
    }

    public ChainEntry {
        Objects.requireNonNull(contract, "Contract cannot be null");
        Objects.requireNonNull(intrinsic, "Intrinsic value cannot be null");
        Objects.requireNonNull(status, "Status cannot be null");
    }
}
