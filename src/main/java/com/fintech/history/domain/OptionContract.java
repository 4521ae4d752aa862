package com.fintech.history.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Listed option contract.
 *
 * @param contractId OCC symbol; uniquely determines expiry, strike and type
 * @param underlying underlying symbol, e.g. SPX for SPXW contracts
 * @param expiry expiration date
 * @param strike strike price
 * @param type call or put
 * @param multiplier shares per contract
 * @param style exercise style
 */
public record OptionContract(
    String contractId,
    String underlying,
    LocalDate expiry,
    BigDecimal strike,
    OptionType type,
    int multiplier,
    ExerciseStyle style
) {

    public static final int DEFAULT_MULTIPLIER = 100;

    public OptionContract {
        Objects.requireNonNull(contractId, "Contract id cannot be null");
        Objects.requireNonNull(underlying, "Underlying cannot be null");
        Objects.requireNonNull(expiry, "Expiry cannot be null");
        Objects.requireNonNull(strike, "Strike cannot be null");
        Objects.requireNonNull(type, "Option type cannot be null");
        Objects.requireNonNull(style, "Exercise style cannot be null");
        if (strike.signum() <= 0) {
            throw new IllegalArgumentException("Strike (" + strike + ") must be positive");
        }
        if (multiplier <= 0) {
            throw new IllegalArgumentException("Multiplier (" + multiplier + ") must be positive");
        }
    }

    /**
     * Builds a contract from its OCC id alone, with default multiplier and European style.
     */
    public static OptionContract fromOcc(String contractId, String underlying) {
        OccSymbol occ = OccSymbol.parse(contractId);
        return new OptionContract(contractId, underlying, occ.expiry(), occ.strike(), occ.type(),
            DEFAULT_MULTIPLIER, ExerciseStyle.EUROPEAN);
    }
}
