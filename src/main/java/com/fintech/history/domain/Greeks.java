package com.fintech.history.domain;

/**
 * Black-Scholes sensitivities for one contract at one point in time.
 *
 * @param contractId contract the values belong to
 * @param timestamp quote time the values were computed for
 * @param impliedVolatility annualized volatility, e.g. 0.18
 * @param delta price change per 1.00 move in the underlying
 * @param gamma delta change per 1.00 move in the underlying
 * @param theta price change per calendar day
 * @param vega price change per 1 volatility point
 * @param rho price change per 1 rate point
 * @param referencePrice option price the volatility was taken from
 * @param source whether the volatility was stored in the shard or solved here
 */
public record Greeks(
    String contractId,
    long timestamp,
    double impliedVolatility,
    double delta,
    double gamma,
    double theta,
    double vega,
    double rho,
    double referencePrice,
    Source source
) {

    public enum Source {
        STORED,
        SOLVED
    }
}
