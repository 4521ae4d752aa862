package com.fintech.history.options;

import com.fintech.history.domain.OptionType;

/**
 * European option pricing and sensitivities under Black-Scholes without dividends.
 * Theta is per calendar day, vega per volatility point, rho per rate point.
 */
public final class BlackScholesModel {

    public static final double DAYS_PER_YEAR = 365.0;

    // Abramowitz and Stegun 7.1.26, absolute error below 1.5e-7
    private static final double A1 = 0.254829592;
    private static final double A2 = -0.284496736;
    private static final double A3 = 1.421413741;
    private static final double A4 = -1.453152027;
    private static final double A5 = 1.061405429;
    private static final double P = 0.3275911;

    private BlackScholesModel() {
    }

    /**
     * Theoretical price.
     *
     * @param spot underlying price
     * @param strike strike price
     * @param years time to expiry in years, positive
     * @param rate continuously compounded risk-free rate
     * @param volatility annualized volatility, positive
     */
    public static double price(OptionType type, double spot, double strike, double years, double rate, double volatility) {
        double sqrtT = Math.sqrt(years);
        double d1 = d1(spot, strike, years, rate, volatility);
        double d2 = d1 - volatility * sqrtT;
        double discount = Math.exp(-rate * years);
        if (type == OptionType.CALL) {
            return spot * normalCdf(d1) - strike * discount * normalCdf(d2);
        }
        return strike * discount * normalCdf(-d2) - spot * normalCdf(-d1);
    }

    /** dPrice/dVolatility per unit of volatility (not per point). Used by the IV solver. */
    public static double rawVega(double spot, double strike, double years, double rate, double volatility) {
        return spot * normalPdf(d1(spot, strike, years, rate, volatility)) * Math.sqrt(years);
    }

    public static Sensitivities sensitivities(
            OptionType type, double spot, double strike, double years, double rate, double volatility) {
        double sqrtT = Math.sqrt(years);
        double d1 = d1(spot, strike, years, rate, volatility);
        double d2 = d1 - volatility * sqrtT;
        double discount = Math.exp(-rate * years);
        double pdf = normalPdf(d1);

        double gamma = pdf / (spot * volatility * sqrtT);
        double vega = spot * pdf * sqrtT / 100.0;
        double decay = -spot * pdf * volatility / (2 * sqrtT);

        double delta;
        double theta;
        double rho;
        if (type == OptionType.CALL) {
            delta = normalCdf(d1);
            theta = (decay - rate * strike * discount * normalCdf(d2)) / DAYS_PER_YEAR;
            rho = strike * years * discount * normalCdf(d2) / 100.0;
        } else {
            delta = normalCdf(d1) - 1.0;
            theta = (decay + rate * strike * discount * normalCdf(-d2)) / DAYS_PER_YEAR;
            rho = -strike * years * discount * normalCdf(-d2) / 100.0;
        }
        return new Sensitivities(price(type, spot, strike, years, rate, volatility), delta, gamma, theta, vega, rho);
    }

    public static double normalCdf(double x) {
        return 0.5 * (1.0 + erf(x / Math.sqrt(2.0)));
    }

    public static double normalPdf(double x) {
        return Math.exp(-0.5 * x * x) / Math.sqrt(2.0 * Math.PI);
    }

    private static double d1(double spot, double strike, double years, double rate, double volatility) {
        return (Math.log(spot / strike) + (rate + 0.5 * volatility * volatility) * years)
            / (volatility * Math.sqrt(years));
    }

    private static double erf(double x) {
        double sign = x < 0 ? -1.0 : 1.0;
        double ax = Math.abs(x);
        double t = 1.0 / (1.0 + P * ax);
        double y = 1.0 - (((((A5 * t + A4) * t) + A3) * t + A2) * t + A1) * t * Math.exp(-ax * ax);
        return sign * y;
    }

    /**
     * Model output for one set of inputs.
     */
    public record Sensitivities(double price, double delta, double gamma, double theta, double vega, double rho) {
    }
}
