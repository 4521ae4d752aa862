package com.fintech.history.options;

import com.fintech.history.domain.OptionType;
import com.fintech.history.exception.IvConvergenceException;

/**
 * Inverts {@link BlackScholesModel#price} for volatility.
 *
 * <p>Newton-Raphson from an initial guess of 0.2, falling back to bisection over
 * [{@value #MIN_VOLATILITY}, {@value #MAX_VOLATILITY}] when vega vanishes or Newton leaves the bracket.
 * Both loops are bounded by the iteration cap.
 */
public class ImpliedVolatilitySolver {

    static final double MIN_VOLATILITY = 1e-4;
    static final double MAX_VOLATILITY = 5.0;
    private static final double INITIAL_GUESS = 0.2;
    private static final double MIN_VEGA = 1e-8;

    private final double tolerance;
    private final int maxIterations;

    /**
     * @param tolerance absolute price error accepted as converged
     * @param maxIterations cap for each of the Newton and bisection loops
     */
    public ImpliedVolatilitySolver(double tolerance, int maxIterations) {
        if (tolerance <= 0) {
            throw new IllegalArgumentException("Tolerance must be positive");
        }
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("Max iterations must be positive");
        }
        this.tolerance = tolerance;
        this.maxIterations = maxIterations;
    }

    /**
     * @throws IvConvergenceException if the price lies outside the no-arbitrage bounds or
     *                                neither loop converges
     */
    public double solve(OptionType type, double price, double spot, double strike, double years, double rate) {
        if (!(price > 0) || !(spot > 0) || !(strike > 0) || !(years > 0)) {
            throw new IvConvergenceException(String.format(
                "Invalid inputs: price=%s spot=%s strike=%s years=%s", price, spot, strike, years));
        }

        double lower = BlackScholesModel.price(type, spot, strike, years, rate, MIN_VOLATILITY);
        double upper = BlackScholesModel.price(type, spot, strike, years, rate, MAX_VOLATILITY);
        if (price < lower - tolerance || price > upper + tolerance) {
            throw new IvConvergenceException(String.format(
                "Price %.4f outside attainable range [%.4f, %.4f]", price, lower, upper));
        }

        double sigma = INITIAL_GUESS;
        for (int i = 0; i < maxIterations; i++) {
            double diff = BlackScholesModel.price(type, spot, strike, years, rate, sigma) - price;
            if (Math.abs(diff) < tolerance) {
                return sigma;
            }
            double vega = BlackScholesModel.rawVega(spot, strike, years, rate, sigma);
            if (vega < MIN_VEGA) {
                break;
            }
            double next = sigma - diff / vega;
            if (!(next > MIN_VOLATILITY) || !(next < MAX_VOLATILITY)) {
                break;
            }
            sigma = next;
        }
        return bisect(type, price, spot, strike, years, rate);
    }

    private double bisect(OptionType type, double price, double spot, double strike, double years, double rate) {
        double low = MIN_VOLATILITY;
        double high = MAX_VOLATILITY;
        for (int i = 0; i < maxIterations; i++) {
            double mid = 0.5 * (low + high);
            double diff = BlackScholesModel.price(type, spot, strike, years, rate, mid) - price;
            if (Math.abs(diff) < tolerance || (high - low) < 1e-10) {
                return mid;
            }
            // price is increasing in volatility
            if (diff > 0) {
                high = mid;
            } else {
                low = mid;
            }
        }
        throw new IvConvergenceException(String.format(
            "Implied volatility did not converge within %d iterations (price=%.4f, strike=%.4f)",
            maxIterations, price, strike));
    }
}
