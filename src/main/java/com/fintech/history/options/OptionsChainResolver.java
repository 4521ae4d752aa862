package com.fintech.history.options;

import com.fintech.history.catalog.ShardCatalog;
import com.fintech.history.domain.Category;
import com.fintech.history.domain.ChainEntry;
import com.fintech.history.domain.ChainResult;
import com.fintech.history.domain.Greeks;
import com.fintech.history.domain.OptionContract;
import com.fintech.history.domain.OptionQuote;
import com.fintech.history.domain.OptionType;
import com.fintech.history.domain.ShardDescriptor;
import com.fintech.history.domain.TimeRange;
import com.fintech.history.exception.InvalidRangeException;
import com.fintech.history.exception.IvConvergenceException;
import com.fintech.history.query.CrossShardQueryPlanner;
import com.fintech.history.query.PlanExecution;
import com.fintech.history.storage.ShardLease;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Builds the at-the-money option chain for an underlying on a date.
 *
 * <ol>
 *   <li>resolve spot from the underlying's own bars</li>
 *   <li>list the contracts of the month shard(s) covering the date for the nearest (or requested) expiry</li>
 *   <li>keep {@code strikeWindow} listed strikes either side of the money, per option type</li>
 *   <li>attach each contract's latest quote of the day and its Greeks</li>
 * </ol>
 *
 * A contract whose volatility cannot be solved is reported with a failed status; the chain itself
 * still resolves.
 */
public class OptionsChainResolver {

    private static final Logger log = LoggerFactory.getLogger(OptionsChainResolver.class);

    private final ShardCatalog catalog;
    private final CrossShardQueryPlanner planner;
    private final SpotPriceResolver spotPriceResolver;
    private final ImpliedVolatilitySolver solver;
    private final OptionShardReader reader = new OptionShardReader();
    private final double riskFreeRate;
    private final Counter ivFailures;

    public OptionsChainResolver(
            ShardCatalog catalog,
            CrossShardQueryPlanner planner,
            SpotPriceResolver spotPriceResolver,
            ImpliedVolatilitySolver solver,
            double riskFreeRate,
            MeterRegistry meterRegistry) {
        this.catalog = catalog;
        this.planner = planner;
        this.spotPriceResolver = spotPriceResolver;
        this.solver = solver;
        this.riskFreeRate = riskFreeRate;
        this.ivFailures = meterRegistry.counter("history.options.iv.failures");
    }

    /**
     * @param underlying underlying symbol, e.g. SPX
     * @param date trading date; quotes are the latest before the end of this UTC day
     * @param strikeWindow listed strikes to keep on each side of the at-the-money strike
     * @param expiry expiry to use, or null for the nearest expiry on or after {@code date}
     */
    public ChainResult resolveChain(String underlying, LocalDate date, int strikeWindow, LocalDate expiry) {
        Objects.requireNonNull(underlying, "Underlying cannot be null");
        Objects.requireNonNull(date, "Date cannot be null");
        if (strikeWindow < 0) {
            throw new IllegalArgumentException("Strike window (" + strikeWindow + ") cannot be negative");
        }
        if (expiry != null && expiry.isBefore(date)) {
            throw new IllegalArgumentException("Expiry (" + expiry + ") cannot be before date (" + date + ")");
        }

        BigDecimal spot = spotPriceResolver.resolve(underlying, date);
        TimeRange day = TimeRange.ofDay(date);
        List<ShardDescriptor> shards;
        try {
            shards = catalog.resolve(Category.OPTIONS, underlying, day);
        } catch (InvalidRangeException e) {
            log.debug("Empty chain for {} on {}: {}", underlying, date, e.getMessage());
            return new ChainResult(underlying, date, null, spot, null, strikeWindow, List.of(),
                false, List.of(), List.of());
        }

        try (PlanExecution execution = planner.open(planner.plan(shards, underlying, day))) {
            Map<String, OptionContract> listed = listContracts(execution, underlying, expiry != null ? expiry : date);
            Optional<LocalDate> chosenExpiry = expiry != null
                ? Optional.of(expiry)
                : listed.values().stream().map(OptionContract::expiry).min(Comparator.naturalOrder());

            if (chosenExpiry.isEmpty()) {
                log.info("No listed contracts for {} expiring on or after {}", underlying, date);
                return new ChainResult(underlying, date, null, spot, null, strikeWindow, List.of(),
                    execution.isPartial(), execution.contributingShards(), execution.unavailableShards());
            }

            LocalDate resolvedExpiry = chosenExpiry.get();
            List<OptionContract> atExpiry = listed.values().stream()
                .filter(c -> c.expiry().equals(resolvedExpiry))
                .collect(Collectors.toList());
            BigDecimal atmStrike = nearestStrike(strikes(atExpiry), spot);

            List<ChainEntry> entries = new ArrayList<>();
            for (OptionType type : OptionType.values()) {
                for (OptionContract contract : window(atExpiry, type, spot, strikeWindow)) {
                    OptionShardReader.QuoteSnapshot snapshot = latestQuote(execution, contract, day.endMillis());
                    entries.add(price(contract, snapshot, spot, date));
                }
            }

            log.debug("Resolved chain: underlying={}, date={}, expiry={}, spot={}, atm={}, entries={}",
                underlying, date, resolvedExpiry, spot, atmStrike, entries.size());
            return new ChainResult(underlying, date, resolvedExpiry, spot, atmStrike, strikeWindow, entries,
                execution.isPartial(), execution.contributingShards(), execution.unavailableShards());
        }
    }

    /**
     * Prices one contract against spot. Never throws for pricing problems; they become the entry status.
     */
    ChainEntry price(OptionContract contract, OptionShardReader.QuoteSnapshot snapshot, BigDecimal spot, LocalDate date) {
        BigDecimal intrinsic = contract.type().intrinsic(spot, contract.strike());
        if (snapshot == null) {
            return new ChainEntry(contract, null, null, intrinsic, false, ChainEntry.Status.NO_PRICE,
                "No quote on or before " + date);
        }

        OptionQuote quote = snapshot.quote();
        BigDecimal mid = quote.mid();
        if (mid == null || mid.signum() <= 0) {
            return new ChainEntry(contract, quote, null, intrinsic, false, ChainEntry.Status.NO_PRICE,
                "Quote has no usable price");
        }
        boolean belowIntrinsic = mid.compareTo(intrinsic) < 0;

        double years = yearsToExpiry(date, contract.expiry());
        double s = spot.doubleValue();
        double k = contract.strike().doubleValue();
        double referencePrice = mid.doubleValue();

        double volatility;
        Greeks.Source source;
        if (snapshot.storedIv() != null && snapshot.storedIv() > 0) {
            volatility = snapshot.storedIv();
            source = Greeks.Source.STORED;
        } else {
            try {
                volatility = solver.solve(contract.type(), referencePrice, s, k, years, riskFreeRate);
                source = Greeks.Source.SOLVED;
            } catch (IvConvergenceException e) {
                ivFailures.increment();
                log.debug("IV failed for {}: {}", contract.contractId(), e.getMessage());
                return new ChainEntry(contract, quote, null, intrinsic, belowIntrinsic,
                    ChainEntry.Status.IV_CONVERGENCE_FAILED, e.getMessage());
            }
        }

        BlackScholesModel.Sensitivities sensitivities =
            BlackScholesModel.sensitivities(contract.type(), s, k, years, riskFreeRate, volatility);
        Greeks greeks = new Greeks(contract.contractId(), quote.timestamp(), volatility,
            sensitivities.delta(), sensitivities.gamma(), sensitivities.theta(), sensitivities.vega(),
            sensitivities.rho(), referencePrice, source);
        return new ChainEntry(contract, quote, greeks, intrinsic, belowIntrinsic, ChainEntry.Status.OK, null);
    }

    /** Calendar days to expiry over 365, never less than one day. */
    static double yearsToExpiry(LocalDate date, LocalDate expiry) {
        long days = ChronoUnit.DAYS.between(date, expiry);
        return Math.max(days, 1L) / BlackScholesModel.DAYS_PER_YEAR;
    }

    /** Strike closest to spot; on a tie the lower strike. */
    static BigDecimal nearestStrike(List<BigDecimal> sortedStrikes, BigDecimal spot) {
        BigDecimal best = null;
        BigDecimal bestDistance = null;
        for (BigDecimal strike : sortedStrikes) {
            BigDecimal distance = strike.subtract(spot).abs();
            if (bestDistance == null || distance.compareTo(bestDistance) < 0) {
                best = strike;
                bestDistance = distance;
            }
        }
        return best;
    }

    private List<OptionContract> window(List<OptionContract> contracts, OptionType type, BigDecimal spot, int width) {
        List<OptionContract> ofType = contracts.stream()
            .filter(c -> c.type() == type)
            .sorted(Comparator.comparing(OptionContract::strike))
            .collect(Collectors.toList());
        if (ofType.isEmpty()) {
            return List.of();
        }
        BigDecimal atm = nearestStrike(strikes(ofType), spot);
        int center = 0;
        while (ofType.get(center).strike().compareTo(atm) != 0) {
            center++;
        }
        int from = Math.max(0, center - width);
        int to = Math.min(ofType.size(), center + width + 1);
        return ofType.subList(from, to);
    }

    private static List<BigDecimal> strikes(List<OptionContract> contracts) {
        TreeSet<BigDecimal> strikes = new TreeSet<>();
        contracts.forEach(c -> strikes.add(c.strike()));
        return new ArrayList<>(strikes);
    }

    private Map<String, OptionContract> listContracts(PlanExecution execution, String underlying, LocalDate from) {
        Map<String, OptionContract> listed = new LinkedHashMap<>();
        // precedence order: a later shard's metadata replaces an earlier one's
        for (ShardLease lease : execution.leases()) {
            try {
                reader.contracts(lease.connection(), underlying, from).forEach(c -> listed.put(c.contractId(), c));
            } catch (SQLException e) {
                execution.markUnavailable(lease.shard().id());
                log.warn("Skipping options shard {}: {}", lease.shard().id(), e.getMessage());
            }
        }
        return listed;
    }

    private OptionShardReader.QuoteSnapshot latestQuote(PlanExecution execution, OptionContract contract, long endMillis) {
        OptionShardReader.QuoteSnapshot latest = null;
        for (ShardLease lease : execution.leases()) {
            if (execution.unavailableShards().contains(lease.shard().id())) {
                continue;
            }
            try {
                Optional<OptionShardReader.QuoteSnapshot> found =
                    reader.latestQuote(lease.connection(), contract.contractId(), endMillis);
                if (found.isPresent()
                        && (latest == null || found.get().quote().timestamp() >= latest.quote().timestamp())) {
                    latest = found.get();
                }
            } catch (SQLException e) {
                execution.markUnavailable(lease.shard().id());
                log.warn("Skipping options shard {}: {}", lease.shard().id(), e.getMessage());
            }
        }
        return latest;
    }
}
