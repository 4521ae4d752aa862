package com.fintech.history.options;

import com.fintech.history.domain.ExerciseStyle;
import com.fintech.history.domain.OccSymbol;
import com.fintech.history.domain.OptionContract;
import com.fintech.history.domain.OptionQuote;
import com.fintech.history.domain.OptionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * SQL access to one monthly options shard: listed contracts, last trade and quote sides,
 * and precomputed implied volatility.
 */
class OptionShardReader {

    private static final Logger log = LoggerFactory.getLogger(OptionShardReader.class);

    static final String CONTRACTS_QUERY =
        "SELECT contract, underlying, option_type, strike_price, expiration_date, exercise_style, shares_per_contract "
            + "FROM contracts_meta WHERE upper(underlying) = ? AND expiration_date >= ? ORDER BY expiration_date, strike_price";
    static final String LAST_TRADE_QUERY =
        "SELECT ts, c, v, oi FROM op_aggs WHERE contract = ? AND ts < ? ORDER BY ts DESC LIMIT 1";
    static final String QUOTE_QUERY =
        "SELECT ts, iv, bid, ask FROM op_iv_greeks WHERE contract = ? AND ts < ? ORDER BY ts DESC LIMIT 1";
    private static final String TABLE_EXISTS =
        "SELECT 1 FROM sqlite_master WHERE type = 'table' AND name = ?";

    /**
     * Contracts of the underlying expiring on or after {@code from}. Malformed rows are skipped.
     */
    List<OptionContract> contracts(Connection connection, String underlying, LocalDate from) throws SQLException {
        List<OptionContract> contracts = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement(CONTRACTS_QUERY)) {
            statement.setString(1, underlying.toUpperCase(Locale.ROOT));
            statement.setString(2, from.toString());
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    String contractId = rs.getString("contract");
                    try {
                        contracts.add(mapContract(rs, contractId));
                    } catch (IllegalArgumentException | DateTimeParseException e) {
                        log.warn("Skipping malformed contract {}: {}", contractId, e.getMessage());
                    }
                }
            }
        }
        return contracts;
    }

    /**
     * Latest last-trade and quote rows strictly before {@code endMillis}, merged into one quote.
     *
     * @return empty when neither table has a row for the contract
     */
    Optional<QuoteSnapshot> latestQuote(Connection connection, String contractId, long endMillis) throws SQLException {
        Long tradeTs = null;
        BigDecimal last = null;
        Long volume = null;
        Long openInterest = null;
        if (hasTable(connection, "op_aggs")) {
            try (PreparedStatement statement = connection.prepareStatement(LAST_TRADE_QUERY)) {
                statement.setString(1, contractId);
                statement.setLong(2, endMillis);
                try (ResultSet rs = statement.executeQuery()) {
                    if (rs.next()) {
                        tradeTs = rs.getLong("ts");
                        last = decimal(rs, "c");
                        volume = longOrNull(rs, "v");
                        openInterest = longOrNull(rs, "oi");
                    }
                }
            }
        }

        Long quoteTs = null;
        BigDecimal bid = null;
        BigDecimal ask = null;
        Double storedIv = null;
        if (hasTable(connection, "op_iv_greeks")) {
            try (PreparedStatement statement = connection.prepareStatement(QUOTE_QUERY)) {
                statement.setString(1, contractId);
                statement.setLong(2, endMillis);
                try (ResultSet rs = statement.executeQuery()) {
                    if (rs.next()) {
                        quoteTs = rs.getLong("ts");
                        double iv = rs.getDouble("iv");
                        storedIv = rs.wasNull() ? null : iv;
                        bid = decimal(rs, "bid");
                        ask = decimal(rs, "ask");
                    }
                }
            }
        }

        if (tradeTs == null && quoteTs == null) {
            return Optional.empty();
        }
        long ts = Math.max(tradeTs == null ? Long.MIN_VALUE : tradeTs, quoteTs == null ? Long.MIN_VALUE : quoteTs);
        OptionQuote quote = new OptionQuote(contractId, ts, bid, ask, last, volume, openInterest);
        return Optional.of(new QuoteSnapshot(quote, storedIv));
    }

    boolean hasTable(Connection connection, String table) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(TABLE_EXISTS)) {
            statement.setString(1, table);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next();
            }
        }
    }

    private static OptionContract mapContract(ResultSet rs, String contractId) throws SQLException {
        OccSymbol occ = OccSymbol.parse(contractId);
        String typeColumn = rs.getString("option_type");
        OptionType type = typeColumn == null ? occ.type() : OptionType.parse(typeColumn);
        double strikeColumn = rs.getDouble("strike_price");
        BigDecimal strike = rs.wasNull() ? occ.strike() : OccSymbol.normalizeStrike(BigDecimal.valueOf(strikeColumn));
        String expiryColumn = rs.getString("expiration_date");
        LocalDate expiry = expiryColumn == null ? occ.expiry() : LocalDate.parse(expiryColumn);
        int multiplier = rs.getInt("shares_per_contract");
        if (rs.wasNull() || multiplier <= 0) {
            multiplier = OptionContract.DEFAULT_MULTIPLIER;
        }
        return new OptionContract(contractId, rs.getString("underlying").toUpperCase(Locale.ROOT), expiry, strike,
            type, multiplier, ExerciseStyle.parseOrDefault(rs.getString("exercise_style")));
    }

    private static BigDecimal decimal(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : BigDecimal.valueOf(value);
    }

    private static Long longOrNull(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    /**
     * @param quote merged quote
     * @param storedIv implied volatility precomputed in the shard, null when absent
     */
    record QuoteSnapshot(OptionQuote quote, Double storedIv) {
    }
}
