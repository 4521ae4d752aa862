package com.fintech.history.testsupport;

import com.fintech.history.domain.Bar;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes small SQLite shard files for tests, laid out as {root}/{category}/{file}.db.
 */
public final class ShardFixtures {

    private static final String BARS_DDL = """
        CREATE TABLE IF NOT EXISTS bars_eq (
            ticker TEXT NOT NULL, ts INTEGER NOT NULL,
            o REAL, h REAL, l REAL, c REAL, v INTEGER, trades INTEGER, vwap REAL,
            PRIMARY KEY (ticker, ts))
        """;
    private static final String CONTRACTS_DDL = """
        CREATE TABLE IF NOT EXISTS contracts_meta (
            contract TEXT PRIMARY KEY, underlying TEXT, option_type TEXT, strike_price REAL,
            expiration_date TEXT, exercise_style TEXT, shares_per_contract INTEGER)
        """;
    private static final String AGGS_DDL = """
        CREATE TABLE IF NOT EXISTS op_aggs (
            contract TEXT NOT NULL, ts INTEGER NOT NULL,
            o REAL, h REAL, l REAL, c REAL, v INTEGER, oi INTEGER, trades INTEGER,
            PRIMARY KEY (contract, ts))
        """;
    private static final String GREEKS_DDL = """
        CREATE TABLE IF NOT EXISTS op_iv_greeks (
            contract TEXT NOT NULL, ts INTEGER NOT NULL,
            iv REAL, delta REAL, gamma REAL, theta REAL, vega REAL, rho REAL,
            ref_px REAL, mid_px REAL, bid REAL, ask REAL, spread_pct REAL,
            PRIMARY KEY (contract, ts))
        """;

    private final Path root;

    public ShardFixtures(Path root) {
        this.root = root;
    }

    public Path root() {
        return root;
    }

    public static long millis(String isoLocalDateTime) {
        return LocalDateTime.parse(isoLocalDateTime).toInstant(ZoneOffset.UTC).toEpochMilli();
    }

    public static long startOfDay(LocalDate date) {
        return date.atStartOfDay().toInstant(ZoneOffset.UTC).toEpochMilli();
    }

    /**
     * Bars with open=close=price, a 1.00 high/low band and volume 10, one every {@code stepMillis}.
     */
    public static List<Bar> flatBars(long startMillis, long stepMillis, int count, double price) {
        List<Bar> bars = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            bars.add(Bar.of(startMillis + i * stepMillis, price, price + 1.0, price - 1.0, price, 10L));
        }
        return bars;
    }

    public Path barShard(String category, String fileName, String ticker, List<Bar> bars) {
        Path file = fileIn(category, fileName);
        try (Connection connection = open(file)) {
            try (Statement statement = connection.createStatement()) {
                statement.execute(BARS_DDL);
            }
            connection.setAutoCommit(false);
            try (PreparedStatement insert = connection.prepareStatement(
                    "INSERT OR REPLACE INTO bars_eq (ticker, ts, o, h, l, c, v, trades, vwap) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
                for (Bar bar : bars) {
                    insert.setString(1, ticker);
                    insert.setLong(2, bar.timestamp());
                    insert.setDouble(3, bar.open().doubleValue());
                    insert.setDouble(4, bar.high().doubleValue());
                    insert.setDouble(5, bar.low().doubleValue());
                    insert.setDouble(6, bar.close().doubleValue());
                    insert.setLong(7, bar.volume());
                    if (bar.tradeCount() != null) {
                        insert.setLong(8, bar.tradeCount());
                    } else {
                        insert.setNull(8, Types.INTEGER);
                    }
                    if (bar.vwap() != null) {
                        insert.setDouble(9, bar.vwap().doubleValue());
                    } else {
                        insert.setNull(9, Types.REAL);
                    }
                    insert.addBatch();
                }
                insert.executeBatch();
            }
            connection.commit();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to write bar fixture " + file, e);
        }
        return file;
    }

    /**
     * Inserts a raw row, bypassing {@link Bar} validation, to simulate corrupt data.
     */
    public void rawBarRow(Path file, String ticker, long ts, double o, double h, double l, double c, long v) {
        try (Connection connection = open(file);
             PreparedStatement insert = connection.prepareStatement(
                 "INSERT OR REPLACE INTO bars_eq (ticker, ts, o, h, l, c, v) VALUES (?, ?, ?, ?, ?, ?, ?)")) {
            insert.setString(1, ticker);
            insert.setLong(2, ts);
            insert.setDouble(3, o);
            insert.setDouble(4, h);
            insert.setDouble(5, l);
            insert.setDouble(6, c);
            insert.setLong(7, v);
            insert.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to write raw row to " + file, e);
        }
    }

    /** Creates an options shard with the contract table only. */
    public OptionShard optionShard(String fileName) {
        Path file = fileIn("options", fileName);
        try (Connection connection = open(file);
             Statement statement = connection.createStatement()) {
            statement.execute(CONTRACTS_DDL);
            statement.execute(AGGS_DDL);
            statement.execute(GREEKS_DDL);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to write option fixture " + file, e);
        }
        return new OptionShard(file);
    }

    /** A file with the shard naming scheme but garbage content. */
    public Path corruptShard(String category, String fileName) {
        Path file = fileIn(category, fileName);
        try {
            Files.write(file, "this is not a sqlite database, just bytes".repeat(64).getBytes());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return file;
    }

    /** A valid SQLite file with the shard naming scheme but no bar table. */
    public Path foreignShard(String category, String fileName) {
        Path file = fileIn(category, fileName);
        try (Connection connection = open(file);
             Statement statement = connection.createStatement()) {
            statement.execute("CREATE TABLE IF NOT EXISTS unrelated (id INTEGER PRIMARY KEY, note TEXT)");
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to write foreign fixture " + file, e);
        }
        return file;
    }

    private Path fileIn(String category, String fileName) {
        try {
            Path dir = Files.createDirectories(root.resolve(category));
            return dir.resolve(fileName);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static Connection open(Path file) throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + file.toAbsolutePath());
    }

    /**
     * Builder-style writer for one options shard.
     */
    public static final class OptionShard {

        private final Path file;

        OptionShard(Path file) {
            this.file = file;
        }

        public Path file() {
            return file;
        }

        public OptionShard contract(String contract, String underlying, String type, double strike, LocalDate expiry) {
            return execute("INSERT OR REPLACE INTO contracts_meta VALUES (?, ?, ?, ?, ?, ?, ?)",
                contract, underlying, type, strike, expiry.toString(), "EUROPEAN", 100);
        }

        public OptionShard lastTrade(String contract, long ts, double close, long volume, long openInterest) {
            return execute("INSERT OR REPLACE INTO op_aggs (contract, ts, o, h, l, c, v, oi) VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                contract, ts, close, close, close, close, volume, openInterest);
        }

        public OptionShard quote(String contract, long ts, Double iv, double bid, double ask) {
            return execute("INSERT OR REPLACE INTO op_iv_greeks (contract, ts, iv, bid, ask) VALUES (?, ?, ?, ?, ?)",
                contract, ts, iv, bid, ask);
        }

        private OptionShard execute(String sql, Object... values) {
            try (Connection connection = open(file);
                 PreparedStatement statement = connection.prepareStatement(sql)) {
                for (int i = 0; i < values.length; i++) {
                    statement.setObject(i + 1, values[i]);
                }
                statement.executeUpdate();
            } catch (SQLException e) {
                throw new IllegalStateException("Fixture write failed: " + sql, e);
            }
            return this;
        }
    }
}
