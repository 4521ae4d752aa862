package com.fintech.history.catalog;

import com.fintech.history.domain.Category;
import com.fintech.history.domain.Granularity;
import com.fintech.history.domain.ShardDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives shard coverage from the partition naming scheme.
 *
 * <pre>
 * {category}_{symbol}_{yyyy}.db                  one year, 1m
 * {category}_{symbol}_{yyyy}_{gran}.db           one year, native gran
 * {category}_{symbol}_{yyyy}_{yyyy}_{gran}.db    inclusive year span
 * {category}_{symbol}_{yyyy}_{MM}[_{gran}].db    one month (the options layout)
 * </pre>
 */
public final class ShardFileNameParser {

    private static final Logger log = LoggerFactory.getLogger(ShardFileNameParser.class);

    private static final Pattern SHARD_NAME = Pattern.compile(
        "^(indices|options|etfs|stocks)_([A-Za-z0-9.\\-]+?)_(\\d{4})(?:_(\\d{2}|\\d{4}))?(?:_([0-9]+[a-z]+|tick))?\\.db$");

    private ShardFileNameParser() {
    }

    /**
     * @return the descriptor, or empty if the name does not follow the scheme or names an unsupported granularity
     */
    public static Optional<ShardDescriptor> parse(Path file, long sizeBytes) {
        String name = file.getFileName().toString();
        Matcher m = SHARD_NAME.matcher(name);
        if (!m.matches()) {
            log.debug("Skipping file outside naming scheme: {}", name);
            return Optional.empty();
        }

        Category category = Category.parse(m.group(1));
        String symbol = m.group(2).toUpperCase(Locale.ROOT);
        int year = Integer.parseInt(m.group(3));
        String period = m.group(4);
        String gran = m.group(5);

        LocalDate start;
        LocalDate end;
        if (period == null) {
            start = LocalDate.of(year, 1, 1);
            end = LocalDate.of(year, 12, 31);
        } else if (period.length() == 2) {
            int month = Integer.parseInt(period);
            if (month < 1 || month > 12) {
                log.debug("Skipping shard with invalid month: {}", name);
                return Optional.empty();
            }
            YearMonth ym = YearMonth.of(year, month);
            start = ym.atDay(1);
            end = ym.atEndOfMonth();
        } else {
            int endYear = Integer.parseInt(period);
            if (endYear < year) {
                log.debug("Skipping shard with inverted year span: {}", name);
                return Optional.empty();
            }
            start = LocalDate.of(year, 1, 1);
            end = LocalDate.of(endYear, 12, 31);
        }

        Granularity granularity;
        try {
            granularity = gran == null ? Granularity.M1 : Granularity.parse(gran);
        } catch (IllegalArgumentException e) {
            log.debug("Skipping shard with unsupported granularity '{}': {}", gran, name);
            return Optional.empty();
        }

        return Optional.of(new ShardDescriptor(name, category, symbol, start, end, granularity, file, sizeBytes));
    }
}
