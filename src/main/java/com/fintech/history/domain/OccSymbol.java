package com.fintech.history.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * OCC option symbol, e.g. {@code O:SPXW240119C05000000}: root, expiry (yyMMdd),
 * type letter, and strike times 1000 padded to eight digits. The "O:" prefix is optional.
 */
public record OccSymbol(String root, LocalDate expiry, OptionType type, BigDecimal strike) {

    private static final Pattern OCC = Pattern.compile("^(?:O:)?([A-Z]{1,6})(\\d{6})([CP])(\\d{8})$");
    private static final DateTimeFormatter EXPIRY = DateTimeFormatter.ofPattern("yyMMdd");
    private static final BigDecimal STRIKE_FACTOR = BigDecimal.valueOf(1000);

    /**
     * @throws IllegalArgumentException if the id is not a well-formed OCC symbol
     */
    public static OccSymbol parse(String contractId) {
        if (contractId == null) {
            throw new IllegalArgumentException("Contract id cannot be null");
        }
        Matcher m = OCC.matcher(contractId.trim().toUpperCase(Locale.ROOT));
        if (!m.matches()) {
            throw new IllegalArgumentException("Not an OCC option symbol: " + contractId);
        }
        LocalDate expiry;
        try {
            expiry = LocalDate.parse(m.group(2), EXPIRY);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid expiry in option symbol: " + contractId, e);
        }
        BigDecimal strike = normalizeStrike(new BigDecimal(m.group(4)).movePointLeft(3));
        return new OccSymbol(m.group(1), expiry, OptionType.parse(m.group(3)), strike);
    }

    /** Strips trailing zeros without switching to exponent notation: 5000.000 becomes 5000. */
    public static BigDecimal normalizeStrike(BigDecimal strike) {
        BigDecimal stripped = strike.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }

    /** Formats back to the prefixed form. */
    public String format() {
        long strikeThousandths = strike.multiply(STRIKE_FACTOR).longValueExact();
        return String.format("O:%s%s%c%08d", root, expiry.format(EXPIRY), type.code(), strikeThousandths);
    }
}
