package com.fintech.history.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fintech.history.domain.ChainEntry;
import com.fintech.history.domain.ChainResult;
import com.fintech.history.domain.Greeks;
import com.fintech.history.domain.OptionQuote;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Option chain around the money with one row per contract.
 */
public record ChainResponse(
    String underlying,
    LocalDate date,
    LocalDate expiry,
    BigDecimal spot,
    BigDecimal atmStrike,
    int strikeWindow,
    boolean partial,
    List<String> shards,
    List<String> unavailableShards,
    List<Row> contracts
) {

    public static ChainResponse fromResult(ChainResult result) {
        return new ChainResponse(
            result.underlying(),
            result.date(),
            result.expiry(),
            result.spot(),
            result.atmStrike(),
            result.strikeWindow(),
            result.partialCoverage(),
            result.shards(),
            result.unavailableShards(),
            result.entries().stream().map(Row::fromEntry).collect(Collectors.toList()));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Row(
        String contract,
        String type,
        BigDecimal strike,
        LocalDate expiry,
        int multiplier,
        String style,
        BigDecimal bid,
        BigDecimal ask,
        BigDecimal last,
        BigDecimal mid,
        Long volume,
        Long openInterest,
        Long quoteTime,
        BigDecimal intrinsic,
        boolean belowIntrinsic,
        Double iv,
        Double delta,
        Double gamma,
        Double theta,
        Double vega,
        Double rho,
        String ivSource,
        String status,
        String message
    ) {

        static Row fromEntry(ChainEntry entry) {
            OptionQuote quote = entry.quote();
            Greeks greeks = entry.greeks();
            return new Row(
                entry.contract().contractId(),
                entry.contract().type().name(),
                entry.contract().strike(),
                entry.contract().expiry(),
                entry.contract().multiplier(),
                entry.contract().style().name(),
                quote != null ? quote.bid() : null,
                quote != null ? quote.ask() : null,
                quote != null ? quote.last() : null,
                quote != null ? quote.mid() : null,
                quote != null ? quote.volume() : null,
                quote != null ? quote.openInterest() : null,
                quote != null ? quote.timestamp() : null,
                entry.intrinsic(),
                entry.belowIntrinsic(),
                greeks != null ? greeks.impliedVolatility() : null,
                greeks != null ? greeks.delta() : null,
                greeks != null ? greeks.gamma() : null,
                greeks != null ? greeks.theta() : null,
                greeks != null ? greeks.vega() : null,
                greeks != null ? greeks.rho() : null,
                greeks != null ? greeks.source().name() : null,
                entry.status().name(),
                entry.message());
        }
    }
}
