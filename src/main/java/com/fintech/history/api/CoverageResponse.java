package com.fintech.history.api;

import com.fintech.history.domain.CoverageReport;
import com.fintech.history.domain.TimeRange;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Covered intervals and gaps for one symbol and granularity, as half-open instant ranges.
 */
public record CoverageResponse(
    String category,
    String symbol,
    String granularity,
    Interval range,
    boolean complete,
    List<Interval> covered,
    List<Interval> gaps
) {

    public static CoverageResponse fromReport(CoverageReport report) {
        return new CoverageResponse(
            report.category().prefix(),
            report.symbol(),
            report.granularity().canonical(),
            Interval.of(report.range()),
            report.complete(),
            report.covered().stream().map(Interval::of).collect(Collectors.toList()),
            report.gaps().stream().map(Interval::of).collect(Collectors.toList()));
    }

    public record Interval(Instant from, Instant to) {

        static Interval of(TimeRange range) {
            return new Interval(Instant.ofEpochMilli(range.startMillis()), Instant.ofEpochMilli(range.endMillis()));
        }
    }
}
