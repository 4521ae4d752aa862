package com.fintech.history.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Granularity Tests")
class GranularityTest {

    @ParameterizedTest(name = "{0} should have {1} milliseconds")
    @MethodSource("millisProvider")
    @DisplayName("toMillis() should return correct milliseconds for each granularity")
    void testToMillis(Granularity granularity, long expectedMillis) {
        assertThat(granularity.toMillis()).isEqualTo(expectedMillis);
    }

    static Stream<Arguments> millisProvider() {
        return Stream.of(
            Arguments.of(Granularity.M1, 60_000L),
            Arguments.of(Granularity.M5, 300_000L),
            Arguments.of(Granularity.M15, 900_000L),
            Arguments.of(Granularity.M30, 1_800_000L),
            Arguments.of(Granularity.H1, 3_600_000L),
            Arguments.of(Granularity.D1, 86_400_000L)
        );
    }

    @ParameterizedTest(name = "{0}: {1} should align to {2}")
    @MethodSource("alignTimestampProvider")
    @DisplayName("alignTimestamp() should align timestamps to epoch window boundaries")
    void testAlignTimestamp(Granularity granularity, long timestamp, long expectedAligned) {
        assertThat(granularity.alignTimestamp(timestamp)).isEqualTo(expectedAligned);
    }

    static Stream<Arguments> alignTimestampProvider() {
        return Stream.of(
            Arguments.of(Granularity.M1, 90_000L, 60_000L),
            Arguments.of(Granularity.M5, 299_999L, 0L),
            Arguments.of(Granularity.M5, 300_000L, 300_000L),
            Arguments.of(Granularity.H1, 5_400_000L, 3_600_000L),
            // 2024-01-02T14:35:00Z -> 2024-01-02T00:00:00Z
            Arguments.of(Granularity.D1, 1_704_206_100_000L, 1_704_153_600_000L),
            // pre-epoch floors rather than truncating toward zero
            Arguments.of(Granularity.M1, -1L, -60_000L)
        );
    }

    @Test
    @DisplayName("windowEnd() and inSameWindow() should agree on half-open windows")
    void testWindowBoundaries() {
        long start = Granularity.M15.alignTimestamp(1_000_000L);
        long end = Granularity.M15.windowEnd(start);

        assertThat(end - start).isEqualTo(900_000L);
        assertThat(Granularity.M15.inSameWindow(start, end - 1)).isTrue();
        assertThat(Granularity.M15.inSameWindow(start, end)).isFalse();
    }

    @ParameterizedTest(name = "{0} divides {1} = {2}")
    @CsvSource({
        "M1, M5, true",
        "M1, D1, true",
        "M5, M15, true",
        "M15, H1, true",
        "M30, D1, true",
        "M5, M5, false",
        "H1, M5, false",
        "D1, H1, false"
    })
    @DisplayName("divides() should hold only for strictly wider exact multiples")
    void testDivides(Granularity source, Granularity target, boolean expected) {
        assertThat(source.divides(target)).isEqualTo(expected);
    }

    @ParameterizedTest(name = "\"{0}\" parses to {1}")
    @CsvSource({
        "1m, M1",
        "m1, M1",
        "5min, M5",
        "15M, M15",
        "30m, M30",
        "60m, H1",
        "1h, H1",
        "day, D1",
        "' 1d ', D1"
    })
    @DisplayName("parse() should accept canonical forms and aliases")
    void testParse(String value, Granularity expected) {
        assertThat(Granularity.parse(value)).isEqualTo(expected);
        assertThat(Granularity.parse(expected.canonical())).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"7m", "tick", "1w", ""})
    @DisplayName("parse() should reject unsupported granularities")
    void testParseRejects(String value) {
        assertThatThrownBy(() -> Granularity.parse(value))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
