package com.fintech.history.rollup;

import com.fintech.history.domain.Granularity;
import com.fintech.history.domain.TimeRange;

/**
 * Part of a requested range served from one stored granularity.
 */
public record SourceSegment(Granularity granularity, TimeRange range) {
}
