package com.fintech.history.rollup;

import com.fintech.history.catalog.ShardCatalog;
import com.fintech.history.domain.Bar;
import com.fintech.history.domain.Category;
import com.fintech.history.domain.CoverageReport;
import com.fintech.history.domain.Granularity;
import com.fintech.history.domain.TimeRange;
import com.fintech.history.exception.InvalidRangeException;
import com.fintech.history.exception.ShardNotFoundException;
import com.fintech.history.exception.UnsupportedGranularityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Derives coarser bars from finer stored ones.
 *
 * <p>Buckets are epoch-aligned windows of the target width (daily buckets start at UTC midnight).
 * Aggregation is a single forward pass over timestamp-ordered input holding one bucket at a time;
 * buckets without input bars are never emitted.
 */
public class RollupResolver {

    private static final Logger log = LoggerFactory.getLogger(RollupResolver.class);

    private final ShardCatalog catalog;

    public RollupResolver(ShardCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Splits the range into segments, each read from one stored granularity. Parts covered at the target
     * width are read as stored; what remains is filled from the finest dividing width covering it, then
     * the next finest, and so on. Segment edges fall on shard coverage edges, which are UTC midnights, so
     * no target bucket straddles two segments.
     *
     * @return disjoint segments in ascending time order; parts no usable width covers are left out
     * @throws ShardNotFoundException if the symbol has no shards
     * @throws UnsupportedGranularityException if no stored width can produce the target
     * @throws InvalidRangeException if no usable width has coverage in the range
     */
    public List<SourceSegment> planSources(Category category, String symbol, Granularity target, TimeRange range) {
        Set<Granularity> usable = usableSources(category, symbol, target);

        List<Granularity> preference = new ArrayList<>(usable.size());
        if (usable.contains(target)) {
            preference.add(target);
        }
        usable.stream().filter(g -> g != target).forEach(preference::add);

        List<SourceSegment> segments = new ArrayList<>();
        List<TimeRange> missing = List.of(range);
        for (Granularity candidate : preference) {
            List<TimeRange> stillMissing = new ArrayList<>();
            for (TimeRange gap : missing) {
                CoverageReport report = catalog.coverage(category, symbol, candidate, gap);
                report.covered().forEach(covered -> segments.add(new SourceSegment(candidate, covered)));
                stillMissing.addAll(report.gaps());
            }
            missing = stillMissing;
            if (missing.isEmpty()) {
                break;
            }
        }

        if (segments.isEmpty()) {
            throw outsideCoverage(category, symbol, range, usable);
        }
        segments.sort(Comparator.comparingLong(segment -> segment.range().startMillis()));
        if (segments.size() > 1) {
            log.debug("Reading {} {} at {} from {} segment(s): {}", category.prefix(), symbol, target.canonical(),
                segments.size(), segments);
        }
        return segments;
    }

    /**
     * Lazily re-buckets timestamp-ordered bars into the target width.
     * The returned stream closes the source stream when closed.
     */
    public Stream<Bar> rollup(Stream<Bar> source, Granularity target) {
        Iterator<Bar> buckets = new BucketIterator(source.iterator(), target);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(buckets, Spliterator.ORDERED | Spliterator.NONNULL), false)
            .onClose(source::close);
    }

    private Set<Granularity> usableSources(Category category, String symbol, Granularity target) {
        Set<Granularity> stored = catalog.granularities(category, symbol);
        if (stored.isEmpty()) {
            throw new ShardNotFoundException(String.format("No shards for %s %s", category.prefix(), symbol));
        }

        // EnumSet iterates finest first; the target sorts after every width that divides it
        Set<Granularity> usable = stored.stream()
            .filter(g -> g == target || g.divides(target))
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(Granularity.class)));
        if (usable.isEmpty()) {
            throw new UnsupportedGranularityException(String.format(
                "Cannot derive %s bars for %s %s from stored granularities %s",
                target.canonical(), category.prefix(), symbol, canonical(stored)));
        }
        return usable;
    }

    private static InvalidRangeException outsideCoverage(
            Category category, String symbol, TimeRange range, Set<Granularity> usable) {
        return new InvalidRangeException(InvalidRangeException.Reason.OUTSIDE_COVERAGE, String.format(
            "Range %s lies outside the coverage of %s %s at %s", range, category.prefix(), symbol, canonical(usable)));
    }

    private static String canonical(Set<Granularity> granularities) {
        return granularities.stream().map(Granularity::canonical).collect(Collectors.joining(", ", "[", "]"));
    }

    private static final class BucketIterator implements Iterator<Bar> {

        private final Iterator<Bar> source;
        private final Granularity target;
        private BarAccumulator current;

        BucketIterator(Iterator<Bar> source, Granularity target) {
            this.source = source;
            this.target = target;
        }

        @Override
        public boolean hasNext() {
            return current != null || source.hasNext();
        }

        @Override
        public Bar next() {
            while (source.hasNext()) {
                Bar bar = source.next();
                long bucket = target.alignTimestamp(bar.timestamp());
                if (current == null) {
                    current = new BarAccumulator(bucket, bar);
                } else if (current.bucketStart == bucket) {
                    current.update(bar);
                } else {
                    Bar completed = current.toBar();
                    current = new BarAccumulator(bucket, bar);
                    return completed;
                }
            }
            if (current == null) {
                throw new NoSuchElementException();
            }
            Bar last = current.toBar();
            current = null;
            return last;
        }
    }
}
