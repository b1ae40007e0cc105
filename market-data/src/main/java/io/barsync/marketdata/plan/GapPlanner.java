package io.barsync.marketdata.plan;

import io.barsync.marketdata.model.CoverageRange;
import io.barsync.marketdata.model.CoverageRanges;
import io.barsync.marketdata.model.SeriesKey;
import io.barsync.marketdata.store.StorageIntegrityException;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Computes which parts of a requested span are not yet stored, so fetches stay incremental.
 */
public class GapPlanner {
    private final CoverageLookup coverage;

    public GapPlanner(CoverageLookup coverage) { this.coverage = Objects.requireNonNull(coverage, "coverage"); }

    /**
     * Sorted, disjoint, minimal sub-ranges of [start, end] (epoch seconds, inclusive) that have no coverage.
     *
     * @throws StorageIntegrityException when stored coverage ranges overlap or are out of order
     */
    public List<CoverageRange> plan(SeriesKey key, long start, long end) throws IOException {
        if (start > end) throw new IllegalArgumentException("start " + start + " is after end " + end);
        List<CoverageRange> existing = coverage.coverage(key);
        if (!CoverageRanges.isConsistent(existing)) {
            throw new StorageIntegrityException(key, "coverage metadata is overlapping or unsorted: " + existing);
        }
        return CoverageRanges.complement(existing, start, end, key.interval().unitSeconds());
    }

    /** Same as {@link #plan(SeriesKey, long, long)} for whole trading days in the exchange's time zone. */
    public List<CoverageRange> plan(SeriesKey key, LocalDate from, LocalDate to) throws IOException {
        CoverageRange span = TradingCalendar.span(key, from, to);
        return plan(key, span.start(), span.end());
    }
}
