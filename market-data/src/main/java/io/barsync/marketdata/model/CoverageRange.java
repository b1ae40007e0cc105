package io.barsync.marketdata.model;

import java.time.Instant;

/**
 * Closed interval [start, end] of epoch seconds for which the upstream has been queried successfully.
 */
public record CoverageRange(long start, long end) implements Comparable<CoverageRange> {

    public CoverageRange {
        if (start > end) throw new IllegalArgumentException("start " + start + " is after end " + end);
    }

    public boolean contains(long ts) { return ts >= start && ts <= end; }

    public boolean overlaps(CoverageRange other) { return start <= other.end && other.start <= end; }

    public boolean encloses(CoverageRange other) { return start <= other.start && other.end <= end; }

    @Override
    public int compareTo(CoverageRange o) {
        int c = Long.compare(start, o.start);
        return c != 0 ? c : Long.compare(end, o.end);
    }

    @Override
    public String toString() { return "[" + Instant.ofEpochSecond(start) + ", " + Instant.ofEpochSecond(end) + "]"; }
}
