package io.barsync.marketdata.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Operations over a dataset's coverage: a sorted list of disjoint ranges.
 */
public final class CoverageRanges {
    private CoverageRanges() {}

    /** Sorted and pairwise disjoint. */
    public static boolean isConsistent(List<CoverageRange> ranges) {
        for (int i = 1; i < ranges.size(); i++) {
            if (ranges.get(i).start() <= ranges.get(i - 1).end()) return false;
        }
        return true;
    }

    public static boolean overlapsAny(List<CoverageRange> ranges, CoverageRange r) {
        for (CoverageRange c : ranges) {
            if (c.overlaps(r)) return true;
        }
        return false;
    }

    public static boolean covers(List<CoverageRange> ranges, long ts) {
        for (CoverageRange c : ranges) {
            if (c.contains(ts)) return true;
        }
        return false;
    }

    /**
     * Adds a range and merges neighbours whose gap is at most one sampling unit.
     */
    public static List<CoverageRange> add(List<CoverageRange> ranges, CoverageRange added, long unitSeconds) {
        List<CoverageRange> all = new ArrayList<>(ranges);
        all.add(added);
        all.sort(null);
        List<CoverageRange> merged = new ArrayList<>();
        CoverageRange current = null;
        for (CoverageRange r : all) {
            if (current == null) {
                current = r;
            } else if (r.start() <= saturatedAdd(current.end(), unitSeconds)) {
                current = new CoverageRange(current.start(), Math.max(current.end(), r.end()));
            } else {
                merged.add(current);
                current = r;
            }
        }
        if (current != null) merged.add(current);
        return List.copyOf(merged);
    }

    /**
     * Parts of [start, end] not covered by {@code coverage}, stepping by one sampling unit at the edges.
     * Coverage must be consistent.
     */
    public static List<CoverageRange> complement(List<CoverageRange> coverage, long start, long end, long unitSeconds) {
        List<CoverageRange> missing = new ArrayList<>();
        long cursor = start;
        for (CoverageRange c : coverage) {
            if (c.end() < cursor) continue;
            if (c.start() > end) break;
            if (c.start() > cursor) {
                long gapEnd = Math.min(c.start() - unitSeconds, end);
                if (gapEnd >= cursor) missing.add(new CoverageRange(cursor, gapEnd));
            }
            cursor = saturatedAdd(c.end(), unitSeconds);
            if (cursor > end) return List.copyOf(missing);
        }
        missing.add(new CoverageRange(cursor, end));
        return List.copyOf(missing);
    }

    public static long span(List<CoverageRange> ranges) {
        long total = 0;
        for (CoverageRange r : ranges) total += r.end() - r.start();
        return total;
    }

    private static long saturatedAdd(long a, long b) {
        long r = a + b;
        return ((a ^ r) & (b ^ r)) < 0 ? Long.MAX_VALUE : r;
    }
}
