package io.barsync.marketdata.fetch;

import io.barsync.marketdata.model.CoverageRange;
import io.barsync.marketdata.model.SeriesKey;

/** One upstream request: a span no longer than the interval's maximum. */
public record Chunk(SeriesKey key, int index, CoverageRange range) {
    public long start() { return range.start(); }
    public long end() { return range.end(); }

    @Override
    public String toString() { return key + "#" + index + range; }
}
