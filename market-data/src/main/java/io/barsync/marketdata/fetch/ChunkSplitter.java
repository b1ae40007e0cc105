package io.barsync.marketdata.fetch;

import io.barsync.marketdata.model.CoverageRange;
import io.barsync.marketdata.model.SamplingInterval;
import io.barsync.marketdata.model.SeriesKey;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits missing ranges into request-sized chunks, oldest first.
 */
public final class ChunkSplitter {
    private ChunkSplitter() {}

    public static List<Chunk> split(SeriesKey key, List<CoverageRange> ranges) {
        SamplingInterval interval = key.interval();
        return split(key, ranges, interval.maxSpanSeconds());
    }

    static List<Chunk> split(SeriesKey key, List<CoverageRange> ranges, long maxSpanSeconds) {
        long unit = key.interval().unitSeconds();
        long span = Math.max(unit, maxSpanSeconds);
        List<CoverageRange> sorted = new ArrayList<>(ranges);
        sorted.sort(null);
        List<Chunk> out = new ArrayList<>();
        for (CoverageRange r : sorted) {
            long s = r.start();
            while (s <= r.end()) {
                long e = Math.min(r.end(), s + span - unit);
                out.add(new Chunk(key, out.size(), new CoverageRange(s, e)));
                if (e >= r.end()) break;
                s = e + unit;
            }
        }
        return out;
    }
}
