package io.barsync.marketdata.fetch;

import io.barsync.marketdata.model.CoverageRange;
import io.barsync.marketdata.model.Exchange;
import io.barsync.marketdata.model.SamplingInterval;
import io.barsync.marketdata.model.SeriesKey;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.barsync.marketdata.BarFixtures.day;
import static io.barsync.marketdata.BarFixtures.days;
import static org.junit.jupiter.api.Assertions.*;

public class ChunkSplitterTest {
    private static final SeriesKey DAILY = SeriesKey.of(Exchange.NSE, "INFY", SamplingInterval.DAY);
    private static final SeriesKey MINUTE = SeriesKey.of(Exchange.NSE, "INFY", SamplingInterval.MINUTE);

    @Test
    void short_range_is_one_chunk() {
        List<Chunk> chunks = ChunkSplitter.split(DAILY, List.of(days("2024-01-01", "2024-01-31")));
        assertEquals(1, chunks.size());
        assertEquals(days("2024-01-01", "2024-01-31"), chunks.get(0).range());
    }

    @Test
    void long_range_splits_into_adjacent_chunks_of_max_span() {
        List<Chunk> chunks = ChunkSplitter.split(DAILY, List.of(days("2024-01-01", "2024-01-10")), 4 * 86_400L);
        assertEquals(List.of(days("2024-01-01", "2024-01-04"), days("2024-01-05", "2024-01-08"), days("2024-01-09", "2024-01-10")),
                chunks.stream().map(Chunk::range).toList());
        assertEquals(List.of(0, 1, 2), chunks.stream().map(Chunk::index).toList());
    }

    @Test
    void minute_ranges_use_sixty_day_chunks() {
        long start = day("2024-01-01");
        long end = day("2024-04-01");
        List<Chunk> chunks = ChunkSplitter.split(MINUTE, List.of(new CoverageRange(start, end)));
        assertEquals(2, chunks.size());
        assertEquals(start + 60 * 86_400L - 60, chunks.get(0).end());
        assertEquals(chunks.get(0).end() + 60, chunks.get(1).start());
        assertEquals(end, chunks.get(1).end());
    }

    @Test
    void ranges_are_processed_oldest_first() {
        List<Chunk> chunks = ChunkSplitter.split(DAILY, List.of(days("2024-03-01", "2024-03-02"), days("2024-01-01", "2024-01-02")));
        assertEquals(day("2024-01-01"), chunks.get(0).start());
        assertEquals(day("2024-03-01"), chunks.get(1).start());
    }

    @Test
    void single_unit_range_is_kept() {
        List<Chunk> chunks = ChunkSplitter.split(DAILY, List.of(days("2024-01-05", "2024-01-05")));
        assertEquals(1, chunks.size());
        assertEquals(chunks.get(0).start(), chunks.get(0).end());
    }
}
