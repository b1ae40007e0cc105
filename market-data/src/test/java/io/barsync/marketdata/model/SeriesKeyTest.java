package io.barsync.marketdata.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SeriesKeyTest {

    @Test
    void symbol_is_normalized_like_storage_paths() {
        SeriesKey key = SeriesKey.of(Exchange.NSE, " m&m-fin ", SamplingInterval.DAY);
        assertEquals("M_M_FIN", key.symbol());
        assertEquals("/data/NSE/M_M_FIN/day", key.path());
        assertEquals(key, SeriesKey.parsePath(key.path()));
    }

    @Test
    void exchange_must_belong_to_segment() {
        assertThrows(IllegalArgumentException.class,
                () -> new SeriesKey(MarketSegment.EQUITY, Exchange.NFO, "NIFTY24JANFUT", SamplingInterval.DAY));
        assertEquals(MarketSegment.COMMODITY, SeriesKey.of("mcx", "GOLD", "15minute").segment());
    }

    @Test
    void unknown_interval_and_exchange_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> SeriesKey.of("NSE", "INFY", "2minute"));
        assertThrows(IllegalArgumentException.class, () -> SeriesKey.of("LSE", "INFY", "day"));
    }

    @Test
    void interval_limits_follow_upstream_spans() {
        assertEquals(60 * 86_400L, SamplingInterval.MINUTE.maxSpanSeconds());
        assertEquals(2_000 * 86_400L, SamplingInterval.DAY.maxSpanSeconds());
        assertEquals(SamplingInterval.MINUTE_5, SamplingInterval.fromCode("5minute"));
    }
}
