package io.barsync.marketdata.model;

/**
 * Upstream row before validation; any field may be missing.
 */
public record RawBar(Long timestamp, Double open, Double high, Double low, Double close, Long volume, Long openInterest) {

    public static RawBar of(long ts, double open, double high, double low, double close, long volume) {
        return new RawBar(ts, open, high, low, close, volume, null);
    }

    public static RawBar of(long ts, double open, double high, double low, double close, long volume, long oi) {
        return new RawBar(ts, open, high, low, close, volume, oi);
    }
}
